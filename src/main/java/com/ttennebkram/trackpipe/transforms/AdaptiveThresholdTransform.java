package com.ttennebkram.trackpipe.transforms;

import com.ttennebkram.trackpipe.model.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Adaptive threshold.
 * "method" 0 = mean of the block, 1 = Gaussian-weighted sum.
 */
public class AdaptiveThresholdTransform extends MatTransform {

    private static final List<ParameterSpec> PARAMS = List.of(
        ParameterSpec.of("blockSize", 3, 99, 11).withAdjust(ParameterSpec.ODD_UP),
        ParameterSpec.of("C", 0, 50, 2),
        ParameterSpec.of("method", 0, 1, 0),
        ParameterSpec.of("inverted", 0, 1, 0)
    );

    public AdaptiveThresholdTransform() {
        super(PARAMS);
    }

    @Override
    public String getDescription() {
        return "Adaptive Threshold\nImgproc.adaptiveThreshold(src, dst, maxValue, adaptiveMethod, thresholdType, blockSize, C)";
    }

    @Override
    protected Mat draw(Mat input) {
        if (isInvalidInput(input)) {
            return input;
        }
        int method = value("method") == 0 ? Imgproc.ADAPTIVE_THRESH_MEAN_C : Imgproc.ADAPTIVE_THRESH_GAUSSIAN_C;
        int type = value("inverted") == 0 ? Imgproc.THRESH_BINARY : Imgproc.THRESH_BINARY_INV;

        Mat gray = toGray(input);
        Mat output = new Mat();
        Imgproc.adaptiveThreshold(gray, output, 255, method, type, value("blockSize"), value("C"));
        gray.release();
        return output;
    }
}
