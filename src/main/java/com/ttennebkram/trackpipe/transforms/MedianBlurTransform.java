package com.ttennebkram.trackpipe.transforms;

import com.ttennebkram.trackpipe.model.Parameter;
import com.ttennebkram.trackpipe.model.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Median blur - effective for salt-and-pepper noise removal.
 */
public class MedianBlurTransform extends MatTransform {

    private static final List<ParameterSpec> PARAMS = List.of(
        ParameterSpec.of("ksize", 1, 99, 5)
    );

    public MedianBlurTransform() {
        super(PARAMS);
    }

    @Override
    public String getDescription() {
        return "Median Blur\nImgproc.medianBlur(src, dst, ksize)";
    }

    @Override
    protected void computeValues() {
        // Kernel size must be positive odd number
        Parameter ksize = param("ksize");
        if (ksize.getValue() % 2 == 0) {
            ksize.setValue(ksize.getValue() + 1);
        }
    }

    @Override
    protected Mat draw(Mat input) {
        if (isInvalidInput(input)) {
            return input;
        }
        Mat output = new Mat();
        Imgproc.medianBlur(input, output, value("ksize"));
        return output;
    }
}
