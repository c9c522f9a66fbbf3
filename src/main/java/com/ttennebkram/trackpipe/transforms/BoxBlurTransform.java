package com.ttennebkram.trackpipe.transforms;

import com.ttennebkram.trackpipe.model.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Normalized box filter.
 */
public class BoxBlurTransform extends MatTransform {

    private static final List<ParameterSpec> PARAMS = List.of(
        ParameterSpec.of("ksize", 1, 99, 5)
    );

    public BoxBlurTransform() {
        super(PARAMS);
    }

    @Override
    public String getDescription() {
        return "Box Blur\nImgproc.blur(src, dst, ksize)";
    }

    @Override
    protected Mat draw(Mat input) {
        if (isInvalidInput(input)) {
            return input;
        }
        int ksize = value("ksize");
        Mat output = new Mat();
        Imgproc.blur(input, output, new Size(ksize, ksize));
        return output;
    }
}
