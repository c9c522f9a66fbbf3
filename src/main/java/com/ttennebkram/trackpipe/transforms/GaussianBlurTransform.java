package com.ttennebkram.trackpipe.transforms;

import com.ttennebkram.trackpipe.model.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Gaussian blur.
 * The kernel slider snaps to odd sizes; sigma is in tenths (0 = derived from the kernel).
 */
public class GaussianBlurTransform extends MatTransform {

    private static final List<ParameterSpec> PARAMS = List.of(
        ParameterSpec.of("ksize", 1, 99, 15).withAdjust(ParameterSpec.ODD_UP),
        ParameterSpec.of("sigma x10", 0, 100, 0)
    );

    public GaussianBlurTransform() {
        super(PARAMS);
    }

    @Override
    public String getDescription() {
        return "Gaussian Blur\nImgproc.GaussianBlur(src, dst, ksize, sigmaX)";
    }

    @Override
    protected Mat draw(Mat input) {
        if (isInvalidInput(input)) {
            return input;
        }
        int ksize = value("ksize");
        Mat output = new Mat();
        Imgproc.GaussianBlur(input, output, new Size(ksize, ksize), value("sigma x10") / 10.0);
        return output;
    }
}
