package com.ttennebkram.trackpipe.transforms;

import com.ttennebkram.trackpipe.model.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Shared parameters and kernel handling for dilate and erode.
 */
public abstract class MorphologyTransform extends MatTransform {

    private static final List<ParameterSpec> PARAMS = List.of(
        ParameterSpec.of("ksize", 1, 31, 3),
        ParameterSpec.of("iterations", 1, 10, 1)
    );

    protected MorphologyTransform() {
        super(PARAMS);
    }

    @Override
    protected Mat draw(Mat input) {
        if (isInvalidInput(input)) {
            return input;
        }
        int ksize = value("ksize");
        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(ksize, ksize));
        Mat output = new Mat();
        apply(input, output, kernel, value("iterations"));
        kernel.release();
        return output;
    }

    protected abstract void apply(Mat input, Mat output, Mat kernel, int iterations);
}
