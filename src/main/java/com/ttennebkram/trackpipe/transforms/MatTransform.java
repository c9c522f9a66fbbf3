package com.ttennebkram.trackpipe.transforms;

import com.ttennebkram.trackpipe.model.ParameterSpec;
import com.ttennebkram.trackpipe.model.Transform;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Base class for OpenCV transforms.
 * Provides common input checks and color helpers.
 */
public abstract class MatTransform extends Transform<Mat> {

    protected MatTransform() {
        super();
    }

    protected MatTransform(List<ParameterSpec> specs) {
        super(specs);
    }

    /**
     * Description shown by the transform listing.
     * Should include the OpenCV function used.
     */
    public abstract String getDescription();

    /**
     * Standard null/empty check for input validation.
     */
    protected boolean isInvalidInput(Mat input) {
        return input == null || input.empty();
    }

    /**
     * Single-channel copy of {@code input}.
     */
    protected Mat toGray(Mat input) {
        Mat gray = new Mat();
        if (input.channels() == 3) {
            Imgproc.cvtColor(input, gray, Imgproc.COLOR_BGR2GRAY);
        } else if (input.channels() == 4) {
            Imgproc.cvtColor(input, gray, Imgproc.COLOR_BGRA2GRAY);
        } else {
            gray = input.clone();
        }
        return gray;
    }
}
