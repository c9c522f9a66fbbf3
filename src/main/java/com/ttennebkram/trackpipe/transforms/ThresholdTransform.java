package com.ttennebkram.trackpipe.transforms;

import com.ttennebkram.trackpipe.model.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Fixed-level threshold on the gray image.
 * The "type" slider selects binary, binary inverted, truncate, to zero, to zero inverted.
 */
public class ThresholdTransform extends MatTransform {

    private static final int[] TYPE_VALUES = {
        Imgproc.THRESH_BINARY,
        Imgproc.THRESH_BINARY_INV,
        Imgproc.THRESH_TRUNC,
        Imgproc.THRESH_TOZERO,
        Imgproc.THRESH_TOZERO_INV
    };

    private static final List<ParameterSpec> PARAMS = List.of(
        ParameterSpec.of("thresh", 0, 255, 127),
        ParameterSpec.of("maxval", 0, 255, 255),
        ParameterSpec.of("type", 0, TYPE_VALUES.length - 1, 0)
    );

    public ThresholdTransform() {
        super(PARAMS);
    }

    @Override
    public String getDescription() {
        return "Binary Threshold\nImgproc.threshold(src, dst, thresh, maxval, type)";
    }

    @Override
    protected Mat draw(Mat input) {
        if (isInvalidInput(input)) {
            return input;
        }
        Mat gray = toGray(input);
        Mat output = new Mat();
        int type = TYPE_VALUES[Math.min(value("type"), TYPE_VALUES.length - 1)];
        Imgproc.threshold(gray, output, value("thresh"), value("maxval"), type);
        gray.release();
        return output;
    }
}
