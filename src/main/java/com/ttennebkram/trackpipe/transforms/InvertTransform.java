package com.ttennebkram.trackpipe.transforms;

import org.opencv.core.Core;
import org.opencv.core.Mat;

/**
 * Inverts every pixel.
 */
public class InvertTransform extends MatTransform {

    @Override
    public String getDescription() {
        return "Invert\nCore.bitwise_not(src, dst)";
    }

    @Override
    protected Mat draw(Mat input) {
        if (isInvalidInput(input)) {
            return input;
        }
        Mat output = new Mat();
        Core.bitwise_not(input, output);
        return output;
    }
}
