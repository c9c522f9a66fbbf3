package com.ttennebkram.trackpipe.transforms;

import org.opencv.core.Mat;

/**
 * Converts color images to a single gray channel.
 */
public class GrayscaleTransform extends MatTransform {

    @Override
    public String getDescription() {
        return "Grayscale\nImgproc.cvtColor(src, dst, COLOR_BGR2GRAY)";
    }

    @Override
    protected Mat draw(Mat input) {
        if (isInvalidInput(input)) {
            return input;
        }
        return toGray(input);
    }
}
