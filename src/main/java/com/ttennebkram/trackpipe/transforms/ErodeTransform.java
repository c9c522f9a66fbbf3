package com.ttennebkram.trackpipe.transforms;

import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.imgproc.Imgproc;

public class ErodeTransform extends MorphologyTransform {

    @Override
    public String getDescription() {
        return "Erode\nImgproc.erode(src, dst, kernel, anchor, iterations)";
    }

    @Override
    protected void apply(Mat input, Mat output, Mat kernel, int iterations) {
        Imgproc.erode(input, output, kernel, new Point(-1, -1), iterations);
    }
}
