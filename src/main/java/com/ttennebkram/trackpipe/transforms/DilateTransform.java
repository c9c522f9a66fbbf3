package com.ttennebkram.trackpipe.transforms;

import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.imgproc.Imgproc;

public class DilateTransform extends MorphologyTransform {

    @Override
    public String getDescription() {
        return "Dilate\nImgproc.dilate(src, dst, kernel, anchor, iterations)";
    }

    @Override
    protected void apply(Mat input, Mat output, Mat kernel, int iterations) {
        Imgproc.dilate(input, output, kernel, new Point(-1, -1), iterations);
    }
}
