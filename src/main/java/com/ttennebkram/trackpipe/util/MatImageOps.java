package com.ttennebkram.trackpipe.util;

import com.ttennebkram.trackpipe.model.ImageOps;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * {@link ImageOps} for OpenCV Mats.
 */
public class MatImageOps implements ImageOps<Mat> {

    @Override
    public Mat copy(Mat image) {
        return image == null ? null : image.clone();
    }

    /**
     * Saturate any non-8-bit Mat to {@code CV_8U}, keeping the channel count.
     */
    @Override
    public Mat toDisplayable(Mat image) {
        if (image == null || image.empty() || image.depth() == CvType.CV_8U) {
            return image;
        }
        Mat converted = new Mat();
        image.convertTo(converted, CvType.CV_8U);
        return converted;
    }
}
