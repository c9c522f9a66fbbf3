package com.ttennebkram.trackpipe.transforms;

import com.ttennebkram.trackpipe.model.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Canny edge detector. Output is a single-channel edge map.
 * The aperture slider snaps to the Sobel sizes 3, 5 and 7.
 */
public class CannyEdgeTransform extends MatTransform {

    private static final List<ParameterSpec> PARAMS = List.of(
        ParameterSpec.of("threshold1", 0, 500, 30),
        ParameterSpec.of("threshold2", 0, 500, 150),
        ParameterSpec.of("aperture", 3, 7, 3).withAdjust(ParameterSpec.ODD_UP)
    );

    public CannyEdgeTransform() {
        super(PARAMS);
    }

    @Override
    public String getDescription() {
        return "Canny Edge Detection\nImgproc.Canny(src, dst, threshold1, threshold2, apertureSize)";
    }

    @Override
    protected Mat draw(Mat input) {
        if (isInvalidInput(input)) {
            return input;
        }
        Mat gray = toGray(input);
        Mat edges = new Mat();
        Imgproc.Canny(gray, edges, value("threshold1"), value("threshold2"), value("aperture"), false);
        gray.release();
        return edges;
    }
}
