package com.ttennebkram.trackpipe.transforms;

import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

/**
 * Loads its image from a file, for pipelines started without an input image.
 * The file is read on the first render and reused afterwards.
 */
public class FileSourceTransform extends MatTransform {

    private final String imagePath;
    private Mat loaded;

    public FileSourceTransform(String imagePath) {
        if (imagePath == null || imagePath.isBlank()) {
            throw new IllegalArgumentException("FileSource needs an image path");
        }
        this.imagePath = imagePath;
    }

    @Override
    public String getDescription() {
        return "File Source\nImgcodecs.imread(path)";
    }

    @Override
    protected Mat draw(Mat input) {
        if (loaded == null) {
            Mat image = Imgcodecs.imread(imagePath);
            if (image.empty()) {
                throw new IllegalStateException("Cannot read image file: " + imagePath);
            }
            loaded = image;
        }
        return loaded.clone();
    }

    public String getImagePath() {
        return imagePath;
    }
}
