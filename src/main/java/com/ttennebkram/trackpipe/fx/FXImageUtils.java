package com.ttennebkram.trackpipe.fx;

import javafx.scene.image.Image;
import javafx.scene.image.PixelFormat;
import javafx.scene.image.PixelWriter;
import javafx.scene.image.WritableImage;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.nio.ByteBuffer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility methods for converting OpenCV Mats to JavaFX Images.
 */
public class FXImageUtils {

    private static final Logger LOG = Logger.getLogger(FXImageUtils.class.getName());

    private FXImageUtils() {
    }

    /**
     * Convert an 8-bit OpenCV Mat (gray, BGR or BGRA) to a JavaFX Image.
     * Uses WritableImage and PixelWriter directly, no AWT/Swing.
     *
     * @param mat The OpenCV Mat to convert
     * @return A JavaFX Image, or null if the Mat is empty or has an unsupported format
     */
    public static Image matToImage(Mat mat) {
        if (mat == null || mat.empty()) {
            return null;
        }
        if (mat.depth() != CvType.CV_8U) {
            LOG.warning("Cannot display Mat of type " + CvType.typeToString(mat.type()) + ", expected 8-bit");
            return null;
        }

        int width = mat.width();
        int height = mat.height();
        int channels = mat.channels();

        Mat pixels;
        PixelFormat<ByteBuffer> format;
        if (channels == 4) {
            // BGRA byte order is what JavaFX expects already
            pixels = mat.isContinuous() ? mat : mat.clone();
            format = PixelFormat.getByteBgraInstance();
        } else if (channels == 3 || channels == 1) {
            pixels = new Mat();
            Imgproc.cvtColor(mat, pixels, channels == 3 ? Imgproc.COLOR_BGR2RGB : Imgproc.COLOR_GRAY2RGB);
            format = PixelFormat.getByteRgbInstance();
        } else {
            LOG.warning("Cannot display Mat with " + channels + " channels");
            return null;
        }

        try {
            int stride = pixels.channels() * width;
            byte[] buffer = new byte[stride * height];
            pixels.get(0, 0, buffer);

            WritableImage image = new WritableImage(width, height);
            PixelWriter pw = image.getPixelWriter();
            pw.setPixels(0, 0, width, height, format, buffer, 0, stride);
            return image;
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Mat to Image conversion failed", e);
            return null;
        } finally {
            if (pixels != mat) {
                pixels.release();
            }
        }
    }
}
