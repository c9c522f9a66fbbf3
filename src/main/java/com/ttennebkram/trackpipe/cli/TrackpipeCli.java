package com.ttennebkram.trackpipe.cli;

import com.google.gson.JsonObject;
import com.ttennebkram.trackpipe.config.PipelineDefinitionLoader;
import com.ttennebkram.trackpipe.config.TrackpipeConfig;
import com.ttennebkram.trackpipe.fx.FXTrackbarUi;
import com.ttennebkram.trackpipe.model.Parameter;
import com.ttennebkram.trackpipe.model.PipelineItem;
import com.ttennebkram.trackpipe.model.Window;
import com.ttennebkram.trackpipe.processing.PipelineConfigurationException;
import com.ttennebkram.trackpipe.processing.PipelineEngine;
import com.ttennebkram.trackpipe.transforms.CannyEdgeTransform;
import com.ttennebkram.trackpipe.transforms.GaussianBlurTransform;
import com.ttennebkram.trackpipe.transforms.GrayscaleTransform;
import com.ttennebkram.trackpipe.transforms.MatTransform;
import com.ttennebkram.trackpipe.transforms.TransformRegistry;
import com.ttennebkram.trackpipe.util.MatImageOps;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry: tune an image pipeline with sliders.
 */
@Command(
    name = "trackpipe",
    mixinStandardHelpOptions = true,
    description = "Tune a pipeline of OpenCV transforms with sliders, re-rendering only the windows a change affects."
)
public class TrackpipeCli implements Callable<Integer> {

    // Strong reference: JUL keeps loggers weakly and would drop the level
    static final Logger PACKAGE_LOGGER = Logger.getLogger("com.ttennebkram.trackpipe");

    @Option(names = "--image", description = "Input image (omit if the first transform loads its own, e.g. FileSource)")
    private Path image;

    @Option(names = "--pipeline", description = "Pipeline declaration JSON (default: Grayscale+GaussianBlur, then CannyEdge)")
    private Path pipeline;

    @Option(names = "--config", description = "Settings JSON overriding the bundled defaults")
    private Path config;

    @Option(names = "--verbose", description = "Log re-render decisions")
    private boolean verbose;

    @Option(names = "--list", description = "List the available transform types and their parameters")
    private boolean list;

    @Override
    public Integer call() {
        if (verbose) {
            PACKAGE_LOGGER.setLevel(Level.FINE);
        }
        if (list) {
            printTransforms(System.out);
            return 0;
        }
        if (image == null && pipeline == null) {
            System.err.println("Error: the demo pipeline needs --image");
            return 1;
        }

        FXTrackbarUi ui = null;
        try {
            TrackpipeConfig settings = config != null ? TrackpipeConfig.load(config) : TrackpipeConfig.defaults();
            List<PipelineItem<Mat>> items = pipeline != null
                ? new PipelineDefinitionLoader().load(pipeline)
                : demoPipeline();
            Mat input = image != null ? readImage(image) : null;

            ui = new FXTrackbarUi(settings.getCancelKey());
            PipelineEngine<Mat> engine = new PipelineEngine<>(items, new MatImageOps(), ui, settings);
            engine.run(input);
            return 0;
        } catch (IOException | PipelineConfigurationException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        } finally {
            if (ui != null) {
                FXTrackbarUi.shutdownToolkit();
            }
        }
    }

    static List<PipelineItem<Mat>> demoPipeline() {
        return List.of(
            new Window<Mat>(List.of(new GrayscaleTransform(), new GaussianBlurTransform()), "Blur"),
            new Window<Mat>(List.of(new CannyEdgeTransform()), "Edges"));
    }

    private static Mat readImage(Path path) throws IOException {
        Mat mat = Imgcodecs.imread(path.toString());
        if (mat.empty()) {
            throw new IOException("Cannot read image file: " + path);
        }
        return mat;
    }

    static void printTransforms(PrintStream out) {
        JsonObject options = new JsonObject();
        options.addProperty("path", "<file>");
        for (String type : TransformRegistry.getTypes()) {
            MatTransform transform = TransformRegistry.create(type, options);
            out.println(type + " - " + transform.getDescription().replace('\n', ' '));
            for (Parameter p : transform.getParameters().values()) {
                out.println("    " + p.getLabel() + " [" + p.getMin() + ".." + p.getMax()
                    + ", default " + p.getDefaultValue() + "]");
            }
        }
    }
}
