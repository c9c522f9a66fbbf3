package com.ttennebkram.trackpipe.fx;

import com.ttennebkram.trackpipe.ui.SurfaceOptions;
import com.ttennebkram.trackpipe.ui.TrackbarUi;
import javafx.application.Platform;
import javafx.geometry.Insets;
import javafx.scene.Scene;
import javafx.scene.control.Label;
import javafx.scene.control.Slider;
import javafx.scene.control.TitledPane;
import javafx.scene.image.Image;
import javafx.scene.image.ImageView;
import javafx.scene.input.KeyCode;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.Region;
import javafx.scene.layout.VBox;
import javafx.stage.Stage;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * JavaFX windows with an image view and integer sliders, one Stage per
 * pipeline window.
 *
 * The engine runs on its own thread. Slider positions, visibility and key
 * presses are recorded by JavaFX listeners into thread-safe state that the
 * engine reads; window changes are handed to the JavaFX Application Thread.
 */
public class FXTrackbarUi implements TrackbarUi<Mat> {

    private static final Logger LOG = Logger.getLogger(FXTrackbarUi.class.getName());

    private final KeyCode cancelKey;
    private final Map<String, SurfaceStage> surfaces = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> positions = new ConcurrentHashMap<>();
    private final BlockingQueue<KeyCode> keyPresses = new LinkedBlockingQueue<>();

    /**
     * Controls of one window.
     */
    private static class SurfaceStage {
        final Stage stage;
        final ImageView view;
        final VBox controls;
        final int maxImageWidth;
        volatile boolean visible = true;
        boolean sized;

        SurfaceStage(Stage stage, ImageView view, VBox controls, int maxImageWidth) {
            this.stage = stage;
            this.view = view;
            this.controls = controls;
            this.maxImageWidth = maxImageWidth;
        }
    }

    /**
     * @param cancelKeyName JavaFX {@link KeyCode} name of the key that stops the pipeline
     * @throws IllegalArgumentException if the key name is unknown
     */
    public FXTrackbarUi(String cancelKeyName) {
        this.cancelKey = KeyCode.valueOf(cancelKeyName);
        startToolkit();
    }

    /**
     * Start the JavaFX runtime if nobody has yet. Windows stay under our
     * control, so closing the last one does not end the toolkit.
     */
    private static void startToolkit() {
        try {
            Platform.startup(() -> { });
        } catch (IllegalStateException e) {
            LOG.fine("JavaFX toolkit already running");
        }
        Platform.setImplicitExit(false);
    }

    /**
     * Stop the JavaFX runtime. Call once, after the engine terminated.
     */
    public static void shutdownToolkit() {
        Platform.exit();
    }

    @Override
    public void createSurface(String name, SurfaceOptions options) {
        runAndWait(() -> {
            ImageView view = new ImageView();
            view.setPreserveRatio(options.isKeepRatio());
            view.setSmooth(true);

            VBox controls = new VBox(6);
            controls.setPadding(new Insets(8));

            Region bottom = controls;
            if (!options.isExpandedControls()) {
                TitledPane pane = new TitledPane("Parameters", controls);
                pane.setExpanded(false);
                bottom = pane;
            }
            BorderPane root = new BorderPane();
            root.setCenter(view);
            root.setBottom(bottom);

            Scene scene = new Scene(root);
            scene.setOnKeyPressed(e -> keyPresses.offer(e.getCode()));

            Stage stage = new Stage();
            stage.setTitle(name);
            stage.setScene(scene);
            stage.setResizable(options.isResizable());

            if (options.isResizable()) {
                view.fitWidthProperty().bind(scene.widthProperty());
                if (!options.isKeepRatio()) {
                    view.fitHeightProperty().bind(scene.heightProperty().subtract(bottom.heightProperty()));
                }
            } else if (options.getMaxImageWidth() > 0) {
                view.setFitWidth(options.getMaxImageWidth());
            }

            SurfaceStage surface = new SurfaceStage(stage, view, controls, options.getMaxImageWidth());
            stage.setOnHidden(e -> surface.visible = false);
            surfaces.put(name, surface);
            stage.show();
        });
    }

    @Override
    public void createControl(String label, String windowName, int initialPosition, int maxValue) {
        SurfaceStage surface = surface(windowName);
        AtomicInteger position = new AtomicInteger(initialPosition);
        positions.put(key(label, windowName), position);

        runAndWait(() -> {
            HBox row = new HBox(10);
            Label nameLabel = new Label(label);
            nameLabel.setMinWidth(90);

            Slider slider = new Slider(0, maxValue, initialPosition);
            slider.setBlockIncrement(1);
            slider.setShowTickMarks(true);
            slider.setShowTickLabels(true);
            slider.setMajorTickUnit(tickUnit(maxValue));
            slider.setMinorTickCount(0);
            HBox.setHgrow(slider, Priority.ALWAYS);

            Label valueLabel = new Label(String.valueOf(initialPosition));
            valueLabel.setMinWidth(40);

            slider.valueProperty().addListener((obs, oldVal, newVal) -> {
                int pos = (int) Math.round(newVal.doubleValue());
                position.set(pos);
                valueLabel.setText(String.valueOf(pos));
            });

            row.getChildren().addAll(nameLabel, slider, valueLabel);
            surface.controls.getChildren().add(row);
            surface.stage.sizeToScene();
        });
    }

    /**
     * Tick spacing based on range, the same steps the properties dialogs use.
     */
    private static double tickUnit(int range) {
        if (range <= 10) {
            return 1;
        } else if (range <= 50) {
            return 10;
        } else if (range <= 100) {
            return 25;
        } else if (range <= 255) {
            return 50;
        }
        return range / 4.0;
    }

    @Override
    public int getControlPosition(String label, String windowName) {
        AtomicInteger position = positions.get(key(label, windowName));
        if (position == null) {
            throw new IllegalArgumentException("No control '" + label + "' on window '" + windowName + "'");
        }
        return position.get();
    }

    @Override
    public void show(String name, Mat image) {
        SurfaceStage surface = surface(name);
        Image fxImage = FXImageUtils.matToImage(image);
        if (fxImage == null) {
            return;
        }
        Platform.runLater(() -> {
            surface.view.setImage(fxImage);
            if (!surface.sized) {
                surface.sized = true;
                double width = fxImage.getWidth();
                if (surface.maxImageWidth > 0) {
                    width = Math.min(width, surface.maxImageWidth);
                }
                surface.stage.setWidth(width);
                surface.stage.sizeToScene();
            }
        });
    }

    @Override
    public boolean isVisible(String name) {
        SurfaceStage surface = surfaces.get(name);
        return surface != null && surface.visible;
    }

    @Override
    public boolean pollCancelKey(long timeoutMs) {
        try {
            KeyCode code = keyPresses.poll(timeoutMs, TimeUnit.MILLISECONDS);
            return code == cancelKey;
        } catch (InterruptedException e) {
            // Treat interruption as a request to stop
            Thread.currentThread().interrupt();
            return true;
        }
    }

    @Override
    public void destroyAllSurfaces() {
        List<SurfaceStage> open = new ArrayList<>(surfaces.values());
        surfaces.clear();
        positions.clear();
        runAndWait(() -> {
            for (SurfaceStage surface : open) {
                surface.stage.close();
            }
        });
    }

    private SurfaceStage surface(String name) {
        SurfaceStage surface = surfaces.get(name);
        if (surface == null) {
            throw new IllegalArgumentException("No window named '" + name + "'");
        }
        return surface;
    }

    private static String key(String label, String windowName) {
        return windowName + '\u0000' + label;
    }

    /**
     * Run {@code action} on the JavaFX Application Thread and wait for it.
     * Runtime exceptions from the action are rethrown on the caller.
     */
    private static void runAndWait(Runnable action) {
        if (Platform.isFxApplicationThread()) {
            action.run();
            return;
        }
        FutureTask<Void> task = new FutureTask<>(action, null);
        Platform.runLater(task);
        try {
            task.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for JavaFX", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("JavaFX call failed", e.getCause());
        }
    }
}
