package com.ttennebkram.trackpipe.processing;

import com.ttennebkram.trackpipe.config.TrackpipeConfig;
import com.ttennebkram.trackpipe.model.ImageOps;
import com.ttennebkram.trackpipe.model.Parameter;
import com.ttennebkram.trackpipe.model.PipelineItem;
import com.ttennebkram.trackpipe.model.Transform;
import com.ttennebkram.trackpipe.model.Window;
import com.ttennebkram.trackpipe.model.WindowNamer;
import com.ttennebkram.trackpipe.ui.ControlSource;
import com.ttennebkram.trackpipe.ui.DisplaySurface;
import com.ttennebkram.trackpipe.ui.EventSource;
import com.ttennebkram.trackpipe.ui.TrackbarUi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * Runs a pipeline of windows as a polling loop and re-renders only what a
 * slider change affects.
 *
 * Lifecycle: {@link State#INITIALIZING} (constructed and validated) to
 * {@link State#RUNNING} after {@link #initialize} to {@link State#TERMINATED}.
 * Each {@link #tick} polls for the cancel key and window visibility,
 * synchronizes all windows, and renders from the first dirty window to the
 * last. Windows before it keep their cached output.
 *
 * Single-threaded: all calls must come from the same thread.
 *
 * @param <I> image buffer type
 */
public class PipelineEngine<I> {

    private static final Logger LOG = Logger.getLogger(PipelineEngine.class.getName());

    public enum State {
        INITIALIZING,
        RUNNING,
        TERMINATED
    }

    private final List<Window<I>> windows;
    private final ImageOps<I> imageOps;
    private final ControlSource controls;
    private final DisplaySurface<I> display;
    private final EventSource events;
    private final TrackpipeConfig config;

    private State state = State.INITIALIZING;
    private I original;

    public PipelineEngine(List<? extends PipelineItem<I>> items, ImageOps<I> imageOps,
                          TrackbarUi<I> ui, TrackpipeConfig config) {
        this(items, imageOps, ui, ui, ui, config, WindowNamer.shared());
    }

    /**
     * Assemble and validate the pipeline.
     *
     * @throws PipelineConfigurationException if {@code items} cannot be run
     */
    public PipelineEngine(List<? extends PipelineItem<I>> items, ImageOps<I> imageOps,
                          ControlSource controls, DisplaySurface<I> display, EventSource events,
                          TrackpipeConfig config, WindowNamer namer) {
        this.windows = new ArrayList<>(PipelineAssembler.assemble(items, namer));
        this.imageOps = imageOps;
        this.controls = controls;
        this.display = display;
        this.events = events;
        this.config = config;
    }

    /**
     * Initialize, then tick until the user cancels or closes every window.
     * Surfaces are destroyed however the loop ends, including a failed
     * initialization.
     *
     * @param input source image, or null if the first transform loads its own
     */
    public void run(I input) {
        try {
            initialize(input);
            while (tick()) {
                // keep polling
            }
        } finally {
            terminate();
        }
    }

    /**
     * Create a surface per window and a slider per parameter, then render
     * every window once so each has a cached output.
     */
    public void initialize(I input) {
        if (state != State.INITIALIZING) {
            throw new IllegalStateException("Engine already initialized (state " + state + ")");
        }
        this.original = input;

        for (Window<I> window : windows) {
            display.createSurface(window.getName(), config.toSurfaceOptions());
            for (Transform<I> transform : window.getTransforms()) {
                for (Parameter p : transform.getParameters().values()) {
                    controls.createControl(p.getLabel(), window.getName(), p.getObservedPosition(), p.getMax());
                }
            }
        }

        I result = imageOps.copy(original);
        for (Window<I> window : windows) {
            result = window.render(result, imageOps, display);
        }
        state = State.RUNNING;
        LOG.info("Pipeline running with " + windows.size() + " window(s)");
    }

    /**
     * One iteration of the loop.
     *
     * @return false once the engine has terminated
     */
    public boolean tick() {
        if (state != State.RUNNING) {
            throw new IllegalStateException("Engine is not running (state " + state + ")");
        }

        if (events.pollCancelKey(config.getPollTimeoutMs())) {
            LOG.info("Cancel key pressed, stopping");
            terminate();
            return false;
        }
        if (!anySurfaceVisible()) {
            LOG.info("All windows closed, stopping");
            terminate();
            return false;
        }

        // Every window is synchronized, even after the first dirty one
        int offset = -1;
        for (int i = 0; i < windows.size(); i++) {
            OptionalInt dirty = windows.get(i).firstDirtyIndex(controls);
            if (offset < 0 && dirty.isPresent()) {
                offset = i;
            }
        }
        if (offset < 0) {
            return true;
        }

        renderFrom(offset);
        return true;
    }

    private boolean anySurfaceVisible() {
        for (Window<I> window : windows) {
            if (display.isVisible(window.getName())) {
                return true;
            }
        }
        return false;
    }

    private void renderFrom(int offset) {
        LOG.fine(() -> "Re-rendering from window '" + windows.get(offset).getName() + "' (" + offset + ")");
        I result = offset == 0 ? imageOps.copy(original) : windows.get(offset - 1).getLastOutput();
        for (int i = offset; i < windows.size(); i++) {
            result = windows.get(i).render(result, imageOps, display);
        }
    }

    /**
     * Close all surfaces. Safe to call more than once.
     */
    public void terminate() {
        if (state == State.TERMINATED) {
            return;
        }
        state = State.TERMINATED;
        display.destroyAllSurfaces();
    }

    public State getState() {
        return state;
    }

    public List<Window<I>> getWindows() {
        return Collections.unmodifiableList(windows);
    }
}
