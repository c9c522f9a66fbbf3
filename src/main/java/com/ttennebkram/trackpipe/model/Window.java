package com.ttennebkram.trackpipe.model;

import com.ttennebkram.trackpipe.ui.ControlSource;
import com.ttennebkram.trackpipe.ui.DisplaySurface;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An ordered group of Transforms sharing one display surface.
 * The output of the last transform is cached and feeds the next window.
 *
 * @param <I> image buffer type
 */
public class Window<I> extends PipelineItem<I> {

    private static final Logger LOG = Logger.getLogger(Window.class.getName());

    private final String name;
    private final List<Transform<I>> transforms;
    private I lastOutput;

    /**
     * Unnamed window, called "Step N" from the shared counter.
     */
    public Window(List<? extends Transform<I>> transforms) {
        this(transforms, null);
    }

    public Window(List<? extends Transform<I>> transforms, String name) {
        this(transforms, name, WindowNamer.shared());
    }

    /**
     * @param name  window title; null or blank takes the next name from {@code namer}
     * @param namer counter for unnamed windows
     */
    public Window(List<? extends Transform<I>> transforms, String name, WindowNamer namer) {
        // Nulls are kept so assembly can report them
        this.transforms = Collections.unmodifiableList(new ArrayList<>(transforms));
        this.name = name == null || name.isBlank() ? namer.nextName() : name;
    }

    @Override
    public final <R> R match(Function<Window<I>, R> onWindow, Function<Transform<I>, R> onTransform) {
        return onWindow.apply(this);
    }

    public String getName() {
        return name;
    }

    public List<Transform<I>> getTransforms() {
        return transforms;
    }

    /**
     * Synchronize every transform from the sliders of this window and return
     * the index of the first dirty one.
     *
     * All transforms are synchronized, including those after the first dirty
     * one, so their slider state is current when the render reaches them.
     *
     * @return index of the first dirty transform, empty if none is dirty
     */
    public OptionalInt firstDirtyIndex(ControlSource controls) {
        int first = -1;
        for (int i = 0; i < transforms.size(); i++) {
            Transform<I> transform = transforms.get(i);
            transform.synchronizeAll(name, controls);
            if (first < 0 && transform.isDirty()) {
                first = i;
            }
        }
        return first < 0 ? OptionalInt.empty() : OptionalInt.of(first);
    }

    /**
     * Feed {@code input} through every transform in order, cache the result
     * and show it on this window's surface.
     *
     * @return the output of the last transform
     */
    public I render(I input, ImageOps<I> ops, DisplaySurface<I> display) {
        I result = input;
        for (Transform<I> transform : transforms) {
            RenderOutcome<I> outcome = transform.render(result);
            if (!outcome.isSuccess()) {
                LOG.log(Level.WARNING, "[" + name + "] " + transform.getName()
                    + " failed, passing input through: " + outcome.getReason(), outcome.getCause());
            }
            result = outcome.outputOr(result);
        }
        lastOutput = result;
        display.show(name, ops.toDisplayable(result));
        return result;
    }

    public I getLastOutput() {
        return lastOutput;
    }

    @Override
    public String toString() {
        return "Window[" + name + ", " + transforms.size() + " transforms]";
    }
}
