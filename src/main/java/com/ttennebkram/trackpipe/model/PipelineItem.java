package com.ttennebkram.trackpipe.model;

import java.util.function.Function;

/**
 * One entry of a pipeline declaration: either a {@link Window} or a bare
 * {@link Transform}. The constructor is package-private so these are the only
 * two direct subclasses, and {@link #match} forces callers to handle both.
 *
 * @param <I> image buffer type
 */
public abstract class PipelineItem<I> {

    PipelineItem() {
    }

    /**
     * Dispatch on the kind of item.
     */
    public abstract <R> R match(Function<Window<I>, R> onWindow, Function<Transform<I>, R> onTransform);
}
