package com.ttennebkram.trackpipe.ui;

/**
 * A toolkit that provides all three collaborators of the render engine:
 * windows to draw into, sliders on them, and key presses.
 *
 * @param <I> image buffer type
 */
public interface TrackbarUi<I> extends ControlSource, DisplaySurface<I>, EventSource {
}
