package com.ttennebkram.trackpipe.ui;

/**
 * Source of user key presses, polled once per engine tick.
 */
@FunctionalInterface
public interface EventSource {

    /**
     * Wait at most {@code timeoutMs} for a key press.
     *
     * @return true if the cancel key was pressed
     */
    boolean pollCancelKey(long timeoutMs);
}
