package com.ttennebkram.trackpipe.ui;

/**
 * Integer slider controls, one per (label, window) pair.
 * Positions are always within [0, max] and stable between reads of one tick.
 */
public interface ControlSource {

    /**
     * Create a slider labelled {@code label} on the window {@code windowName}.
     *
     * @param initialPosition starting position
     * @param maxValue        upper bound of the slider (lower bound is 0)
     */
    void createControl(String label, String windowName, int initialPosition, int maxValue);

    /**
     * Current position of the slider created with the same label and window.
     */
    int getControlPosition(String label, String windowName);
}
