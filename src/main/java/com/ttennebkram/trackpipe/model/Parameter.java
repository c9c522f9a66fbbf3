package com.ttennebkram.trackpipe.model;

import java.util.function.IntUnaryOperator;

/**
 * A single slider-backed integer owned by a Transform.
 *
 * The value is always derived from the last observed slider position:
 * {@code value = max(min, adjust(position))}, or {@code max(min, position)}
 * without an adjust function. {@code max} is only the slider's upper bound
 * and never clamps the value itself.
 *
 * A new Parameter starts dirty so the first render always happens.
 */
public class Parameter {

    private final String label;
    private final int min;
    private final int max;
    private final int defaultValue;
    private final IntUnaryOperator adjust;

    private int value;
    private int observedPosition;
    private boolean dirty = true;

    Parameter(String label, int min, int max, int defaultValue, IntUnaryOperator adjust) {
        this.label = label;
        this.min = min;
        this.max = max;
        this.defaultValue = defaultValue;
        this.adjust = adjust;
        this.observedPosition = Math.max(min, defaultValue);
        this.value = computeValue(observedPosition);
    }

    /**
     * Read a slider position into this parameter.
     * Dirty is set exactly when the position moved since the previous read.
     *
     * @param position the position currently reported by the slider
     */
    public void synchronize(int position) {
        dirty = position != observedPosition;
        observedPosition = position;
        value = computeValue(position);
    }

    private int computeValue(int position) {
        int adjusted = adjust != null ? adjust.applyAsInt(position) : position;
        return Math.max(min, adjusted);
    }

    /**
     * Called after the owning Transform rendered.
     */
    void markClean() {
        dirty = false;
    }

    public String getLabel() {
        return label;
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }

    public int getDefaultValue() {
        return defaultValue;
    }

    public int getValue() {
        return value;
    }

    /**
     * Transforms may overwrite the value in {@code computeValues()} to derive
     * auxiliary values. The next synchronize recomputes it from the slider.
     */
    public void setValue(int value) {
        this.value = value;
    }

    public int getObservedPosition() {
        return observedPosition;
    }

    public boolean isDirty() {
        return dirty;
    }

    @Override
    public String toString() {
        return label + "=" + value + (dirty ? " (dirty)" : "");
    }
}
