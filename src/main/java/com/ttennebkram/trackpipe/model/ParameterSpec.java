package com.ttennebkram.trackpipe.model;

import java.util.function.IntUnaryOperator;

/**
 * Static declaration of one tunable parameter of a Transform type.
 * Each Transform subclass keeps a fixed list of these and every new
 * instance gets its own Parameter per spec via {@link #instantiate()}.
 *
 * Example:
 * <pre>
 * private static final List&lt;ParameterSpec&gt; PARAMS = List.of(
 *     ParameterSpec.of("ksize", 1, 51, 5).withAdjust(ParameterSpec.ODD_UP)
 * );
 * </pre>
 *
 * No ordering between min, max and default is checked here. A default below
 * min is clamped when the Parameter is created; anything else is the
 * declaring Transform's responsibility.
 */
public final class ParameterSpec {

    /** Even positions are bumped to the next odd number (kernel sizes). */
    public static final IntUnaryOperator ODD_UP = x -> x % 2 == 0 ? x + 1 : x;

    /** Odd positions are bumped to the next even number. */
    public static final IntUnaryOperator EVEN_UP = x -> x % 2 == 0 ? x : x + 1;

    public static final int DEFAULT_MAX = 100;
    public static final int DEFAULT_MIN = 0;
    public static final int DEFAULT_VALUE = 1;

    private final String label;
    private final int min;
    private final int max;
    private final int defaultValue;
    private final IntUnaryOperator adjust;

    private ParameterSpec(String label, int min, int max, int defaultValue, IntUnaryOperator adjust) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Parameter label must not be empty");
        }
        this.label = label;
        this.min = min;
        this.max = max;
        this.defaultValue = defaultValue;
        this.adjust = adjust;
    }

    /**
     * Spec with the stock bounds (0..100, default 1).
     */
    public static ParameterSpec of(String label) {
        return new ParameterSpec(label, DEFAULT_MIN, DEFAULT_MAX, DEFAULT_VALUE, null);
    }

    public static ParameterSpec of(String label, int min, int max, int defaultValue) {
        return new ParameterSpec(label, min, max, defaultValue, null);
    }

    /**
     * Copy of this spec whose value is passed through {@code adjust}
     * before the min clamp.
     */
    public ParameterSpec withAdjust(IntUnaryOperator adjust) {
        return new ParameterSpec(label, min, max, defaultValue, adjust);
    }

    /**
     * Create a fresh Parameter with its own mutable state.
     */
    public Parameter instantiate() {
        return new Parameter(label, min, max, defaultValue, adjust);
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

    public IntUnaryOperator getAdjust() {
        return adjust;
    }

    @Override
    public String toString() {
        return label + " [" + min + ".." + max + ", default " + defaultValue + "]";
    }
}
