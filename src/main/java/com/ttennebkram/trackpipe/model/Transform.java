package com.ttennebkram.trackpipe.model;

import com.ttennebkram.trackpipe.ui.ControlSource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * One stage of image processing with zero or more slider-backed Parameters.
 *
 * Subclasses declare their parameters once as a static list of
 * {@link ParameterSpec}s and pass it to the constructor; each instance gets
 * its own Parameter objects in declaration order. Subclasses implement
 * {@link #draw} and may override {@link #computeValues} to derive values
 * before drawing (e.g. forcing odd kernel sizes).
 *
 * <pre>
 * public class BlurTransform extends Transform&lt;Mat&gt; {
 *     private static final List&lt;ParameterSpec&gt; PARAMS = List.of(
 *         ParameterSpec.of("ksize", 1, 51, 5).withAdjust(ParameterSpec.ODD_UP));
 *
 *     public BlurTransform() { super(PARAMS); }
 *
 *     protected Mat draw(Mat input) { ... value("ksize") ... }
 * }
 * </pre>
 *
 * @param <I> image buffer type
 */
public abstract class Transform<I> extends PipelineItem<I> {

    private final Map<String, Parameter> parameters = new LinkedHashMap<>();
    private I lastOutput;

    protected Transform() {
        this(Collections.emptyList());
    }

    protected Transform(List<ParameterSpec> specs) {
        for (ParameterSpec spec : specs) {
            if (parameters.putIfAbsent(spec.getLabel(), spec.instantiate()) != null) {
                throw new IllegalArgumentException(
                    "Parameter '" + spec.getLabel() + "' is declared twice in " + getClass().getName());
            }
        }
    }

    @Override
    public final <R> R match(Function<Window<I>, R> onWindow, Function<Transform<I>, R> onTransform) {
        return onTransform.apply(this);
    }

    /**
     * Type name used in log lines and error messages.
     */
    public String getName() {
        String simple = getClass().getSimpleName();
        return simple.isEmpty() ? getClass().getName() : simple;
    }

    /**
     * Parameters by label, in declaration order.
     */
    public Map<String, Parameter> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    protected Parameter param(String label) {
        Parameter p = parameters.get(label);
        if (p == null) {
            throw new IllegalArgumentException(getName() + " has no parameter '" + label + "'");
        }
        return p;
    }

    protected int value(String label) {
        return param(label).getValue();
    }

    /**
     * Read every parameter's slider on window {@code windowName}.
     */
    public void synchronizeAll(String windowName, ControlSource controls) {
        if (parameters.isEmpty()) {
            return;
        }
        for (Parameter p : parameters.values()) {
            p.synchronize(controls.getControlPosition(p.getLabel(), windowName));
        }
    }

    /**
     * True if any parameter moved at the last synchronization and this
     * transform has not rendered since.
     */
    public boolean isDirty() {
        for (Parameter p : parameters.values()) {
            if (p.isDirty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Hook run before {@link #draw}. May overwrite parameter values.
     */
    protected void computeValues() {
    }

    /**
     * Perform the transformation.
     *
     * @param input image to operate on; null if this is the first stage and it
     *              acquires its own input
     * @return the output image
     */
    protected abstract I draw(I input);

    /**
     * Run {@link #computeValues} and {@link #draw} on {@code input}.
     *
     * A failing hook is reported as a failure outcome and the input is kept
     * as this transform's last output. Either way every parameter is clean
     * afterwards, since a render consumes all current values.
     */
    public RenderOutcome<I> render(I input) {
        RenderOutcome<I> outcome;
        try {
            computeValues();
            I result = draw(input);
            outcome = result != null
                ? RenderOutcome.success(result)
                : RenderOutcome.failure(getName() + " produced no image");
        } catch (RuntimeException e) {
            outcome = RenderOutcome.failure(e);
        }
        lastOutput = outcome.outputOr(input);

        for (Parameter p : parameters.values()) {
            p.markClean();
        }
        return outcome;
    }

    public I getLastOutput() {
        return lastOutput;
    }

    @Override
    public String toString() {
        return getName() + parameters.values();
    }
}
