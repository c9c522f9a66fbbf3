package com.ttennebkram.trackpipe.model;

/**
 * Result of rendering one Transform: either the produced image or the
 * reason the render failed. On failure the caller decides what to pass on.
 *
 * @param <I> image buffer type
 */
public final class RenderOutcome<I> {

    private final I output;
    private final String reason;
    private final Throwable cause;

    private RenderOutcome(I output, String reason, Throwable cause) {
        this.output = output;
        this.reason = reason;
        this.cause = cause;
    }

    public static <I> RenderOutcome<I> success(I output) {
        return new RenderOutcome<>(output, null, null);
    }

    public static <I> RenderOutcome<I> failure(String reason) {
        return new RenderOutcome<>(null, reason, null);
    }

    public static <I> RenderOutcome<I> failure(Throwable cause) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new RenderOutcome<>(null, reason, cause);
    }

    public boolean isSuccess() {
        return reason == null;
    }

    public I getOutput() {
        if (!isSuccess()) {
            throw new IllegalStateException("Render failed: " + reason);
        }
        return output;
    }

    /**
     * The rendered image, or {@code fallback} if the render failed.
     */
    public I outputOr(I fallback) {
        return isSuccess() ? output : fallback;
    }

    public String getReason() {
        return reason;
    }

    /** May be null for failures that were not exceptions. */
    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return isSuccess() ? "success" : "failure: " + reason;
    }
}
