package com.ttennebkram.trackpipe.processing;

/**
 * Windows and bare Transforms were mixed in one pipeline declaration.
 */
public class MixedGroupingException extends PipelineConfigurationException {

    private final int windowCount;
    private final int transformCount;

    public MixedGroupingException(int windowCount, int transformCount) {
        super("Cannot mix windows and bare transforms in one pipeline (" + windowCount
            + " windows, " + transformCount + " transforms). Put every transform in a window, or use no windows.");
        this.windowCount = windowCount;
        this.transformCount = transformCount;
    }

    public int getWindowCount() {
        return windowCount;
    }

    public int getTransformCount() {
        return transformCount;
    }
}
