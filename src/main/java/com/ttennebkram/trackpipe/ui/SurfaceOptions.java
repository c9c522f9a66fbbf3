package com.ttennebkram.trackpipe.ui;

/**
 * How a display surface should be created. Mirrors the usual
 * normal / keep-ratio / expanded-GUI window flags of an image viewer.
 */
public class SurfaceOptions {

    private final boolean resizable;
    private final boolean keepRatio;
    private final boolean expandedControls;
    private final int maxImageWidth;

    public SurfaceOptions(boolean resizable, boolean keepRatio, boolean expandedControls, int maxImageWidth) {
        this.resizable = resizable;
        this.keepRatio = keepRatio;
        this.expandedControls = expandedControls;
        this.maxImageWidth = maxImageWidth;
    }

    public static SurfaceOptions defaults() {
        return new SurfaceOptions(true, true, true, 800);
    }

    public boolean isResizable() {
        return resizable;
    }

    public boolean isKeepRatio() {
        return keepRatio;
    }

    public boolean isExpandedControls() {
        return expandedControls;
    }

    /** Initial width limit for the image area, 0 for the image's own width. */
    public int getMaxImageWidth() {
        return maxImageWidth;
    }
}
