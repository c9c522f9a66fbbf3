package com.ttennebkram.trackpipe.processing;

/**
 * Two windows of one pipeline share a name, so their surfaces and sliders
 * would collide.
 */
public class DuplicateWindowNameException extends PipelineConfigurationException {

    private final String windowName;

    public DuplicateWindowNameException(String windowName) {
        super("Window name '" + windowName + "' is used more than once. Give each window its own name.");
        this.windowName = windowName;
    }

    public String getWindowName() {
        return windowName;
    }
}
