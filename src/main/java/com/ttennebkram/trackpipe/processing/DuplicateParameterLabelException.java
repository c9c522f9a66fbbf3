package com.ttennebkram.trackpipe.processing;

/**
 * Two transforms in the same window declare a parameter with the same label,
 * so their sliders would collide.
 */
public class DuplicateParameterLabelException extends PipelineConfigurationException {

    private final String label;
    private final String windowName;
    private final String transformName;
    private final String firstTransformName;

    public DuplicateParameterLabelException(String label, String windowName,
                                            String transformName, String firstTransformName) {
        super("Parameter '" + label + "' is defined twice in window '" + windowName
            + "' in transforms '" + transformName + "' and '" + firstTransformName
            + "'. Rename one of the parameter labels or move a transform to another window.");
        this.label = label;
        this.windowName = windowName;
        this.transformName = transformName;
        this.firstTransformName = firstTransformName;
    }

    public String getLabel() {
        return label;
    }

    public String getWindowName() {
        return windowName;
    }

    /** The transform where the label was seen the second time. */
    public String getTransformName() {
        return transformName;
    }

    /** The transform that declared the label first. */
    public String getFirstTransformName() {
        return firstTransformName;
    }
}
