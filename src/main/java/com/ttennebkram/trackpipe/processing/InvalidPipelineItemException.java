package com.ttennebkram.trackpipe.processing;

/**
 * An item is neither a Transform nor a Window, or a Window holds something
 * other than Transforms.
 */
public class InvalidPipelineItemException extends PipelineConfigurationException {

    public InvalidPipelineItemException(String message) {
        super(message);
    }
}
