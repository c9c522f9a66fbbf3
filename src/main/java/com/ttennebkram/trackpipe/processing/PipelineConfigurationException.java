package com.ttennebkram.trackpipe.processing;

/**
 * A pipeline declaration that cannot be run. Raised before the render loop
 * starts.
 */
public class PipelineConfigurationException extends RuntimeException {

    public PipelineConfigurationException(String message) {
        super(message);
    }
}
