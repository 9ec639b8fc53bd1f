package com.adlanda.contextengine.exception;

/**
 * Thrown when a request is malformed (missing workspace, empty content, rating out of range, ...).
 */
public class ContextValidationException extends ContextEngineException {

    public ContextValidationException(String message) {
        super(message);
    }
}
