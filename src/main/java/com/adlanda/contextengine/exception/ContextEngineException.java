package com.adlanda.contextengine.exception;

/**
 * Base class for context engine errors.
 */
public class ContextEngineException extends RuntimeException {

    public ContextEngineException(String message) {
        super(message);
    }

    public ContextEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
