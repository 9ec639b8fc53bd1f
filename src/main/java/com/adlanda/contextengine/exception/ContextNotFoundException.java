package com.adlanda.contextengine.exception;

/**
 * Thrown when a referenced context or context version does not exist.
 */
public class ContextNotFoundException extends ContextEngineException {

    private final String contextId;

    public ContextNotFoundException(String contextId, String message) {
        super(message);
        this.contextId = contextId;
    }

    public String getContextId() {
        return contextId;
    }
}
