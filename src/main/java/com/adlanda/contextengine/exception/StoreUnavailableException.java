package com.adlanda.contextengine.exception;

/**
 * The primary store could not be reached. Always propagated to the caller.
 */
public class StoreUnavailableException extends ContextEngineException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
