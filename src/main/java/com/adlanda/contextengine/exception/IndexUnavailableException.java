package com.adlanda.contextengine.exception;

/**
 * The vector index could not be reached or rejected an operation.
 *
 * Fatal for retrieval; storage writes, deletes and usage tracking catch it,
 * log it and record the affected context for repair.
 */
public class IndexUnavailableException extends ContextEngineException {

    public IndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
