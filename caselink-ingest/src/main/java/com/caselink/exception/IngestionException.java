package com.caselink.exception;

/**
 * Base of the pipeline's failure taxonomy. Everything except
 * {@link OrchestrationException} is recovered inside a run.
 */
public abstract class IngestionException extends RuntimeException {

    protected IngestionException(String message) {
        super(message);
    }

    protected IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
