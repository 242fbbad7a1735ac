package com.caselink.exception;

public class DeduplicationException extends IngestionException {

    public DeduplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
