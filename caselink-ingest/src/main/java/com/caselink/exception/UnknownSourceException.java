package com.caselink.exception;

public class UnknownSourceException extends IngestionException {

    public UnknownSourceException(String sourceId) {
        super("Unknown source: " + sourceId);
    }
}
