package com.caselink.exception;

public class NormalizationException extends IngestionException {

    public NormalizationException(String message) {
        super(message);
    }
}
