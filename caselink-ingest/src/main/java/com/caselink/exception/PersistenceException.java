package com.caselink.exception;

/** A transactional write failed and was rolled back. */
public class PersistenceException extends IngestionException {

    private final String externalId;

    public PersistenceException(String externalId, String message, Throwable cause) {
        super(message, cause);
        this.externalId = externalId;
    }

    public String getExternalId() {
        return externalId;
    }
}
