package com.caselink.model;

/**
 * An already-ingested record with the same source and external id.
 * {@code originating} is false when the record was attached to another
 * source's case as provenance.
 */
public record ExactMatch(Long caseId, Long personId, Long sourceRecordId, boolean originating) {}
