package com.caselink.model;

/**
 * Outcome of deduplicating one normalized record. Exactly one of three
 * shapes: an exact re-ingestion ({@code exactMatch} set), a cross-source
 * duplicate ({@code duplicate} true), or a new case.
 */
public record DeduplicationDecision(
    boolean duplicate,
    Long existingCaseId,
    Long existingPersonId,
    double score,
    String reason,
    Action action,
    ExactMatch exactMatch
) {
    public enum Action { CREATE, UPDATE }

    public static DeduplicationDecision create(double score, String reason) {
        return new DeduplicationDecision(false, null, null, score, reason, Action.CREATE, null);
    }

    public static DeduplicationDecision attach(Long caseId, Long personId, double score, String reason) {
        return new DeduplicationDecision(true, caseId, personId, score, reason, Action.UPDATE, null);
    }

    public static DeduplicationDecision exact(ExactMatch match) {
        return new DeduplicationDecision(false, match.caseId(), match.personId(), 1.0,
            "Same source and external id", Action.UPDATE, match);
    }

    public boolean isExactMatch() {
        return exactMatch != null;
    }
}
