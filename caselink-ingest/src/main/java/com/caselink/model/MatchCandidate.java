package com.caselink.model;

import java.time.LocalDate;

/** A person from another source considered during fuzzy matching. */
public record MatchCandidate(
    Long personId,
    Long caseId,
    String caseSource,
    String firstName,
    String lastName,
    LocalDate dateOfBirth,
    String gender
) {}
