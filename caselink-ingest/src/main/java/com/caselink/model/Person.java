package com.caselink.model;

import java.time.LocalDate;

public record Person(
    Long id,
    Long caseId,
    String role,
    String firstName,
    String lastName,
    String nameNormalized,
    LocalDate dateOfBirth,
    Integer approximateAge,
    Integer ageMin,
    Integer ageMax,
    String gender,
    String nationality,
    String ethnicity,
    Integer heightCm,
    Integer weightKg
) {
    public static final String ROLE_MISSING_CHILD = "missing_child";
}
