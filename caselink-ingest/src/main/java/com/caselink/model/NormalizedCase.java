package com.caselink.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.util.List;

/**
 * Canonical shape every adapter produces before persistence.
 * {@code externalId} is only unique within {@code source}.
 */
public record NormalizedCase(
    String externalId,
    CaseSource source,
    String firstName,
    String lastName,
    String nameNormalized,
    LocalDate dateOfBirth,
    LocalDate missingDate,
    String lastSeenLocation,
    Double lastSeenLat,
    Double lastSeenLng,
    String lastSeenCountry,
    String description,
    Gender gender,
    String race,
    Integer age,
    AgeRange ageRange,
    Integer heightCm,
    Integer weightKg,
    List<String> photoUrls,
    RecordStatus status,
    String sourceUrl,
    JsonNode rawData
) {
    public NormalizedCase {
        photoUrls = photoUrls == null ? List.of() : List.copyOf(photoUrls);
        gender = gender == null ? Gender.UNKNOWN : gender;
        status = status == null ? RecordStatus.UNKNOWN : status;
    }

    public String fullName() {
        StringBuilder sb = new StringBuilder();
        if (firstName != null && !firstName.isBlank()) {
            sb.append(firstName.trim());
        }
        if (lastName != null && !lastName.isBlank()) {
            if (sb.length() > 0) sb.append(" ");
            sb.append(lastName.trim());
        }
        return sb.toString();
    }

    public boolean hasCoordinates() {
        return lastSeenLat != null && lastSeenLng != null;
    }
}
