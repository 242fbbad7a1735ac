package com.caselink.model;

import java.time.Instant;
import java.time.LocalDate;

public record MissingCase(
    Long id,
    String caseNumber,
    String caseType,
    String status,
    String urgency,
    int qualityScore,
    Instant reportedAt,
    String source,
    String sourceId,
    String sourceUrl,
    LocalDate lastSeenAt,
    String lastSeenLocation,
    Double lastSeenLat,
    Double lastSeenLng,
    String lastSeenCountry,
    String circumstances,
    Instant lastSyncedAt
) {
    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_RESOLVED = "resolved";
    public static final String STATUS_ARCHIVED = "archived";
}
