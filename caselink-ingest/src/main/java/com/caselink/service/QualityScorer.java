package com.caselink.service;

import com.caselink.model.NormalizedCase;
import com.caselink.model.QualityScore;
import com.caselink.model.QualityScore.Factor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores a record 0-100 by how complete it is, starting from a per-source
 * base. Deterministic and side-effect free.
 */
@Service
public class QualityScorer {

    static final int UNKNOWN_SOURCE_BASE = 40;
    private static final int RICH_DESCRIPTION_LENGTH = 50;

    public QualityScore score(NormalizedCase record) {
        List<Factor> factors = new ArrayList<>();
        int score = record.source() != null ? record.source().baseQualityScore() : UNKNOWN_SOURCE_BASE;

        boolean hasFirst = hasText(record.firstName());
        boolean hasLast = hasText(record.lastName());
        if (hasFirst && hasLast) {
            factors.add(new Factor("name", 10, "First and last name present"));
        } else if (hasFirst || hasLast) {
            factors.add(new Factor("name", 5, "Partial name present"));
        } else {
            factors.add(new Factor("name", -10, "No name data"));
        }

        if (record.dateOfBirth() != null) {
            factors.add(new Factor("dateOfBirth", 5, "Date of birth present"));
        }
        if (record.missingDate() != null) {
            factors.add(new Factor("missingDate", 3, "Missing date present"));
        }
        if (!record.photoUrls().isEmpty()) {
            factors.add(new Factor("photoUrls", 8, "Photo available"));
        }

        if (record.hasCoordinates()) {
            factors.add(new Factor("location", 5, "Coordinates present"));
        } else if (hasText(record.lastSeenLocation())) {
            factors.add(new Factor("location", 3, "Location text present"));
        }

        if (record.description() != null && record.description().length() > RICH_DESCRIPTION_LENGTH) {
            factors.add(new Factor("description", 3, "Rich description present"));
        }
        if (record.gender().isKnown()) {
            factors.add(new Factor("gender", 2, "Gender specified"));
        }
        if (record.heightCm() != null || record.weightKg() != null) {
            factors.add(new Factor("physical", 2, "Height or weight present"));
        }
        if (hasText(record.lastSeenCountry())) {
            factors.add(new Factor("country", 2, "Country present"));
        }

        for (Factor factor : factors) {
            score += factor.points();
        }
        return new QualityScore(Math.max(0, Math.min(100, score)), List.copyOf(factors));
    }

    /** Scores keyed by external id, in input order. */
    public Map<String, Integer> scoreAll(List<NormalizedCase> records) {
        Map<String, Integer> scores = new LinkedHashMap<>();
        for (NormalizedCase record : records) {
            scores.put(record.externalId(), score(record).score());
        }
        return scores;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
