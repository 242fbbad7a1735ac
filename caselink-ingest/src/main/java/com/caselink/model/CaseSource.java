package com.caselink.model;

import java.util.Arrays;
import java.util.Optional;

public enum CaseSource {
    FBI("fbi", 60),
    NCMEC("ncmec", 70),
    INTERPOL("interpol", 60),
    AMBER("amber", 55),
    PLATFORM("platform", 50),
    OTHER("other", 30);

    private final String slug;
    private final int baseQualityScore;

    CaseSource(String slug, int baseQualityScore) {
        this.slug = slug;
        this.baseQualityScore = baseQualityScore;
    }

    public String slug() {
        return slug;
    }

    /**
     * Starting quality score for records from this source, reflecting how
     * trustworthy and complete its data usually is.
     */
    public int baseQualityScore() {
        return baseQualityScore;
    }

    public static Optional<CaseSource> fromSlug(String slug) {
        if (slug == null) return Optional.empty();
        String s = slug.trim().toLowerCase();
        return Arrays.stream(values())
            .filter(source -> source.slug.equals(s))
            .findFirst();
    }
}
