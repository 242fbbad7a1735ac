package com.caselink.model;

public enum Gender {
    MALE, FEMALE, OTHER, UNKNOWN;

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /** Column value, or null when unknown. */
    public String dbValue() {
        return isKnown() ? name().toLowerCase() : null;
    }

    public static Gender fromDbValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        try {
            return Gender.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
