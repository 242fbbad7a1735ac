package com.caselink.model;

import java.util.List;

public record QualityScore(int score, List<Factor> factors) {

    public record Factor(String field, int points, String reason) {}
}
