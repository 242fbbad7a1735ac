package com.caselink.model;

public record AgeRange(int min, int max) {}
