package com.caselink.model;

public record Image(
    Long id,
    Long personId,
    String storageUrl,
    String storageKey,
    String imageType,
    boolean primary,
    String sourceAttribution
) {}
