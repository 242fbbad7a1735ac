package com.caselink.model;

public record RecordError(String externalId, String error) {}
