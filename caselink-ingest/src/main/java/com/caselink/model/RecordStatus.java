package com.caselink.model;

public enum RecordStatus {
    MISSING, FOUND, UNKNOWN
}
