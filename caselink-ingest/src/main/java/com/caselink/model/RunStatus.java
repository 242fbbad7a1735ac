package com.caselink.model;

public enum RunStatus {
    RUNNING, SUCCESS, ERROR;

    public String dbValue() {
        return name().toLowerCase();
    }

    public static RunStatus fromDbValue(String value) {
        return RunStatus.valueOf(value.trim().toUpperCase());
    }
}
