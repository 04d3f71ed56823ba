package com.licitia.etl.domain.enums;

public enum RunStatus {
    RUNNING("running"),
    OK("ok"),
    FAILED("failed");

    private final String dbValue;

    RunStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String getDbValue() {
        return dbValue;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public static RunStatus fromDbValue(String value) {
        for (RunStatus s : values()) {
            if (s.dbValue.equals(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown run status: " + value);
    }
}
