package com.quotaguard.backend.entity;

public enum AuditChangeType {
    UPDATE("update"),
    DELETE("delete"),
    RESTORE("restore");

    private final String code;

    AuditChangeType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
