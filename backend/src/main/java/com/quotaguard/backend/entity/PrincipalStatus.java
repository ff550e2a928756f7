package com.quotaguard.backend.entity;

public enum PrincipalStatus {
    ACTIVE,
    PENDING_DELETION,
    EXPIRED
}
