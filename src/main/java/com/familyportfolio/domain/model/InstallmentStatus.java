package com.familyportfolio.domain.model;

public enum InstallmentStatus {
    ACTIVE,
    COMPLETED,
    CANCELLED
}
