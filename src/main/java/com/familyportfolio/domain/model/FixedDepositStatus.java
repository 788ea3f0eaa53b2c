package com.familyportfolio.domain.model;

public enum FixedDepositStatus {
    ACTIVE,
    MATURED,
    CLOSED,
    EARLY_WITHDRAWAL
}
