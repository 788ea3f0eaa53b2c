package com.familyportfolio.domain.model;

public enum CashFlowSource {
    STOCK_TRANSACTION,
    CURRENCY_LEDGER
}
