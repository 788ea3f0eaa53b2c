package com.familyportfolio.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * External cash flow crossing the boundary of a portfolio, positive when capital comes in.
 */
public record ReturnCashFlowEvent(UUID portfolioId,
                                  UUID transactionId,
                                  LocalDate transactionDate,
                                  BigDecimal amount,
                                  String currencyCode,
                                  CashFlowSource source) {

    public CashFlow toCashFlow() {
        return new CashFlow(amount, transactionDate);
    }
}
