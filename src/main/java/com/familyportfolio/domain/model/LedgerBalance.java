package com.familyportfolio.domain.model;

import java.math.BigDecimal;

/**
 * Current balance of a ledger in its own currency. May be negative.
 */
public record LedgerBalance(BigDecimal balance, String currencyCode) {
}
