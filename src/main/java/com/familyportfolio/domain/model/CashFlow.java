package com.familyportfolio.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Signed, dated amount. Positive amounts flow in, negative amounts flow out.
 */
public record CashFlow(BigDecimal amount, LocalDate date) {
}
