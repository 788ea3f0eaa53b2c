package com.familyportfolio.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Portfolio value immediately before and after an external cash flow.
 */
public record ValuationSnapshot(LocalDate date, BigDecimal valueBeforeFlow, BigDecimal valueAfterFlow) {
}
