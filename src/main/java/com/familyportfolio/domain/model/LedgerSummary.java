package com.familyportfolio.domain.model;

import java.math.BigDecimal;

public record LedgerSummary(BigDecimal balance,
                            BigDecimal weightedAverageCost,
                            BigDecimal totalCost,
                            BigDecimal realizedPnl) {
}
