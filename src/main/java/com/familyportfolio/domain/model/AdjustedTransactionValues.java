package com.familyportfolio.domain.model;

import java.math.BigDecimal;

public record AdjustedTransactionValues(BigDecimal originalShares,
                                        BigDecimal adjustedShares,
                                        BigDecimal originalPrice,
                                        BigDecimal adjustedPrice,
                                        BigDecimal splitRatio,
                                        boolean hasSplitAdjustment) {
}
