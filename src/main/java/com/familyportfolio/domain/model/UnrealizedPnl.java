package com.familyportfolio.domain.model;

import java.math.BigDecimal;

public record UnrealizedPnl(BigDecimal currentValueHome,
                            BigDecimal unrealizedPnlHome,
                            BigDecimal percentage) {

    public static UnrealizedPnl zero() {
        return new UnrealizedPnl(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }
}
