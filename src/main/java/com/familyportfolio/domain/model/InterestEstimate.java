package com.familyportfolio.domain.model;

import java.math.BigDecimal;

public record InterestEstimate(BigDecimal monthlyInterest, BigDecimal yearlyInterest) {
}
