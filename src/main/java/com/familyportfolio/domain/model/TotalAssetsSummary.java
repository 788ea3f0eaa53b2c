package com.familyportfolio.domain.model;

import java.math.BigDecimal;

public record TotalAssetsSummary(BigDecimal investmentTotal,
                                 BigDecimal bankTotal,
                                 BigDecimal grandTotal,
                                 BigDecimal investmentPercentage,
                                 BigDecimal bankPercentage,
                                 BigDecimal totalMonthlyInterest,
                                 BigDecimal totalYearlyInterest) {
}
