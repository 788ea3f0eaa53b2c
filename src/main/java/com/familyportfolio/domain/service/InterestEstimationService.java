package com.familyportfolio.domain.service;

import com.familyportfolio.domain.model.BankAccount;
import com.familyportfolio.domain.model.InterestEstimate;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Simple-interest projection on the capped principal. Monthly and yearly figures are each
 * rounded to cents from their own formula, so yearly is not monthly times twelve.
 */
public class InterestEstimationService {

    private static final BigDecimal PERCENT_PER_YEAR = BigDecimal.valueOf(100);
    private static final BigDecimal PERCENT_PER_MONTH = BigDecimal.valueOf(1200);

    public InterestEstimate calculate(BankAccount account) {
        Objects.requireNonNull(account, "account must not be null");

        BigDecimal principal = account.getEffectivePrincipal();
        BigDecimal annualInterest = principal.multiply(account.getInterestRate());

        BigDecimal monthly = DecimalMath.round(DecimalMath.divide(annualInterest, PERCENT_PER_MONTH), 2);
        BigDecimal yearly = DecimalMath.round(DecimalMath.divide(annualInterest, PERCENT_PER_YEAR), 2);

        return new InterestEstimate(monthly, yearly);
    }
}
