package com.familyportfolio.domain.model;

import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * Fixed-deposit terms of a bank account. The account's total assets are the principal.
 */
public record FixedDepositDetails(int termMonths,
                                  LocalDate startDate,
                                  FixedDepositStatus status,
                                  BigDecimal expectedInterest,
                                  BigDecimal actualInterest) {

    public FixedDepositDetails {
        if (termMonths <= 0) {
            throw new ServiceException(Errors.BankAccount.INVALID_INPUT, "Term months must be greater than 0");
        }
        if (startDate == null) {
            throw new ServiceException(Errors.BankAccount.INVALID_INPUT, "Start date is required");
        }
        if (expectedInterest != null && expectedInterest.compareTo(BigDecimal.ZERO) < 0) {
            throw new ServiceException(Errors.BankAccount.INVALID_INPUT, "Expected interest cannot be negative");
        }
        if (actualInterest != null && actualInterest.compareTo(BigDecimal.ZERO) < 0) {
            throw new ServiceException(Errors.BankAccount.INVALID_INPUT, "Actual interest cannot be negative");
        }
        status = status != null ? status : FixedDepositStatus.ACTIVE;
        expectedInterest = expectedInterest != null
                ? expectedInterest.setScale(2, RoundingMode.HALF_EVEN)
                : BigDecimal.ZERO;
    }

    public LocalDate maturityDate() {
        return startDate.plusMonths(termMonths);
    }

    /**
     * Matured when flagged so, or when still active and the term has run out by {@code asOf}.
     * Closed and early-withdrawn deposits are settled and never count as matured.
     */
    public boolean isMatured(LocalDate asOf) {
        return switch (status) {
            case MATURED -> true;
            case ACTIVE -> !maturityDate().isAfter(asOf);
            case CLOSED, EARLY_WITHDRAWAL -> false;
        };
    }

    /**
     * Simple interest over the term, {@code principal * rate% * months / 12}.
     */
    public static BigDecimal estimateInterest(BigDecimal principal, BigDecimal annualRatePercent, int termMonths) {
        return principal
                .multiply(annualRatePercent)
                .multiply(BigDecimal.valueOf(termMonths))
                .divide(BigDecimal.valueOf(1200), 2, RoundingMode.HALF_EVEN);
    }
}
