package com.familyportfolio.domain.model;

import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A bank account, optionally configured as a fixed deposit. Interest rate is an annual
 * percentage; interest accrues on at most {@code interestCap}.
 */
@Getter
public class BankAccount {
    private final UUID id;
    private final UUID userId;
    private final String bankName;
    private final BigDecimal totalAssets;
    private final BigDecimal interestRate;
    private final BigDecimal interestCap;
    private final String currency;
    private final FixedDepositDetails fixedDeposit;
    private final boolean active;

    @Builder
    public BankAccount(UUID id,
                       UUID userId,
                       String bankName,
                       BigDecimal totalAssets,
                       BigDecimal interestRate,
                       BigDecimal interestCap,
                       String currency,
                       FixedDepositDetails fixedDeposit,
                       Boolean active) {
        if (bankName == null || bankName.isBlank()) {
            throw new ServiceException(Errors.BankAccount.INVALID_INPUT, "Bank name is required");
        }
        if (totalAssets != null && totalAssets.compareTo(BigDecimal.ZERO) < 0) {
            throw new ServiceException(Errors.BankAccount.INVALID_INPUT, "Total assets cannot be negative");
        }
        if (interestRate != null && interestRate.compareTo(BigDecimal.ZERO) < 0) {
            throw new ServiceException(Errors.BankAccount.INVALID_INPUT, "Interest rate cannot be negative");
        }
        if (interestCap != null && interestCap.compareTo(BigDecimal.ZERO) < 0) {
            throw new ServiceException(Errors.BankAccount.INVALID_INPUT, "Interest cap cannot be negative");
        }

        this.id = id != null ? id : UUID.randomUUID();
        this.userId = userId;
        this.bankName = bankName;
        this.totalAssets = totalAssets != null ? totalAssets : BigDecimal.ZERO;
        this.interestRate = interestRate != null ? interestRate : BigDecimal.ZERO;
        this.interestCap = interestCap;
        this.currency = CurrencyCodes.normalize(currency != null ? currency : "TWD", Errors.BankAccount.INVALID_INPUT);
        this.fixedDeposit = fixedDeposit;
        this.active = active == null || active;
    }

    public boolean isFixedDeposit() {
        return fixedDeposit != null;
    }

    public boolean isMaturedFixedDeposit(LocalDate asOf) {
        return isFixedDeposit() && fixedDeposit.isMatured(asOf);
    }

    /**
     * Principal interest accrues on. A missing cap means the whole balance earns interest.
     */
    public BigDecimal getEffectivePrincipal() {
        if (interestCap == null) {
            return totalAssets;
        }
        return totalAssets.min(interestCap);
    }
}
