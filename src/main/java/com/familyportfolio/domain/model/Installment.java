package com.familyportfolio.domain.model;

import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import com.familyportfolio.domain.service.DecimalMath;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Credit-card installment plan.
 */
@Getter
public class Installment {
    private final UUID id;
    private final String description;
    private final BigDecimal totalAmount;
    private final int numberOfInstallments;
    private int remainingInstallments;
    private InstallmentStatus status;

    public Installment(UUID id, String description, BigDecimal totalAmount, int numberOfInstallments, int remainingInstallments) {
        if (totalAmount == null || totalAmount.compareTo(BigDecimal.ZERO) <= 0) {
            throw new ServiceException(Errors.Installment.INVALID_INPUT, "Total amount must be positive");
        }
        if (numberOfInstallments <= 0) {
            throw new ServiceException(Errors.Installment.INVALID_INPUT, "Number of installments must be greater than 0");
        }
        this.id = id != null ? id : UUID.randomUUID();
        this.description = description;
        this.totalAmount = DecimalMath.round(totalAmount, 2);
        this.numberOfInstallments = numberOfInstallments;
        this.status = InstallmentStatus.ACTIVE;
        updateRemainingInstallments(remainingInstallments);
    }

    public BigDecimal getMonthlyPayment() {
        return DecimalMath.round(DecimalMath.divide(totalAmount, BigDecimal.valueOf(numberOfInstallments)), 2);
    }

    public void updateRemainingInstallments(int remaining) {
        if (remaining < 0) {
            throw new ServiceException(Errors.Installment.INVALID_INPUT, "Remaining installments cannot be negative");
        }
        if (remaining > numberOfInstallments) {
            throw new ServiceException(Errors.Installment.INVALID_INPUT, "Remaining installments cannot exceed total installments");
        }
        this.remainingInstallments = remaining;
        if (remaining == 0 && status == InstallmentStatus.ACTIVE) {
            this.status = InstallmentStatus.COMPLETED;
        }
    }

    public void cancel() {
        this.status = InstallmentStatus.CANCELLED;
    }

    public boolean isOutstanding() {
        return status != InstallmentStatus.CANCELLED && remainingInstallments > 0;
    }

    /**
     * {@code totalAmount / numberOfInstallments * remainingInstallments}, zero once cancelled or paid off.
     */
    public BigDecimal getUnpaidBalance() {
        if (!isOutstanding()) {
            return BigDecimal.ZERO;
        }
        BigDecimal unpaid = totalAmount
                .multiply(BigDecimal.valueOf(remainingInstallments))
                .divide(BigDecimal.valueOf(numberOfInstallments), DecimalMath.PRECISION);
        return DecimalMath.round(unpaid, 2);
    }
}
