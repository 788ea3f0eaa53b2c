package com.familyportfolio.domain.model;

import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A movement on a currency ledger. {@code foreignAmount} is always positive, the direction comes
 * from the transaction type.
 */
@Getter
public class CurrencyTransaction {
    public static final int MAX_NOTES_LENGTH = 500;

    private final UUID id;
    private final UUID ledgerId;
    private final LocalDate transactionDate;
    private final CurrencyTransactionType transactionType;
    private final BigDecimal foreignAmount;
    private final BigDecimal homeAmount;
    private final BigDecimal exchangeRate;
    private final UUID relatedStockTransactionId;
    /** Set by stock linking: the row settles a stock trade and is never an external cash flow. */
    private final boolean internalSettlement;
    private final String notes;
    private final Instant createdAt;
    private final boolean deleted;

    @Builder
    public CurrencyTransaction(UUID id,
                               UUID ledgerId,
                               LocalDate transactionDate,
                               CurrencyTransactionType transactionType,
                               BigDecimal foreignAmount,
                               BigDecimal homeAmount,
                               BigDecimal exchangeRate,
                               UUID relatedStockTransactionId,
                               boolean internalSettlement,
                               String notes,
                               Instant createdAt,
                               boolean deleted) {
        if (transactionType == null) {
            throw new ServiceException(Errors.CurrencyTransaction.INVALID_INPUT, "Transaction type is required");
        }
        if (transactionDate == null) {
            throw new ServiceException(Errors.CurrencyTransaction.INVALID_INPUT, "Transaction date is required");
        }
        if (foreignAmount == null || foreignAmount.compareTo(BigDecimal.ZERO) <= 0) {
            throw new ServiceException(Errors.CurrencyTransaction.INVALID_INPUT, "Foreign amount must be positive");
        }
        if (homeAmount != null && homeAmount.compareTo(BigDecimal.ZERO) < 0) {
            throw new ServiceException(Errors.CurrencyTransaction.INVALID_INPUT, "Home amount cannot be negative");
        }
        if (exchangeRate != null && exchangeRate.compareTo(BigDecimal.ZERO) <= 0) {
            throw new ServiceException(Errors.CurrencyTransaction.INVALID_INPUT, "Exchange rate must be positive");
        }
        if (transactionType.isExchange() && homeAmount == null && exchangeRate == null) {
            throw new ServiceException(Errors.CurrencyTransaction.REQUIRED_FIELD_MISSING,
                    "Currency exchanges require a home amount or an exchange rate");
        }
        if (notes != null && notes.length() > MAX_NOTES_LENGTH) {
            throw new ServiceException(Errors.CurrencyTransaction.INVALID_INPUT,
                    "Notes cannot exceed " + MAX_NOTES_LENGTH + " characters");
        }

        this.id = id != null ? id : UUID.randomUUID();
        this.ledgerId = ledgerId;
        this.transactionDate = transactionDate;
        this.transactionType = transactionType;
        this.foreignAmount = foreignAmount.setScale(4, RoundingMode.HALF_EVEN);
        this.homeAmount = homeAmount != null ? homeAmount.setScale(2, RoundingMode.HALF_EVEN) : null;
        this.exchangeRate = exchangeRate != null ? exchangeRate.setScale(6, RoundingMode.HALF_EVEN) : null;
        this.relatedStockTransactionId = relatedStockTransactionId;
        this.internalSettlement = internalSettlement;
        this.notes = notes;
        this.createdAt = createdAt != null ? createdAt : Instant.EPOCH;
        this.deleted = deleted;
    }

    /**
     * Home-currency value of the movement: the recorded home amount, else the foreign amount at
     * the recorded rate, else zero.
     */
    public BigDecimal resolveHomeAmount() {
        if (homeAmount != null) {
            return homeAmount;
        }
        if (exchangeRate != null) {
            return foreignAmount.multiply(exchangeRate);
        }
        return BigDecimal.ZERO;
    }
}
