package com.familyportfolio.domain.model;

import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import com.familyportfolio.domain.service.DecimalMath;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;

/**
 * A recorded stock/ETF trade. Prices and fees are in the currency the stock trades in; the
 * exchange rate converts that currency into the home currency and is absent when no
 * conversion applies.
 */
@Getter
public class StockTransaction {
    private final UUID id;
    private final UUID portfolioId;
    private final LocalDate transactionDate;
    private final String ticker;
    private final StockMarket market;
    private final StockTransactionType transactionType;
    private final BigDecimal shares;
    private final BigDecimal pricePerShare;
    private final BigDecimal exchangeRate;
    private final BigDecimal fees;
    private final String currency;
    private final String notes;
    private final boolean deleted;
    private UUID linkedCurrencyTransactionId;

    @Builder
    public StockTransaction(UUID id,
                            UUID portfolioId,
                            LocalDate transactionDate,
                            String ticker,
                            StockMarket market,
                            StockTransactionType transactionType,
                            BigDecimal shares,
                            BigDecimal pricePerShare,
                            BigDecimal exchangeRate,
                            BigDecimal fees,
                            String currency,
                            String notes,
                            boolean deleted,
                            UUID linkedCurrencyTransactionId) {
        if (ticker == null || ticker.isBlank()) {
            throw new ServiceException(Errors.StockTransaction.INVALID_INPUT, "Ticker is required");
        }
        if (transactionType == null) {
            throw new ServiceException(Errors.StockTransaction.INVALID_INPUT, "Transaction type is required");
        }
        if (transactionDate == null) {
            throw new ServiceException(Errors.StockTransaction.INVALID_INPUT, "Transaction date is required");
        }
        if (shares == null) {
            throw new ServiceException(Errors.StockTransaction.INVALID_INPUT, "Shares are required");
        }
        if (transactionType != StockTransactionType.ADJUSTMENT && shares.compareTo(BigDecimal.ZERO) <= 0) {
            throw new ServiceException(Errors.StockTransaction.INVALID_INPUT, "Shares must be positive");
        }
        if (pricePerShare != null && pricePerShare.compareTo(BigDecimal.ZERO) < 0) {
            throw new ServiceException(Errors.StockTransaction.INVALID_INPUT, "Price cannot be negative");
        }
        if (exchangeRate != null && exchangeRate.compareTo(BigDecimal.ZERO) <= 0) {
            throw new ServiceException(Errors.StockTransaction.INVALID_INPUT, "Exchange rate must be positive");
        }
        if (fees != null && fees.compareTo(BigDecimal.ZERO) < 0) {
            throw new ServiceException(Errors.StockTransaction.INVALID_INPUT, "Fees cannot be negative");
        }

        this.id = id != null ? id : UUID.randomUUID();
        this.portfolioId = portfolioId;
        this.transactionDate = transactionDate;
        this.ticker = ticker.trim().toUpperCase(Locale.ROOT);
        this.market = market != null ? market : StockMarket.US;
        this.transactionType = transactionType;
        this.shares = shares.setScale(4, RoundingMode.HALF_EVEN);
        this.pricePerShare = pricePerShare != null ? pricePerShare : BigDecimal.ZERO;
        this.exchangeRate = exchangeRate;
        this.fees = fees != null ? fees : BigDecimal.ZERO;
        this.currency = currency != null ? currency.trim().toUpperCase(Locale.ROOT) : null;
        this.notes = notes;
        this.deleted = deleted;
        this.linkedCurrencyTransactionId = linkedCurrencyTransactionId;
    }

    public boolean isBuy() {
        return transactionType == StockTransactionType.BUY;
    }

    public boolean isSell() {
        return transactionType == StockTransactionType.SELL;
    }

    /**
     * Source-currency amount of the trade before fees, floored for Taiwan-market tickers.
     */
    public BigDecimal getSubtotalSource() {
        return DecimalMath.tradeSubtotal(shares, pricePerShare, market.isTaiwan());
    }

    public void linkCurrencyTransaction(UUID currencyTransactionId) {
        this.linkedCurrencyTransactionId = currencyTransactionId;
    }
}
