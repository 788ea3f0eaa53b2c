package com.familyportfolio.domain.model;

import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import com.familyportfolio.domain.service.DecimalMath;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Position derived from a ticker's transaction history using the moving weighted-average cost
 * method. Never persisted; replaying the same ordered history always yields the same position.
 */
@Getter
public class Position {
    private final String ticker;
    private BigDecimal totalShares;
    private BigDecimal totalCostHome;
    private BigDecimal totalCostSource;

    public Position(String ticker) {
        this(ticker, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public Position(String ticker,
                    BigDecimal totalShares,
                    BigDecimal totalCostHome,
                    BigDecimal totalCostSource) {
        this.ticker = ticker;
        this.totalShares = DecimalMath.orZero(totalShares);
        this.totalCostHome = DecimalMath.orZero(totalCostHome);
        this.totalCostSource = DecimalMath.orZero(totalCostSource);
    }

    public boolean hasShares() {
        return totalShares.compareTo(BigDecimal.ZERO) > 0;
    }

    public BigDecimal getAverageCostPerShareHome() {
        return hasShares() ? DecimalMath.divide(totalCostHome, totalShares) : BigDecimal.ZERO;
    }

    public BigDecimal getAverageCostPerShareSource() {
        return hasShares() ? DecimalMath.divide(totalCostSource, totalShares) : BigDecimal.ZERO;
    }

    /**
     * Adds a purchase. {@code subtotalSource} is the already market-rounded {@code shares * price};
     * a missing exchange rate means the trade is already in the home currency.
     */
    public void applyBuy(BigDecimal quantity, BigDecimal subtotalSource, BigDecimal fees, BigDecimal exchangeRate) {
        if (quantity == null || quantity.compareTo(BigDecimal.ZERO) <= 0) {
            throw new ServiceException(Errors.Position.INVALID_INPUT, "Quantity must be positive");
        }
        if (subtotalSource == null || subtotalSource.compareTo(BigDecimal.ZERO) < 0) {
            throw new ServiceException(Errors.Position.INVALID_INPUT, "Subtotal cannot be negative");
        }

        BigDecimal costSource = subtotalSource.add(DecimalMath.orZero(fees));
        BigDecimal costHome = costSource.multiply(DecimalMath.orOne(exchangeRate));

        this.totalShares = totalShares.add(quantity);
        this.totalCostSource = totalCostSource.add(costSource);
        this.totalCostHome = totalCostHome.add(costHome);
    }

    /**
     * Removes shares at the current average cost, so the average of the remaining shares is
     * unchanged. Ignored when nothing is held.
     */
    public void applySell(BigDecimal quantity) {
        if (quantity == null || quantity.compareTo(BigDecimal.ZERO) <= 0) {
            throw new ServiceException(Errors.Position.INVALID_INPUT, "Quantity must be positive");
        }
        if (!hasShares()) {
            return;
        }

        BigDecimal averageCostHome = getAverageCostPerShareHome();
        BigDecimal averageCostSource = getAverageCostPerShareSource();

        this.totalCostHome = totalCostHome.subtract(quantity.multiply(averageCostHome));
        this.totalCostSource = totalCostSource.subtract(quantity.multiply(averageCostSource));
        this.totalShares = totalShares.subtract(quantity);
        clampAtZero();
    }

    public void applySplit(BigDecimal ratio) {
        if (ratio == null || ratio.compareTo(BigDecimal.ZERO) <= 0) {
            throw new ServiceException(Errors.Position.INVALID_INPUT, "Split ratio must be positive");
        }
        this.totalShares = totalShares.multiply(ratio);
    }

    public void applyAdjustment(BigDecimal quantity, BigDecimal costSource, BigDecimal exchangeRate) {
        BigDecimal cost = DecimalMath.orZero(costSource);

        this.totalShares = totalShares.add(DecimalMath.orZero(quantity));
        this.totalCostSource = totalCostSource.add(cost);
        this.totalCostHome = totalCostHome.add(cost.multiply(DecimalMath.orOne(exchangeRate)));
        clampAtZero();
    }

    public void applyTransaction(StockTransaction transaction) {
        switch (transaction.getTransactionType()) {
            case BUY -> applyBuy(transaction.getShares(), transaction.getSubtotalSource(),
                    transaction.getFees(), transaction.getExchangeRate());
            case SELL -> applySell(transaction.getShares());
            case SPLIT -> applySplit(transaction.getShares());
            case ADJUSTMENT -> applyAdjustment(transaction.getShares(),
                    transaction.getShares().multiply(transaction.getPricePerShare()),
                    transaction.getExchangeRate());
        }
    }

    // Shares, cost and average are all zero together
    private void clampAtZero() {
        if (totalShares.compareTo(BigDecimal.ZERO) <= 0) {
            this.totalShares = BigDecimal.ZERO;
            this.totalCostHome = BigDecimal.ZERO;
            this.totalCostSource = BigDecimal.ZERO;
            return;
        }
        this.totalCostHome = DecimalMath.max(totalCostHome, BigDecimal.ZERO);
        this.totalCostSource = DecimalMath.max(totalCostSource, BigDecimal.ZERO);
    }
}
