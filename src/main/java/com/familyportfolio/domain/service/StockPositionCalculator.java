package com.familyportfolio.domain.service;

import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import com.familyportfolio.domain.model.Position;
import com.familyportfolio.domain.model.StockSplit;
import com.familyportfolio.domain.model.StockTransaction;
import com.familyportfolio.domain.model.StockTransactionType;
import com.familyportfolio.domain.model.UnrealizedPnl;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds positions from stock transaction histories and values them.
 * <p>
 * Transactions are replayed in the order given; callers pass them chronologically.
 */
public class StockPositionCalculator {

    private final StockSplitAdjustmentService splitAdjustmentService;

    public StockPositionCalculator(StockSplitAdjustmentService splitAdjustmentService) {
        this.splitAdjustmentService = splitAdjustmentService;
    }

    public Position calculatePosition(String ticker, List<StockTransaction> transactions) {
        Objects.requireNonNull(ticker, "ticker must not be null");
        Objects.requireNonNull(transactions, "transactions must not be null");

        Position position = new Position(ticker);
        for (StockTransaction transaction : transactionsFor(ticker, transactions)) {
            position.applyTransaction(transaction);
        }
        return position;
    }

    /**
     * Replays with split-adjusted share counts. Cost is unaffected by a split, so only the share
     * side of each trade changes.
     */
    public Position calculatePositionWithSplitAdjustments(String ticker,
                                                          List<StockTransaction> transactions,
                                                          List<StockSplit> splits) {
        Objects.requireNonNull(ticker, "ticker must not be null");
        Objects.requireNonNull(transactions, "transactions must not be null");
        Objects.requireNonNull(splits, "splits must not be null");

        Position position = new Position(ticker);
        for (StockTransaction transaction : transactionsFor(ticker, transactions)) {
            BigDecimal adjustedShares = splitAdjustmentService.getAdjustedShares(
                    transaction.getShares(), transaction.getTicker(), transaction.getMarket(),
                    transaction.getTransactionDate(), splits);

            switch (transaction.getTransactionType()) {
                case BUY -> position.applyBuy(adjustedShares, transaction.getSubtotalSource(),
                        transaction.getFees(), transaction.getExchangeRate());
                case SELL -> position.applySell(adjustedShares);
                case ADJUSTMENT -> position.applyAdjustment(adjustedShares,
                        transaction.getShares().multiply(transaction.getPricePerShare()),
                        transaction.getExchangeRate());
                // registered splits already cover the share change
                case SPLIT -> {
                }
            }
        }
        return position;
    }

    /**
     * One position per ticker, in the order tickers first appear.
     */
    public List<Position> recalculateAllPositions(List<StockTransaction> transactions) {
        Objects.requireNonNull(transactions, "transactions must not be null");

        Set<String> tickers = new LinkedHashSet<>();
        transactions.stream()
                .filter(transaction -> !transaction.isDeleted())
                .forEach(transaction -> tickers.add(transaction.getTicker()));

        List<Position> positions = new ArrayList<>();
        for (String ticker : tickers) {
            positions.add(calculatePosition(ticker, transactions));
        }
        return positions;
    }

    public UnrealizedPnl calculateUnrealizedPnl(Position position, BigDecimal currentPrice, BigDecimal currentExchangeRate) {
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(currentPrice, "currentPrice must not be null");

        if (!position.hasShares()) {
            return UnrealizedPnl.zero();
        }

        BigDecimal currentValueHome = position.getTotalShares()
                .multiply(currentPrice)
                .multiply(DecimalMath.orOne(currentExchangeRate));
        BigDecimal pnl = currentValueHome.subtract(position.getTotalCostHome());
        BigDecimal percentage = DecimalMath.isPositive(position.getTotalCostHome())
                ? DecimalMath.divide(pnl, position.getTotalCostHome()).multiply(DecimalMath.HUNDRED)
                : BigDecimal.ZERO;

        return new UnrealizedPnl(currentValueHome, pnl, percentage);
    }

    /**
     * Realized gain of a sale against the position held just before it. Taiwan-market proceeds
     * drop the fractional dollar of the subtotal before fees and conversion.
     */
    public BigDecimal calculateRealizedPnl(Position positionBeforeSale, StockTransaction sellTransaction) {
        Objects.requireNonNull(positionBeforeSale, "positionBeforeSale must not be null");
        Objects.requireNonNull(sellTransaction, "sellTransaction must not be null");

        if (sellTransaction.getTransactionType() != StockTransactionType.SELL) {
            throw new ServiceException(Errors.Position.NOT_A_SELL_TRANSACTION,
                    "Realized P&L requires a sell transaction, got " + sellTransaction.getTransactionType());
        }

        BigDecimal costBasis = sellTransaction.getShares().multiply(positionBeforeSale.getAverageCostPerShareHome());
        BigDecimal proceeds = calculateNetProceedsSource(sellTransaction)
                .multiply(DecimalMath.orOne(sellTransaction.getExchangeRate()));

        return proceeds.subtract(costBasis);
    }

    /**
     * Sale subtotal less fees, in the stock's currency.
     */
    public BigDecimal calculateNetProceedsSource(StockTransaction sellTransaction) {
        return sellTransaction.getSubtotalSource().subtract(sellTransaction.getFees());
    }

    private List<StockTransaction> transactionsFor(String ticker, List<StockTransaction> transactions) {
        return transactions.stream()
                .filter(transaction -> !transaction.isDeleted())
                .filter(transaction -> transaction.getTicker().equalsIgnoreCase(ticker))
                .toList();
    }
}
