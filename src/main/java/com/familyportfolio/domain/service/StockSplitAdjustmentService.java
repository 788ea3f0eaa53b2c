package com.familyportfolio.domain.service;

import com.familyportfolio.domain.model.AdjustedTransactionValues;
import com.familyportfolio.domain.model.StockMarket;
import com.familyportfolio.domain.model.StockSplit;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Restates historical shares and prices in post-split terms.
 * <p>
 * A trade is affected by every split of the same symbol and market dated strictly after it; a
 * trade on the split date is already in post-split units. Adjusted shares times adjusted price
 * always equals the original {@code shares * price}.
 */
public class StockSplitAdjustmentService {

    private static final String UK_SUFFIX = ".L";

    public BigDecimal getCumulativeSplitRatio(String symbol, StockMarket market, LocalDate transactionDate, List<StockSplit> splits) {
        Objects.requireNonNull(splits, "splits must not be null");
        if (symbol == null || transactionDate == null) {
            return BigDecimal.ONE;
        }

        return splits.stream()
                .filter(split -> split.appliesTo(symbol, market))
                .filter(split -> split.splitDate().isAfter(transactionDate))
                .sorted(Comparator.comparing(StockSplit::splitDate))
                .map(StockSplit::splitRatio)
                .reduce(BigDecimal.ONE, BigDecimal::multiply);
    }

    public BigDecimal getAdjustedShares(BigDecimal shares, String symbol, StockMarket market, LocalDate transactionDate, List<StockSplit> splits) {
        return shares.multiply(getCumulativeSplitRatio(symbol, market, transactionDate, splits));
    }

    public BigDecimal getAdjustedPrice(BigDecimal price, String symbol, StockMarket market, LocalDate transactionDate, List<StockSplit> splits) {
        BigDecimal ratio = getCumulativeSplitRatio(symbol, market, transactionDate, splits);
        if (ratio.signum() == 0) {
            return price;
        }
        return DecimalMath.divide(price, ratio);
    }

    public AdjustedTransactionValues getAdjustedValues(BigDecimal shares,
                                                       BigDecimal price,
                                                       String symbol,
                                                       StockMarket market,
                                                       LocalDate transactionDate,
                                                       List<StockSplit> splits) {
        BigDecimal ratio = getCumulativeSplitRatio(symbol, market, transactionDate, splits);
        boolean adjusted = ratio.compareTo(BigDecimal.ONE) != 0;
        BigDecimal adjustedPrice = ratio.signum() == 0 ? price : DecimalMath.divide(price, ratio);

        return new AdjustedTransactionValues(
                shares,
                shares.multiply(ratio),
                price,
                adjustedPrice,
                ratio,
                adjusted);
    }

    /**
     * Leading digit means a Taiwan listing, a {@code .L} suffix a London listing, anything else
     * is treated as US.
     */
    public StockMarket detectMarket(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return StockMarket.US;
        }
        String trimmed = symbol.trim();
        if (Character.isDigit(trimmed.charAt(0))) {
            return StockMarket.TW;
        }
        if (trimmed.toUpperCase(Locale.ROOT).endsWith(UK_SUFFIX)) {
            return StockMarket.UK;
        }
        return StockMarket.US;
    }
}
