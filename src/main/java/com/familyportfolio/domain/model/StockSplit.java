package com.familyportfolio.domain.model;

import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;

/**
 * A registered split. A ratio of 4 means every share held before {@code splitDate} became four.
 */
public record StockSplit(String symbol,
                         StockMarket market,
                         LocalDate splitDate,
                         BigDecimal splitRatio,
                         String description) {

    public StockSplit {
        if (symbol == null || symbol.isBlank()) {
            throw new ServiceException(Errors.StockSplit.INVALID_INPUT, "Symbol is required");
        }
        if (symbol.length() > 20) {
            throw new ServiceException(Errors.StockSplit.INVALID_INPUT, "Symbol cannot exceed 20 characters");
        }
        if (market == null) {
            throw new ServiceException(Errors.StockSplit.INVALID_INPUT, "Market is required");
        }
        if (splitDate == null) {
            throw new ServiceException(Errors.StockSplit.INVALID_INPUT, "Split date is required");
        }
        if (splitRatio == null || splitRatio.compareTo(BigDecimal.ZERO) <= 0) {
            throw new ServiceException(Errors.StockSplit.INVALID_INPUT, "Split ratio must be greater than 0");
        }
        symbol = symbol.trim().toUpperCase(Locale.ROOT);
    }

    public StockSplit(String symbol, StockMarket market, LocalDate splitDate, BigDecimal splitRatio) {
        this(symbol, market, splitDate, splitRatio, null);
    }

    public boolean appliesTo(String ticker, StockMarket tickerMarket) {
        return symbol.equalsIgnoreCase(ticker) && market == tickerMarket;
    }
}
