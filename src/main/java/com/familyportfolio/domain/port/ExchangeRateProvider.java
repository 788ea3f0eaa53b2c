package com.familyportfolio.domain.port;

import io.smallrye.mutiny.Uni;

import java.math.BigDecimal;

/**
 * Port interface for exchange-rate sources
 */
public interface ExchangeRateProvider {

    /**
     * Gets the current rate converting one unit of {@code fromCurrency} into {@code toCurrency}
     * @param fromCurrency ISO code of the currency being converted (e.g., "USD")
     * @param toCurrency ISO code of the target currency (e.g., "TWD")
     */
    Uni<BigDecimal> getExchangeRate(String fromCurrency, String toCurrency);
}
