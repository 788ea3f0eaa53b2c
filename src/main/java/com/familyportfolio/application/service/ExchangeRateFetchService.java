package com.familyportfolio.application.service;

import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import com.familyportfolio.domain.port.ExchangeRateProvider;
import com.familyportfolio.infrastructure.config.CalculationConfig;
import io.quarkus.cache.CacheResult;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * Service responsible for fetching exchange rates into the home currency with fallback logic
 * Tries the primary provider first, then falls back to the secondary provider
 */
@ApplicationScoped
@Slf4j
public class ExchangeRateFetchService {

    private final ExchangeRateProvider primaryProvider;
    private final ExchangeRateProvider secondaryProvider;
    private final CalculationConfig config;

    public ExchangeRateFetchService(
            @Named("primaryRates") ExchangeRateProvider primaryProvider,
            @Named("secondaryRates") ExchangeRateProvider secondaryProvider,
            CalculationConfig config) {
        this.primaryProvider = primaryProvider;
        this.secondaryProvider = secondaryProvider;
        this.config = config;
    }

    /**
     * Gets the rate converting one unit of {@code currency} into the home currency
     * @param currency ISO currency code
     * @return Rate to the home currency, 1 for the home currency itself
     */
    @CacheResult(cacheName = "exchange-rates")
    public Uni<BigDecimal> getExchangeRate(String currency) {
        String homeCurrency = config.homeCurrency();
        if (currency == null || currency.isBlank()) {
            return Uni.createFrom().failure(new ServiceException(Errors.ExchangeRate.INVALID_INPUT, "Currency is required"));
        }
        if (homeCurrency.equalsIgnoreCase(currency)) {
            return Uni.createFrom().item(BigDecimal.ONE);
        }

        log.debug("Fetching exchange rate {} -> {}", currency, homeCurrency);

        return primaryProvider.getExchangeRate(currency, homeCurrency)
                .onItem().transform(rate -> requirePositive(rate, currency))
                .onItem().invoke(rate ->
                    log.info("Retrieved exchange rate {} for {} -> {} from primary provider", rate, currency, homeCurrency)
                )
                .onFailure().recoverWithUni(primaryError -> {
                    log.warn("Primary exchange-rate provider failed for {}, attempting secondary provider", currency, primaryError);

                    return secondaryProvider.getExchangeRate(currency, homeCurrency)
                            .onItem().transform(rate -> requirePositive(rate, currency))
                            .onItem().invoke(rate ->
                                log.info("Retrieved exchange rate {} for {} -> {} from secondary provider", rate, currency, homeCurrency)
                            )
                            .onFailure().invoke(secondaryError ->
                                log.error("Both exchange-rate providers failed for {}", currency, secondaryError)
                            );
                });
    }

    private static BigDecimal requirePositive(BigDecimal rate, String currency) {
        if (rate == null || rate.signum() <= 0) {
            throw new ServiceException(Errors.ExchangeRate.RATE_NOT_FOUND, "No usable exchange rate for " + currency);
        }
        return rate;
    }
}
