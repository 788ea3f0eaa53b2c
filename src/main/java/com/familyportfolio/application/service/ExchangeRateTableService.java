package com.familyportfolio.application.service;

import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves the home-currency rates for a set of currencies in one go
 */
@ApplicationScoped
@Slf4j
public class ExchangeRateTableService {

    private final ExchangeRateFetchService exchangeRateFetchService;

    public ExchangeRateTableService(ExchangeRateFetchService exchangeRateFetchService) {
        this.exchangeRateFetchService = exchangeRateFetchService;
    }

    /**
     * Fails as soon as one rate cannot be obtained
     */
    public Uni<Map<String, BigDecimal>> fetchRates(Collection<String> currencies) {
        Set<String> codes = normalize(currencies);
        if (codes.isEmpty()) {
            return Uni.createFrom().item(Map.of());
        }

        List<Uni<RateEntry>> lookups = codes.stream()
                .map(code -> exchangeRateFetchService.getExchangeRate(code)
                        .map(rate -> new RateEntry(code, rate)))
                .toList();

        return Uni.join().all(lookups).andFailFast()
                .map(ExchangeRateTableService::toMap);
    }

    /**
     * Leaves out the currencies whose rate cannot be obtained
     */
    public Uni<Map<String, BigDecimal>> fetchAvailableRates(Collection<String> currencies) {
        Set<String> codes = normalize(currencies);
        if (codes.isEmpty()) {
            return Uni.createFrom().item(Map.of());
        }

        List<Uni<RateEntry>> lookups = codes.stream()
                .map(code -> exchangeRateFetchService.getExchangeRate(code)
                        .map(rate -> new RateEntry(code, rate))
                        .onFailure().recoverWithItem(throwable -> {
                            log.warn("Exchange rate for {} unavailable, excluding it: {}", code, throwable.getMessage());
                            return new RateEntry(code, null);
                        }))
                .toList();

        return Uni.join().all(lookups).andCollectFailures()
                .map(ExchangeRateTableService::toMap);
    }

    private static Set<String> normalize(Collection<String> currencies) {
        Set<String> codes = new LinkedHashSet<>();
        currencies.stream()
                .filter(Objects::nonNull)
                .map(code -> code.trim().toUpperCase(Locale.ROOT))
                .forEach(codes::add);
        return codes;
    }

    private static Map<String, BigDecimal> toMap(List<RateEntry> entries) {
        Map<String, BigDecimal> rates = new HashMap<>();
        entries.stream()
                .filter(entry -> entry.rate() != null)
                .forEach(entry -> rates.put(entry.currency(), entry.rate()));
        return rates;
    }

    private record RateEntry(String currency, BigDecimal rate) {
    }
}
