package com.familyportfolio.application.service;

import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ExchangeRateTableServiceTest {
    private ExchangeRateFetchService fetchService;
    private ExchangeRateTableService service;

    @BeforeEach
    void setUp() {
        fetchService = mock(ExchangeRateFetchService.class);
        service = new ExchangeRateTableService(fetchService);
    }

    @Test
    void testFetchRates_DistinctCurrenciesLookedUpOnce() {
        // Given
        when(fetchService.getExchangeRate("USD")).thenReturn(Uni.createFrom().item(new BigDecimal("31")));
        when(fetchService.getExchangeRate("JPY")).thenReturn(Uni.createFrom().item(new BigDecimal("0.21")));

        // When
        Map<String, BigDecimal> rates = service.fetchRates(Arrays.asList("usd", "USD", " JPY", null))
            .subscribe().withSubscriber(UniAssertSubscriber.create())
            .assertCompleted()
            .getItem();

        // Then
        assertEquals(Map.of("USD", new BigDecimal("31"), "JPY", new BigDecimal("0.21")), rates);
        verify(fetchService, times(1)).getExchangeRate("USD");
        verify(fetchService, times(1)).getExchangeRate("JPY");
    }

    @Test
    void testFetchRates_OneFailure_FailsWhole() {
        // Given
        when(fetchService.getExchangeRate("USD")).thenReturn(Uni.createFrom().item(new BigDecimal("31")));
        when(fetchService.getExchangeRate("EUR")).thenReturn(Uni.createFrom().failure(
            new ServiceException(Errors.ExchangeRate.RATE_NOT_FOUND, "No EUR rate")));

        // When
        Throwable failure = service.fetchRates(List.of("USD", "EUR"))
            .subscribe().withSubscriber(UniAssertSubscriber.create())
            .assertFailed()
            .getFailure();

        // Then
        assertInstanceOf(ServiceException.class, failure);
    }

    @Test
    void testFetchAvailableRates_FailedCurrencyLeftOut() {
        // Given
        when(fetchService.getExchangeRate("USD")).thenReturn(Uni.createFrom().item(new BigDecimal("31")));
        when(fetchService.getExchangeRate("EUR")).thenReturn(Uni.createFrom().failure(
            new ServiceException(Errors.ExchangeRate.RATE_NOT_FOUND, "No EUR rate")));

        // When
        Map<String, BigDecimal> rates = service.fetchAvailableRates(List.of("USD", "EUR"))
            .subscribe().withSubscriber(UniAssertSubscriber.create())
            .assertCompleted()
            .getItem();

        // Then
        assertEquals(Map.of("USD", new BigDecimal("31")), rates);
    }

    @Test
    void testFetchRates_NoCurrencies_EmptyWithoutLookups() {
        // When
        Map<String, BigDecimal> rates = service.fetchRates(List.of())
            .subscribe().withSubscriber(UniAssertSubscriber.create())
            .assertCompleted()
            .getItem();

        // Then
        assertTrue(rates.isEmpty());
        verifyNoInteractions(fetchService);
    }
}
