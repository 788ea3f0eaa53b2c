package com.familyportfolio.domain.service;

import com.familyportfolio.domain.model.CashFlow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class XirrCalculatorTest {

    private static final LocalDate DAY_ZERO = LocalDate.of(2023, 1, 1);
    private static final LocalDate ONE_YEAR_LATER = LocalDate.of(2024, 1, 1);

    private XirrCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new XirrCalculator();
    }

    @Test
    void testCalculateXirr_TenPercentGainOverOneYear() {
        // When
        Optional<BigDecimal> result = calculator.calculateXirr(List.of(
                flow("-1000", DAY_ZERO),
                flow("1100", ONE_YEAR_LATER)));

        // Then
        assertTrue(result.isPresent());
        assertEquals(0.10, result.get().doubleValue(), 0.0001);
    }

    @Test
    void testCalculateXirr_TenPercentLoss() {
        // When
        Optional<BigDecimal> result = calculator.calculateXirr(List.of(
                flow("-1000", DAY_ZERO),
                flow("900", ONE_YEAR_LATER)));

        // Then
        assertEquals(-0.10, result.orElseThrow().doubleValue(), 0.0001);
    }

    @Test
    void testCalculateXirr_DoublingInOneYear() {
        // When
        Optional<BigDecimal> result = calculator.calculateXirr(List.of(
                flow("-1000", DAY_ZERO),
                flow("2000", ONE_YEAR_LATER)));

        // Then
        assertEquals(1.0, result.orElseThrow().doubleValue(), 0.0001);
    }

    @Test
    void testCalculateXirr_BreakEven_IsZero() {
        // When
        Optional<BigDecimal> result = calculator.calculateXirr(List.of(
                flow("-1000", DAY_ZERO),
                flow("1000", LocalDate.of(2023, 7, 1))));

        // Then
        assertEquals(0.0, result.orElseThrow().doubleValue(), 0.0001);
    }

    @Test
    void testCalculateXirr_LargeShortTermGain_AnnualizesAboveThousandPercent() {
        // When
        Optional<BigDecimal> result = calculator.calculateXirr(List.of(
                flow("-1000", DAY_ZERO),
                flow("1500", DAY_ZERO.plusDays(20))));

        // Then
        assertTrue(result.isPresent());
        assertTrue(result.get().compareTo(BigDecimal.TEN) > 0);
    }

    @Test
    void testCalculateXirr_InputOrderDoesNotMatter() {
        // Given
        List<CashFlow> ordered = List.of(
                flow("-1000", DAY_ZERO),
                flow("-500", LocalDate.of(2023, 6, 1)),
                flow("1700", ONE_YEAR_LATER));
        List<CashFlow> shuffled = List.of(ordered.get(2), ordered.get(0), ordered.get(1));

        // When & Then
        assertEquals(calculator.calculateXirr(ordered), calculator.calculateXirr(shuffled));
    }

    @Test
    void testCalculateXirr_ResultHasSixDecimals() {
        // When
        BigDecimal result = calculator.calculateXirr(List.of(
                flow("-1000", DAY_ZERO),
                flow("1234.56", ONE_YEAR_LATER))).orElseThrow();

        // Then
        assertEquals(6, result.scale());
    }

    @Test
    void testCalculateXirr_FewerThanTwoFlows_ReturnsEmpty() {
        assertTrue(calculator.calculateXirr(List.of()).isEmpty());
        assertTrue(calculator.calculateXirr(List.of(flow("-1000", DAY_ZERO))).isEmpty());
    }

    @Test
    void testCalculateXirr_NoSignChange_ReturnsEmpty() {
        assertTrue(calculator.calculateXirr(List.of(
                flow("-1000", DAY_ZERO),
                flow("-100", ONE_YEAR_LATER))).isEmpty());
        assertTrue(calculator.calculateXirr(List.of(
                flow("1000", DAY_ZERO),
                flow("100", ONE_YEAR_LATER))).isEmpty());
    }

    private static CashFlow flow(String amount, LocalDate date) {
        return new CashFlow(new BigDecimal(amount), date);
    }
}
