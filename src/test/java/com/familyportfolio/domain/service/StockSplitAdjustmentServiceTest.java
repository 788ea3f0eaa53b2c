package com.familyportfolio.domain.service;

import com.familyportfolio.domain.model.AdjustedTransactionValues;
import com.familyportfolio.domain.model.StockMarket;
import com.familyportfolio.domain.model.StockSplit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StockSplitAdjustmentServiceTest {

    private StockSplitAdjustmentService service;
    private List<StockSplit> splits;

    @BeforeEach
    void setUp() {
        service = new StockSplitAdjustmentService();
        splits = List.of(
                new StockSplit("0050", StockMarket.TW, LocalDate.of(2025, 6, 18), new BigDecimal("4"), "1:4 split"),
                new StockSplit("TEST", StockMarket.US, LocalDate.of(2022, 3, 1), new BigDecimal("2")),
                new StockSplit("TEST", StockMarket.US, LocalDate.of(2023, 9, 1), new BigDecimal("3"))
        );
    }

    @Test
    void testGetAdjustedValues_BeforeSplit_PreservesTotalCost() {
        // When
        AdjustedTransactionValues values = service.getAdjustedValues(new BigDecimal("10"), new BigDecimal("160"),
                "0050", StockMarket.TW, LocalDate.of(2024, 1, 15), splits);

        // Then
        assertEquals(0, new BigDecimal("40").compareTo(values.adjustedShares()));
        assertEquals(0, new BigDecimal("40").compareTo(values.adjustedPrice()));
        assertEquals(0, new BigDecimal("1600").compareTo(values.adjustedShares().multiply(values.adjustedPrice())));
        assertTrue(values.hasSplitAdjustment());
    }

    @Test
    void testGetAdjustedPrice_NonExactDivision_NotFloored() {
        // When
        BigDecimal adjustedPrice = service.getAdjustedPrice(new BigDecimal("163"), "0050", StockMarket.TW,
                LocalDate.of(2024, 1, 15), splits);

        // Then
        assertEquals(0, new BigDecimal("40.75").compareTo(adjustedPrice));
    }

    @Test
    void testGetCumulativeSplitRatio_OnSplitDate_NotAffected() {
        // When
        BigDecimal ratio = service.getCumulativeSplitRatio("0050", StockMarket.TW, LocalDate.of(2025, 6, 18), splits);

        // Then
        assertEquals(0, BigDecimal.ONE.compareTo(ratio));
    }

    @Test
    void testGetCumulativeSplitRatio_MultipleLaterSplits_Compound() {
        // When
        BigDecimal beforeBoth = service.getCumulativeSplitRatio("TEST", StockMarket.US, LocalDate.of(2021, 1, 1), splits);
        BigDecimal betweenSplits = service.getCumulativeSplitRatio("TEST", StockMarket.US, LocalDate.of(2022, 6, 1), splits);

        // Then
        assertEquals(0, new BigDecimal("6").compareTo(beforeBoth));
        assertEquals(0, new BigDecimal("3").compareTo(betweenSplits));
    }

    @Test
    void testGetCumulativeSplitRatio_OtherMarket_NotAffected() {
        // When
        BigDecimal ratio = service.getCumulativeSplitRatio("0050", StockMarket.US, LocalDate.of(2024, 1, 15), splits);

        // Then
        assertEquals(0, BigDecimal.ONE.compareTo(ratio));
    }

    @Test
    void testGetAdjustedShares_NoSplits_Unchanged() {
        // When
        BigDecimal shares = service.getAdjustedShares(new BigDecimal("7"), "AAPL", StockMarket.US, LocalDate.of(2024, 1, 1), List.of());

        // Then
        assertEquals(0, new BigDecimal("7").compareTo(shares));
    }

    @Test
    void testDetectMarket() {
        assertEquals(StockMarket.TW, service.detectMarket("2330"));
        assertEquals(StockMarket.TW, service.detectMarket("00878"));
        assertEquals(StockMarket.UK, service.detectMarket("VWRA.L"));
        assertEquals(StockMarket.US, service.detectMarket("AAPL"));
        assertEquals(StockMarket.US, service.detectMarket(" "));
        assertEquals(StockMarket.US, service.detectMarket(null));
    }
}
