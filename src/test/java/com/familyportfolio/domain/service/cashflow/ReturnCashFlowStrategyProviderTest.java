package com.familyportfolio.domain.service.cashflow;

import com.familyportfolio.domain.model.CurrencyLedger;
import com.familyportfolio.domain.model.CurrencyTransactionType;
import com.familyportfolio.domain.model.Portfolio;
import com.familyportfolio.domain.model.StockMarket;
import com.familyportfolio.domain.model.StockTransaction;
import com.familyportfolio.domain.model.StockTransactionType;
import com.familyportfolio.domain.service.TransactionClassificationPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ReturnCashFlowStrategyProviderTest {

    private ReturnCashFlowStrategyProvider provider;
    private CurrencyLedger ledger;

    @BeforeEach
    void setUp() {
        provider = new ReturnCashFlowStrategyProvider(
                new CurrencyLedgerCashFlowStrategy(new TransactionClassificationPolicy()),
                new StockTransactionCashFlowStrategy());
        ledger = new CurrencyLedger(UUID.randomUUID(), "USD", "TWD");
    }

    @Test
    void testGetStrategy_ActiveBoundLedger_UsesLedger() {
        // Given
        Portfolio portfolio = new Portfolio(null, null, "USD", "TWD", ledger.getId());

        // When
        ReturnCashFlowStrategy strategy = provider.getStrategy(portfolio, List.of(ledger));

        // Then
        assertEquals("CurrencyLedger", strategy.name());
    }

    @Test
    void testGetStrategy_NoBoundLedger_FallsBackToStockTransactions() {
        // Given
        Portfolio portfolio = new Portfolio(null, null, "USD", "TWD", null);

        // When
        ReturnCashFlowStrategy strategy = provider.getStrategy(portfolio, List.of(ledger));

        // Then
        assertEquals(StockTransactionCashFlowStrategy.NAME, strategy.name());
    }

    @Test
    void testGetStrategy_InactiveBoundLedger_FallsBackToStockTransactions() {
        // Given
        ledger.deactivate();
        Portfolio portfolio = new Portfolio(null, null, "USD", "TWD", ledger.getId());

        // When
        ReturnCashFlowStrategy strategy = provider.getStrategy(portfolio, List.of(ledger));

        // Then
        assertEquals(StockTransactionCashFlowStrategy.NAME, strategy.name());
    }

    @Test
    void testStockTransactionStrategy_TradesAreNeverExternal() {
        // Given
        StockTransaction buy = StockTransaction.builder()
                .ticker("AAPL")
                .market(StockMarket.US)
                .transactionType(StockTransactionType.BUY)
                .shares(new BigDecimal("10"))
                .pricePerShare(new BigDecimal("150"))
                .transactionDate(LocalDate.of(2024, 1, 1))
                .build();
        Portfolio portfolio = new Portfolio(null, null, "USD", "TWD", null);

        // When & Then
        assertTrue(new StockTransactionCashFlowStrategy().getCashFlowEvents(portfolio, null, null,
                List.of(buy), List.of(), List.of(CurrencyLedgerCashFlowStrategyTest.tx(
                        ledger.getId(), CurrencyTransactionType.DEPOSIT, "100", LocalDate.of(2024, 1, 1), false))).isEmpty());
    }
}
