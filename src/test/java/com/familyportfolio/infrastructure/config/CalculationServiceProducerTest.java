package com.familyportfolio.infrastructure.config;

import com.familyportfolio.domain.model.BankAccount;
import com.familyportfolio.domain.model.CurrencyLedger;
import com.familyportfolio.domain.model.Portfolio;
import com.familyportfolio.domain.model.TotalAssetsSummary;
import com.familyportfolio.domain.service.AvailableFundsService;
import com.familyportfolio.domain.service.StockTransactionLinkingService;
import com.familyportfolio.domain.service.TotalAssetsService;
import com.familyportfolio.domain.service.TransactionClassificationPolicy;
import com.familyportfolio.domain.service.cashflow.ReturnCashFlowStrategyProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CalculationServiceProducerTest {

    private CalculationServiceProducer producer;
    private CalculationConfig config;

    @BeforeEach
    void setUp() {
        producer = new CalculationServiceProducer();
        config = mock(CalculationConfig.class);
        when(config.homeCurrency()).thenReturn("TWD");
    }

    @Test
    void testTotalAssetsService_UsesConfiguredHomeCurrency() {
        // Given
        TotalAssetsService service = producer.totalAssetsService(producer.interestEstimationService(), config);
        BankAccount account = BankAccount.builder()
                .bankName("Local")
                .totalAssets(new BigDecimal("1000"))
                .currency("TWD")
                .build();

        // When
        TotalAssetsSummary summary = service.calculate(BigDecimal.ZERO, List.of(account), Map.of());

        // Then
        assertEquals(0, new BigDecimal("1000").compareTo(summary.bankTotal()));
        verify(config).homeCurrency();
    }

    @Test
    void testReturnCashFlowStrategyProvider_WiresBothStrategies() {
        // Given
        ReturnCashFlowStrategyProvider provider =
                producer.returnCashFlowStrategyProvider(producer.transactionClassificationPolicy());
        CurrencyLedger ledger = new CurrencyLedger(UUID.randomUUID(), "USD", "TWD");
        Portfolio bound = new Portfolio(UUID.randomUUID(), null, "USD", "TWD", ledger.getId());
        Portfolio unbound = new Portfolio(UUID.randomUUID(), null, "USD", "TWD", null);

        // When / Then
        assertEquals("CurrencyLedger", provider.getStrategy(bound, List.of(ledger)).name());
        assertEquals("StockTransaction", provider.getStrategy(unbound, List.of(ledger)).name());
    }

    @Test
    void testProducers_BuildDependentServices() {
        // Given
        TransactionClassificationPolicy policy = producer.transactionClassificationPolicy();
        Clock clock = producer.clock();

        // When
        StockTransactionLinkingService linkingService = producer.stockTransactionLinkingService(
                policy, producer.stockPositionCalculator(producer.stockSplitAdjustmentService()));
        AvailableFundsService availableFundsService = producer.availableFundsService(config, clock);

        // Then
        assertNotNull(linkingService);
        assertNotNull(availableFundsService);
        assertNotNull(producer.currencyLedgerService(policy));
        assertNotNull(producer.returnCalculator());
        assertNotNull(producer.xirrCalculator());
    }
}
