package com.familyportfolio.infrastructure.config;

import com.familyportfolio.domain.service.AvailableFundsService;
import com.familyportfolio.domain.service.CurrencyLedgerService;
import com.familyportfolio.domain.service.InterestEstimationService;
import com.familyportfolio.domain.service.ReturnCalculator;
import com.familyportfolio.domain.service.StockPositionCalculator;
import com.familyportfolio.domain.service.StockSplitAdjustmentService;
import com.familyportfolio.domain.service.StockTransactionLinkingService;
import com.familyportfolio.domain.service.TotalAssetsService;
import com.familyportfolio.domain.service.TransactionClassificationPolicy;
import com.familyportfolio.domain.service.XirrCalculator;
import com.familyportfolio.domain.service.cashflow.CurrencyLedgerCashFlowStrategy;
import com.familyportfolio.domain.service.cashflow.ReturnCashFlowStrategyProvider;
import com.familyportfolio.domain.service.cashflow.StockTransactionCashFlowStrategy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * Exposes the framework-free calculation services as CDI beans
 */
@ApplicationScoped
public class CalculationServiceProducer {

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Produces
    @Singleton
    TransactionClassificationPolicy transactionClassificationPolicy() {
        return new TransactionClassificationPolicy();
    }

    @Produces
    @Singleton
    StockSplitAdjustmentService stockSplitAdjustmentService() {
        return new StockSplitAdjustmentService();
    }

    @Produces
    @Singleton
    StockPositionCalculator stockPositionCalculator(StockSplitAdjustmentService splitAdjustmentService) {
        return new StockPositionCalculator(splitAdjustmentService);
    }

    @Produces
    @Singleton
    CurrencyLedgerService currencyLedgerService(TransactionClassificationPolicy policy) {
        return new CurrencyLedgerService(policy);
    }

    @Produces
    @Singleton
    StockTransactionLinkingService stockTransactionLinkingService(TransactionClassificationPolicy policy,
                                                                  StockPositionCalculator positionCalculator) {
        return new StockTransactionLinkingService(policy, positionCalculator);
    }

    @Produces
    @Singleton
    ReturnCashFlowStrategyProvider returnCashFlowStrategyProvider(TransactionClassificationPolicy policy) {
        return new ReturnCashFlowStrategyProvider(
                new CurrencyLedgerCashFlowStrategy(policy),
                new StockTransactionCashFlowStrategy());
    }

    @Produces
    @Singleton
    ReturnCalculator returnCalculator() {
        return new ReturnCalculator();
    }

    @Produces
    @Singleton
    XirrCalculator xirrCalculator() {
        return new XirrCalculator();
    }

    @Produces
    @Singleton
    InterestEstimationService interestEstimationService() {
        return new InterestEstimationService();
    }

    @Produces
    @Singleton
    TotalAssetsService totalAssetsService(InterestEstimationService interestEstimationService, CalculationConfig config) {
        return new TotalAssetsService(interestEstimationService, config.homeCurrency());
    }

    @Produces
    @Singleton
    AvailableFundsService availableFundsService(CalculationConfig config, Clock clock) {
        return new AvailableFundsService(config.homeCurrency(), clock);
    }
}
