package com.familyportfolio.application.service;

import com.familyportfolio.domain.model.CurrencyLedger;
import com.familyportfolio.domain.model.CurrencyTransaction;
import com.familyportfolio.domain.model.Portfolio;
import com.familyportfolio.domain.model.ReturnCashFlowEvent;
import com.familyportfolio.domain.model.StockTransaction;
import com.familyportfolio.domain.port.CurrencyLedgerRepository;
import com.familyportfolio.domain.port.CurrencyTransactionRepository;
import com.familyportfolio.domain.port.StockTransactionRepository;
import com.familyportfolio.domain.service.cashflow.ReturnCashFlowStrategy;
import com.familyportfolio.domain.service.cashflow.ReturnCashFlowStrategyProvider;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.List;

/**
 * Loads what the return calculations need for a portfolio and extracts its external cash flows
 * with the applicable strategy
 */
@ApplicationScoped
@Slf4j
public class PortfolioCashFlowService {

    private final StockTransactionRepository stockTransactionRepository;
    private final CurrencyLedgerRepository ledgerRepository;
    private final CurrencyTransactionRepository currencyTransactionRepository;
    private final ReturnCashFlowStrategyProvider strategyProvider;

    public PortfolioCashFlowService(StockTransactionRepository stockTransactionRepository,
                                    CurrencyLedgerRepository ledgerRepository,
                                    CurrencyTransactionRepository currencyTransactionRepository,
                                    ReturnCashFlowStrategyProvider strategyProvider) {
        this.stockTransactionRepository = stockTransactionRepository;
        this.ledgerRepository = ledgerRepository;
        this.currencyTransactionRepository = currencyTransactionRepository;
        this.strategyProvider = strategyProvider;
    }

    public Uni<PortfolioCashFlows> loadCashFlows(Portfolio portfolio, LocalDate fromDate, LocalDate toDate) {
        Uni<List<CurrencyTransaction>> ledgerTransactions = portfolio.hasBoundLedger()
                ? currencyTransactionRepository.findByLedgerId(portfolio.getBoundLedgerId())
                : Uni.createFrom().item(List.<CurrencyTransaction>of());

        return Uni.combine().all()
                .unis(stockTransactionRepository.findByPortfolioId(portfolio.getId()),
                        ledgerRepository.findByUserId(portfolio.getUserId()),
                        ledgerTransactions)
                .asTuple()
                .map(tuple -> {
                    List<StockTransaction> stockTransactions = tuple.getItem1();
                    List<CurrencyLedger> ledgers = tuple.getItem2();
                    ReturnCashFlowStrategy strategy = strategyProvider.getStrategy(portfolio, ledgers);

                    List<ReturnCashFlowEvent> events = strategy.getCashFlowEvents(
                            portfolio, fromDate, toDate, stockTransactions, ledgers, tuple.getItem3());
                    log.debug("Portfolio {} uses {} cash flows: {} events between {} and {}",
                            portfolio.getId(), strategy.name(), events.size(), fromDate, toDate);
                    return new PortfolioCashFlows(strategy.name(), events, stockTransactions);
                });
    }

    public record PortfolioCashFlows(String strategy,
                                     List<ReturnCashFlowEvent> events,
                                     List<StockTransaction> stockTransactions) {
    }
}
