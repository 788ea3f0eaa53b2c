package com.familyportfolio.application.usecase.performance;

import com.familyportfolio.application.service.PortfolioCashFlowService;
import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import com.familyportfolio.domain.model.CashFlow;
import com.familyportfolio.domain.model.ReturnCashFlowEvent;
import com.familyportfolio.domain.model.StockTransaction;
import com.familyportfolio.domain.port.PortfolioRepository;
import com.familyportfolio.domain.service.StockPositionCalculator;
import com.familyportfolio.domain.service.XirrCalculator;
import com.familyportfolio.domain.service.cashflow.StockTransactionCashFlowStrategy;
import com.familyportfolio.domain.usecase.CalculateXirrUseCase;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Service computing the money-weighted return of a portfolio from the investor's side: money put
 * in is negative, money taken out and the current value are positive.
 */
@ApplicationScoped
public class CalculateXirrService implements CalculateXirrUseCase {

    private static final Logger log = LoggerFactory.getLogger(CalculateXirrService.class);

    private final PortfolioRepository portfolioRepository;
    private final PortfolioCashFlowService cashFlowService;
    private final StockPositionCalculator positionCalculator;
    private final XirrCalculator xirrCalculator;

    public CalculateXirrService(PortfolioRepository portfolioRepository,
                                PortfolioCashFlowService cashFlowService,
                                StockPositionCalculator positionCalculator,
                                XirrCalculator xirrCalculator) {
        this.portfolioRepository = portfolioRepository;
        this.cashFlowService = cashFlowService;
        this.positionCalculator = positionCalculator;
        this.xirrCalculator = xirrCalculator;
    }

    @Override
    public Uni<Result> execute(Command command) {
        log.info("Calculating XIRR: portfolioId={}, asOf={}", command.portfolioId(), command.asOfDate());

        return Uni.createFrom().item(command)
                .invoke(CalculateXirrService::validate)
                .flatMap(valid -> portfolioRepository.findById(command.portfolioId()))
                .flatMap(portfolio -> {
                    if (portfolio == null) {
                        return Uni.createFrom().item((Result) new Result.NotFound(command.portfolioId()));
                    }
                    return cashFlowService.loadCashFlows(portfolio, null, command.asOfDate())
                            .map(cashFlows -> calculate(command, cashFlows));
                })
                .onFailure().recoverWithItem(throwable -> {
                    if (throwable instanceof ServiceException serviceException) {
                        log.warn("XIRR calculation rejected for portfolio {}: {}", command.portfolioId(), serviceException.getMessage());
                        return new Result.Error(serviceException.getError(), serviceException.getMessage());
                    }
                    log.error("Error calculating XIRR for portfolio {}", command.portfolioId(), throwable);
                    return new Result.Error(Errors.PortfolioPerformance.PERSISTENCE_ERROR,
                            "Failed to calculate XIRR: " + throwable.getMessage());
                });
    }

    private Result calculate(Command command, PortfolioCashFlowService.PortfolioCashFlows cashFlows) {
        List<CashFlow> flows = new ArrayList<>();
        if (StockTransactionCashFlowStrategy.NAME.equals(cashFlows.strategy())) {
            flows.addAll(tradeFlows(cashFlows.stockTransactions(), command));
        } else {
            cashFlows.events().stream()
                    .map(ReturnCashFlowEvent::toCashFlow)
                    .map(flow -> new CashFlow(flow.amount().negate(), flow.date()))
                    .forEach(flows::add);
        }
        if (command.currentValue().signum() != 0) {
            flows.add(new CashFlow(command.currentValue(), command.asOfDate()));
        }

        Optional<BigDecimal> xirr = xirrCalculator.calculateXirr(flows);
        if (xirr.isEmpty()) {
            log.debug("XIRR not computable for portfolio {} from {} flows", command.portfolioId(), flows.size());
            return new Result.NotComputable("Cash flows have no sign change or the rate did not converge", flows);
        }
        return new Result.Success(xirr.get(), flows);
    }

    /**
     * Without a bound ledger the trades themselves are the flows: buys pay the subtotal plus fees,
     * sells return the net proceeds.
     */
    private List<CashFlow> tradeFlows(List<StockTransaction> transactions, Command command) {
        return transactions.stream()
                .filter(transaction -> !transaction.isDeleted())
                .filter(transaction -> !transaction.getTransactionDate().isAfter(command.asOfDate()))
                .filter(transaction -> transaction.isBuy() || transaction.isSell())
                .sorted(Comparator.comparing(StockTransaction::getTransactionDate))
                .map(transaction -> transaction.isBuy()
                        ? new CashFlow(transaction.getSubtotalSource().add(transaction.getFees()).negate(), transaction.getTransactionDate())
                        : new CashFlow(positionCalculator.calculateNetProceedsSource(transaction), transaction.getTransactionDate()))
                .toList();
    }

    private static void validate(Command command) {
        if (command.asOfDate() == null) {
            throw new ServiceException(Errors.PortfolioPerformance.INVALID_INPUT, "As-of date is required");
        }
        if (command.currentValue() == null || command.currentValue().signum() < 0) {
            throw new ServiceException(Errors.PortfolioPerformance.INVALID_INPUT, "Current value must be zero or positive");
        }
    }
}
