package com.familyportfolio.application.usecase.performance;

import com.familyportfolio.application.service.PortfolioCashFlowService;
import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import com.familyportfolio.domain.model.CashFlow;
import com.familyportfolio.domain.model.ReturnCashFlowEvent;
import com.familyportfolio.domain.port.PortfolioRepository;
import com.familyportfolio.domain.service.ReturnCalculator;
import com.familyportfolio.domain.usecase.CalculatePortfolioReturnsUseCase;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;

@ApplicationScoped
public class CalculatePortfolioReturnsService implements CalculatePortfolioReturnsUseCase {

    private static final Logger log = LoggerFactory.getLogger(CalculatePortfolioReturnsService.class);

    private final PortfolioRepository portfolioRepository;
    private final PortfolioCashFlowService cashFlowService;
    private final ReturnCalculator returnCalculator;

    public CalculatePortfolioReturnsService(PortfolioRepository portfolioRepository,
                                            PortfolioCashFlowService cashFlowService,
                                            ReturnCalculator returnCalculator) {
        this.portfolioRepository = portfolioRepository;
        this.cashFlowService = cashFlowService;
        this.returnCalculator = returnCalculator;
    }

    @Override
    public Uni<Result> execute(Command command) {
        log.info("Calculating returns: portfolioId={}, from={}, to={}",
                command.portfolioId(), command.fromDate(), command.toDate());

        return Uni.createFrom().item(command)
                .invoke(CalculatePortfolioReturnsService::validate)
                .flatMap(valid -> portfolioRepository.findById(command.portfolioId()))
                .flatMap(portfolio -> {
                    if (portfolio == null) {
                        return Uni.createFrom().item((Result) new Result.NotFound(command.portfolioId()));
                    }
                    return cashFlowService.loadCashFlows(portfolio, command.fromDate(), command.toDate())
                            .map(cashFlows -> calculate(command, cashFlows));
                })
                .onFailure().recoverWithItem(throwable -> {
                    if (throwable instanceof ServiceException serviceException) {
                        log.warn("Return calculation rejected for portfolio {}: {}", command.portfolioId(), serviceException.getMessage());
                        return new Result.Error(serviceException.getError(), serviceException.getMessage());
                    }
                    log.error("Error calculating returns for portfolio {}", command.portfolioId(), throwable);
                    return new Result.Error(Errors.PortfolioPerformance.PERSISTENCE_ERROR,
                            "Failed to calculate returns: " + throwable.getMessage());
                });
    }

    private Result calculate(Command command, PortfolioCashFlowService.PortfolioCashFlows cashFlows) {
        List<CashFlow> flows = cashFlows.events().stream()
                .map(ReturnCashFlowEvent::toCashFlow)
                .toList();

        BigDecimal modifiedDietz = returnCalculator.calculateModifiedDietz(
                command.startValue(), command.endValue(), command.fromDate(), command.toDate(), flows).orElse(null);
        BigDecimal timeWeighted = returnCalculator.calculateTimeWeightedReturn(
                command.startValue(), command.endValue(),
                command.snapshots() != null ? command.snapshots() : List.of()).orElse(null);

        log.debug("Portfolio {} returns: modifiedDietz={}, twr={}", command.portfolioId(), modifiedDietz, timeWeighted);
        return new Result.Success(cashFlows.strategy(), cashFlows.events(), modifiedDietz, timeWeighted);
    }

    private static void validate(Command command) {
        if (command.fromDate() == null || command.toDate() == null) {
            throw new ServiceException(Errors.PortfolioPerformance.INVALID_INPUT, "Period start and end dates are required");
        }
        if (command.toDate().isBefore(command.fromDate())) {
            throw new ServiceException(Errors.PortfolioPerformance.INVALID_INPUT, "Period end cannot be before its start");
        }
        if (command.startValue() == null || command.endValue() == null) {
            throw new ServiceException(Errors.PortfolioPerformance.INVALID_INPUT, "Start and end valuations are required");
        }
    }
}
