package com.familyportfolio.application.usecase.position;

import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import com.familyportfolio.domain.model.Position;
import com.familyportfolio.domain.model.StockSplit;
import com.familyportfolio.domain.model.StockTransaction;
import com.familyportfolio.domain.port.PortfolioRepository;
import com.familyportfolio.domain.port.StockSplitRepository;
import com.familyportfolio.domain.port.StockTransactionRepository;
import com.familyportfolio.domain.service.StockPositionCalculator;
import com.familyportfolio.domain.usecase.GetPortfolioPositionsUseCase;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Service rebuilding the current holdings of a portfolio from its trade history
 */
@ApplicationScoped
public class GetPortfolioPositionsService implements GetPortfolioPositionsUseCase {

    private static final Logger log = LoggerFactory.getLogger(GetPortfolioPositionsService.class);

    private final PortfolioRepository portfolioRepository;
    private final StockTransactionRepository stockTransactionRepository;
    private final StockSplitRepository stockSplitRepository;
    private final StockPositionCalculator positionCalculator;

    public GetPortfolioPositionsService(PortfolioRepository portfolioRepository,
                                        StockTransactionRepository stockTransactionRepository,
                                        StockSplitRepository stockSplitRepository,
                                        StockPositionCalculator positionCalculator) {
        this.portfolioRepository = portfolioRepository;
        this.stockTransactionRepository = stockTransactionRepository;
        this.stockSplitRepository = stockSplitRepository;
        this.positionCalculator = positionCalculator;
    }

    @Override
    public Uni<Result> execute(Command command) {
        log.debug("Calculating positions: portfolioId={}", command.portfolioId());

        return portfolioRepository.findById(command.portfolioId())
                .flatMap(portfolio -> {
                    if (portfolio == null) {
                        return Uni.createFrom().item((Result) new Result.NotFound(command.portfolioId()));
                    }
                    return Uni.combine().all()
                            .unis(stockTransactionRepository.findByPortfolioId(portfolio.getId()), stockSplitRepository.findAll())
                            .asTuple()
                            .map(tuple -> (Result) new Result.Success(buildPositions(tuple.getItem1(), tuple.getItem2())));
                })
                .onFailure().recoverWithItem(throwable -> {
                    log.error("Error calculating positions for portfolio {}", command.portfolioId(), throwable);
                    return toError(throwable);
                });
    }

    private List<Position> buildPositions(List<StockTransaction> transactions, List<StockSplit> splits) {
        Set<String> tickers = new LinkedHashSet<>();
        transactions.stream()
                .filter(transaction -> !transaction.isDeleted())
                .forEach(transaction -> tickers.add(transaction.getTicker()));

        return tickers.stream()
                .map(ticker -> positionCalculator.calculatePositionWithSplitAdjustments(ticker, transactions, splits))
                .filter(Position::hasShares)
                .toList();
    }

    private static Result toError(Throwable throwable) {
        if (throwable instanceof ServiceException serviceException) {
            return new Result.Error(serviceException.getError(), serviceException.getMessage());
        }
        return new Result.Error(Errors.StockTransaction.PERSISTENCE_ERROR,
                "Failed to calculate positions: " + throwable.getMessage());
    }
}
