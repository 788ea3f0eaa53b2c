package com.familyportfolio.domain.usecase;

import com.familyportfolio.domain.model.Position;
import io.smallrye.mutiny.Uni;

import java.util.List;
import java.util.UUID;

/**
 * Use case for rebuilding the split-adjusted positions of a portfolio
 */
public interface GetPortfolioPositionsUseCase {

    Uni<Result> execute(Command command);

    sealed interface Result {
        record Success(List<Position> positions) implements Result {}
        record NotFound(UUID portfolioId) implements Result {}
        record Error(com.familyportfolio.domain.exception.Error error, String message) implements Result {}
    }

    record Command(UUID portfolioId) {}
}
