package com.familyportfolio.domain.usecase;

import com.familyportfolio.domain.model.TotalAssetsSummary;
import io.smallrye.mutiny.Uni;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Use case for the investment versus bank split of a user's net worth
 */
public interface GetTotalAssetsSummaryUseCase {

    Uni<Result> execute(Command command);

    sealed interface Result {
        record Success(TotalAssetsSummary summary) implements Result {}
        record Error(com.familyportfolio.domain.exception.Error error, String message) implements Result {}
    }

    /**
     * @param investmentTotal market value of the user's investments in the home currency
     */
    record Command(UUID userId, BigDecimal investmentTotal) {}
}
