package com.familyportfolio.domain.usecase;

import com.familyportfolio.domain.model.ReturnCashFlowEvent;
import com.familyportfolio.domain.model.ValuationSnapshot;
import io.smallrye.mutiny.Uni;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Use case for the Modified Dietz and time-weighted returns of a portfolio over a period
 */
public interface CalculatePortfolioReturnsUseCase {

    Uni<Result> execute(Command command);

    sealed interface Result {
        /**
         * @param modifiedDietz null when not computable for the period
         * @param timeWeightedReturn null when not computable for the period
         */
        record Success(String strategy,
                       List<ReturnCashFlowEvent> cashFlows,
                       BigDecimal modifiedDietz,
                       BigDecimal timeWeightedReturn) implements Result {}
        record NotFound(UUID portfolioId) implements Result {}
        record Error(com.familyportfolio.domain.exception.Error error, String message) implements Result {}
    }

    /**
     * Valuations are supplied by the caller: start and end value of the period and the value
     * around each external cash flow.
     */
    record Command(
        UUID portfolioId,
        LocalDate fromDate,
        LocalDate toDate,
        BigDecimal startValue,
        BigDecimal endValue,
        List<ValuationSnapshot> snapshots
    ) {}
}
