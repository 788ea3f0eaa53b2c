package com.familyportfolio.domain.usecase;

import com.familyportfolio.domain.model.CashFlow;
import io.smallrye.mutiny.Uni;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Use case for the annualized money-weighted return of a portfolio
 */
public interface CalculateXirrUseCase {

    Uni<Result> execute(Command command);

    sealed interface Result {
        /**
         * @param cashFlows investor-perspective flows: contributions negative, withdrawals and
         *                  the terminal value positive
         */
        record Success(BigDecimal xirr, List<CashFlow> cashFlows) implements Result {}
        record NotComputable(String reason, List<CashFlow> cashFlows) implements Result {}
        record NotFound(UUID portfolioId) implements Result {}
        record Error(com.familyportfolio.domain.exception.Error error, String message) implements Result {}
    }

    record Command(
        UUID portfolioId,
        LocalDate asOfDate,
        BigDecimal currentValue
    ) {}
}
