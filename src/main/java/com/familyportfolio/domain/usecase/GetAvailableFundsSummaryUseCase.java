package com.familyportfolio.domain.usecase;

import com.familyportfolio.domain.model.AvailableFundsSummary;
import io.smallrye.mutiny.Uni;

import java.util.UUID;

/**
 * Use case for the spendable funds of a user in the home currency
 */
public interface GetAvailableFundsSummaryUseCase {

    Uni<Result> execute(Command command);

    sealed interface Result {
        record Success(AvailableFundsSummary summary) implements Result {}
        record Error(com.familyportfolio.domain.exception.Error error, String message) implements Result {}
    }

    record Command(UUID userId) {}
}
