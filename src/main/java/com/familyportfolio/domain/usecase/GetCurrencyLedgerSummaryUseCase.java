package com.familyportfolio.domain.usecase;

import com.familyportfolio.domain.model.CurrencyLedger;
import com.familyportfolio.domain.model.LedgerSummary;
import io.smallrye.mutiny.Uni;

import java.util.UUID;

/**
 * Use case for the balance, average cost and realized result of a currency ledger
 */
public interface GetCurrencyLedgerSummaryUseCase {

    Uni<Result> execute(Command command);

    sealed interface Result {
        record Success(CurrencyLedger ledger, LedgerSummary summary) implements Result {}
        record NotFound(UUID ledgerId) implements Result {}
        record Error(com.familyportfolio.domain.exception.Error error, String message) implements Result {}
    }

    record Command(UUID ledgerId) {}
}
