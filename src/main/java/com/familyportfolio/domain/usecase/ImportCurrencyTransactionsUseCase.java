package com.familyportfolio.domain.usecase;

import com.familyportfolio.domain.model.ImportRowError;
import com.familyportfolio.domain.model.ImportSummary;
import io.smallrye.mutiny.Uni;

import java.util.List;
import java.util.UUID;

/**
 * Use case for importing a batch of parsed CSV rows into a currency ledger. The batch is
 * committed as a whole or not at all.
 */
public interface ImportCurrencyTransactionsUseCase {

    Uni<Result> execute(Command command);

    sealed interface Result {
        record Committed(ImportSummary summary) implements Result {}
        record Rejected(ImportSummary summary, List<ImportRowError> errors) implements Result {}
        record NotFound(UUID ledgerId) implements Result {}
        record Error(com.familyportfolio.domain.exception.Error error, String message) implements Result {}
    }

    /**
     * Command for an import
     * @param headerColumns first CSV line, split into columns
     * @param dataRows remaining CSV lines, split into columns
     */
    record Command(
        UUID ledgerId,
        List<String> headerColumns,
        List<List<String>> dataRows
    ) {}
}
