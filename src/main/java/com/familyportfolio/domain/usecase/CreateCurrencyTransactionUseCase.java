package com.familyportfolio.domain.usecase;

import com.familyportfolio.domain.model.CurrencyTransaction;
import com.familyportfolio.domain.model.CurrencyTransactionType;
import io.smallrye.mutiny.Uni;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Use case for manually recording a currency ledger movement.
 * A row may reference the stock transaction it funded; only rows flagged as
 * internal settlements are treated as reallocations inside the portfolio.
 */
public interface CreateCurrencyTransactionUseCase {

    Uni<Result> execute(Command command);

    sealed interface Result {
        record Success(CurrencyTransaction transaction) implements Result {}
        record Error(com.familyportfolio.domain.exception.Error error, String message) implements Result {}
    }

    record Command(
        UUID ledgerId,
        LocalDate transactionDate,
        CurrencyTransactionType transactionType,
        BigDecimal foreignAmount,
        BigDecimal homeAmount,
        BigDecimal exchangeRate,
        String notes,
        UUID relatedStockTransactionId,
        boolean internalSettlement
    ) {
        public Command(UUID ledgerId,
                       LocalDate transactionDate,
                       CurrencyTransactionType transactionType,
                       BigDecimal foreignAmount,
                       BigDecimal homeAmount,
                       BigDecimal exchangeRate,
                       String notes) {
            this(ledgerId, transactionDate, transactionType, foreignAmount, homeAmount, exchangeRate, notes, null, false);
        }
    }
}
