package com.familyportfolio.domain.usecase;

import com.familyportfolio.domain.model.CurrencyTransaction;
import com.familyportfolio.domain.model.StockMarket;
import com.familyportfolio.domain.model.StockTransaction;
import com.familyportfolio.domain.model.StockTransactionType;
import io.smallrye.mutiny.Uni;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Use case for recording a stock trade and settling it on the portfolio's bound ledger
 */
public interface CreateStockTransactionUseCase {

    Uni<Result> execute(Command command);

    sealed interface Result {
        /**
         * @param linkedTransaction settling ledger movement, null when the trade was not linked
         */
        record Success(StockTransaction transaction, CurrencyTransaction linkedTransaction) implements Result {}
        record Error(com.familyportfolio.domain.exception.Error error, String message) implements Result {}
    }

    /**
     * Command for a new stock trade. A null market is detected from the ticker.
     */
    record Command(
        UUID portfolioId,
        String ticker,
        StockMarket market,
        StockTransactionType transactionType,
        BigDecimal shares,
        BigDecimal pricePerShare,
        BigDecimal fees,
        BigDecimal exchangeRate,
        String currency,
        LocalDate transactionDate,
        String notes
    ) {}
}
