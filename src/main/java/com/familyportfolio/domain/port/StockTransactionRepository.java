package com.familyportfolio.domain.port;

import com.familyportfolio.domain.model.StockTransaction;
import io.smallrye.mutiny.Uni;

import java.util.List;
import java.util.UUID;

public interface StockTransactionRepository {

    /**
     * Non-deleted transactions of a portfolio ordered by transaction date.
     */
    Uni<List<StockTransaction>> findByPortfolioId(UUID portfolioId);

    Uni<StockTransaction> save(StockTransaction transaction);

    Uni<Void> deleteById(UUID id);
}
