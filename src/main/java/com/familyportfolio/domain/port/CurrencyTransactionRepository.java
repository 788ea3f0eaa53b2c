package com.familyportfolio.domain.port;

import com.familyportfolio.domain.model.CurrencyTransaction;
import io.smallrye.mutiny.Uni;

import java.util.List;
import java.util.UUID;

public interface CurrencyTransactionRepository {

    Uni<List<CurrencyTransaction>> findByLedgerId(UUID ledgerId);

    Uni<List<CurrencyTransaction>> findByLedgerIds(List<UUID> ledgerIds);

    Uni<CurrencyTransaction> save(CurrencyTransaction transaction);

    /**
     * Saves every transaction in a single unit of work: either all are stored or none.
     */
    Uni<List<CurrencyTransaction>> saveAll(List<CurrencyTransaction> transactions);
}
