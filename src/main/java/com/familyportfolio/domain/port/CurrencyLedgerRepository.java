package com.familyportfolio.domain.port;

import com.familyportfolio.domain.model.CurrencyLedger;
import io.smallrye.mutiny.Uni;

import java.util.List;
import java.util.UUID;

public interface CurrencyLedgerRepository {

    Uni<CurrencyLedger> findById(UUID id);

    Uni<List<CurrencyLedger>> findByUserId(UUID userId);
}
