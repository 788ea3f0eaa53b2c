package com.familyportfolio.domain.port;

import com.familyportfolio.domain.model.BankAccount;
import io.smallrye.mutiny.Uni;

import java.util.List;
import java.util.UUID;

public interface BankAccountRepository {

    Uni<List<BankAccount>> findActiveByUserId(UUID userId);
}
