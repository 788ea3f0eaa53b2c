package com.familyportfolio.domain.port;

import com.familyportfolio.domain.model.Installment;
import io.smallrye.mutiny.Uni;

import java.util.List;
import java.util.UUID;

public interface InstallmentRepository {

    Uni<List<Installment>> findByUserId(UUID userId);
}
