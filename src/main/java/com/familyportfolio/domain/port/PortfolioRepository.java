package com.familyportfolio.domain.port;

import com.familyportfolio.domain.model.Portfolio;
import io.smallrye.mutiny.Uni;

import java.util.UUID;

public interface PortfolioRepository {

    Uni<Portfolio> findById(UUID id);
}
