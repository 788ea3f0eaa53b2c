package com.familyportfolio.domain.port;

import com.familyportfolio.domain.model.StockSplit;
import io.smallrye.mutiny.Uni;

import java.util.List;

public interface StockSplitRepository {

    Uni<List<StockSplit>> findAll();
}
