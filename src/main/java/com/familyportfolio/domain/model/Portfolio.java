package com.familyportfolio.domain.model;

import com.familyportfolio.domain.exception.Errors;
import lombok.Getter;

import java.util.UUID;

@Getter
public class Portfolio {
    private final UUID id;
    private final UUID userId;
    private final String baseCurrency;
    private final String homeCurrency;
    private final UUID boundLedgerId;

    public Portfolio(UUID id, UUID userId, String baseCurrency, String homeCurrency, UUID boundLedgerId) {
        this.id = id != null ? id : UUID.randomUUID();
        this.userId = userId;
        this.baseCurrency = CurrencyCodes.normalize(baseCurrency, Errors.PortfolioPerformance.INVALID_INPUT);
        this.homeCurrency = CurrencyCodes.normalize(homeCurrency, Errors.PortfolioPerformance.INVALID_INPUT);
        this.boundLedgerId = boundLedgerId;
    }

    public boolean hasBoundLedger() {
        return boundLedgerId != null;
    }
}
