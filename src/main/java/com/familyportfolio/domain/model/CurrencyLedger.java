package com.familyportfolio.domain.model;

import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import lombok.Getter;

import java.util.UUID;

/**
 * Cash ledger for one currency. Balance and average cost are derived from its transactions;
 * the balance may go negative.
 */
@Getter
public class CurrencyLedger {
    private final UUID id;
    private final UUID userId;
    private final String currencyCode;
    private final String homeCurrency;
    private String name;
    private boolean active;

    public CurrencyLedger(UUID id, UUID userId, String currencyCode, String homeCurrency, String name, boolean active) {
        this.id = id != null ? id : UUID.randomUUID();
        this.userId = userId;
        this.currencyCode = CurrencyCodes.normalize(currencyCode, Errors.CurrencyLedger.INVALID_INPUT);
        this.homeCurrency = CurrencyCodes.normalize(homeCurrency, Errors.CurrencyLedger.INVALID_INPUT);
        this.name = name;
        this.active = active;
    }

    public CurrencyLedger(UUID id, String currencyCode, String homeCurrency) {
        this(id, null, currencyCode, homeCurrency, currencyCode, true);
    }

    public boolean isHomeCurrencyLedger() {
        return currencyCode.equals(homeCurrency);
    }

    public void rename(String name) {
        if (name == null || name.isBlank()) {
            throw new ServiceException(Errors.CurrencyLedger.INVALID_INPUT, "Ledger name is required");
        }
        this.name = name;
    }

    public void deactivate() {
        this.active = false;
    }
}
