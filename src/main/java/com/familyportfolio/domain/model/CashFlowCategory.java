package com.familyportfolio.domain.model;

/**
 * Role a ledger transaction plays in return calculations.
 */
public enum CashFlowCategory {
    /** Capital entering the tracked system. */
    EXTERNAL_INFLOW,
    /** Capital leaving the tracked system. */
    EXTERNAL_OUTFLOW,
    /** Money moving between the ledger and the stock holdings. */
    INTERNAL_REALLOCATION,
    /** Interest and dividends, part of the return itself. */
    INTERNAL_RETURN,
    /** Type that is not valid for the ledger, e.g. a currency exchange on a home-currency ledger. */
    NOT_APPLICABLE;

    public boolean isExternal() {
        return this == EXTERNAL_INFLOW || this == EXTERNAL_OUTFLOW;
    }
}
