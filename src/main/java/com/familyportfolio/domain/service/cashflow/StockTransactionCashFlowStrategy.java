package com.familyportfolio.domain.service.cashflow;

import com.familyportfolio.domain.model.CurrencyLedger;
import com.familyportfolio.domain.model.CurrencyTransaction;
import com.familyportfolio.domain.model.Portfolio;
import com.familyportfolio.domain.model.ReturnCashFlowEvent;
import com.familyportfolio.domain.model.StockTransaction;

import java.time.LocalDate;
import java.util.List;

/**
 * Fallback for portfolios without an active bound ledger. Buys and sells only move value
 * between cash and holdings, so no trade is an external cash flow.
 */
public class StockTransactionCashFlowStrategy implements ReturnCashFlowStrategy {

    public static final String NAME = "StockTransaction";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isApplicable(Portfolio portfolio, List<CurrencyLedger> ledgers) {
        return true;
    }

    @Override
    public List<ReturnCashFlowEvent> getCashFlowEvents(Portfolio portfolio,
                                                       LocalDate fromDate,
                                                       LocalDate toDate,
                                                       List<StockTransaction> stockTransactions,
                                                       List<CurrencyLedger> ledgers,
                                                       List<CurrencyTransaction> currencyTransactions) {
        return List.of();
    }
}
