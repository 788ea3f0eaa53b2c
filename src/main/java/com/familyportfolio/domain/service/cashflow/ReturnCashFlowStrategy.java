package com.familyportfolio.domain.service.cashflow;

import com.familyportfolio.domain.model.CurrencyLedger;
import com.familyportfolio.domain.model.CurrencyTransaction;
import com.familyportfolio.domain.model.Portfolio;
import com.familyportfolio.domain.model.ReturnCashFlowEvent;
import com.familyportfolio.domain.model.StockTransaction;

import java.time.LocalDate;
import java.util.List;

/**
 * Source of the external cash flows used by return calculations.
 */
public interface ReturnCashFlowStrategy {

    String name();

    boolean isApplicable(Portfolio portfolio, List<CurrencyLedger> ledgers);

    /**
     * External cash flows dated within {@code [fromDate, toDate]}, oldest first.
     */
    List<ReturnCashFlowEvent> getCashFlowEvents(Portfolio portfolio,
                                                LocalDate fromDate,
                                                LocalDate toDate,
                                                List<StockTransaction> stockTransactions,
                                                List<CurrencyLedger> ledgers,
                                                List<CurrencyTransaction> currencyTransactions);
}
