package com.familyportfolio.domain.service.cashflow;

import com.familyportfolio.domain.model.CurrencyLedger;
import com.familyportfolio.domain.model.Portfolio;

import java.util.List;

/**
 * Picks the ledger strategy when the portfolio has an active bound ledger, the stock strategy
 * otherwise.
 */
public class ReturnCashFlowStrategyProvider {

    private final CurrencyLedgerCashFlowStrategy ledgerStrategy;
    private final StockTransactionCashFlowStrategy stockStrategy;

    public ReturnCashFlowStrategyProvider(CurrencyLedgerCashFlowStrategy ledgerStrategy,
                                          StockTransactionCashFlowStrategy stockStrategy) {
        this.ledgerStrategy = ledgerStrategy;
        this.stockStrategy = stockStrategy;
    }

    public ReturnCashFlowStrategy getStrategy(Portfolio portfolio, List<CurrencyLedger> ledgers) {
        return ledgerStrategy.isApplicable(portfolio, ledgers) ? ledgerStrategy : stockStrategy;
    }
}
