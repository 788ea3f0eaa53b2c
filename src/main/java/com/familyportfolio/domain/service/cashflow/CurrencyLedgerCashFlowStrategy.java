package com.familyportfolio.domain.service.cashflow;

import com.familyportfolio.domain.model.CashFlowCategory;
import com.familyportfolio.domain.model.CashFlowSource;
import com.familyportfolio.domain.model.CurrencyLedger;
import com.familyportfolio.domain.model.CurrencyTransaction;
import com.familyportfolio.domain.model.Portfolio;
import com.familyportfolio.domain.model.ReturnCashFlowEvent;
import com.familyportfolio.domain.model.StockTransaction;
import com.familyportfolio.domain.service.TransactionClassificationPolicy;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads external cash flows from the ledger bound to the portfolio. Stock trades settle through
 * that ledger, so only money crossing the ledger's boundary counts.
 */
public class CurrencyLedgerCashFlowStrategy implements ReturnCashFlowStrategy {

    private final TransactionClassificationPolicy classificationPolicy;

    public CurrencyLedgerCashFlowStrategy(TransactionClassificationPolicy classificationPolicy) {
        this.classificationPolicy = classificationPolicy;
    }

    @Override
    public String name() {
        return "CurrencyLedger";
    }

    @Override
    public boolean isApplicable(Portfolio portfolio, List<CurrencyLedger> ledgers) {
        return findBoundLedger(portfolio, ledgers)
                .map(CurrencyLedger::isActive)
                .orElse(false);
    }

    @Override
    public List<ReturnCashFlowEvent> getCashFlowEvents(Portfolio portfolio,
                                                       LocalDate fromDate,
                                                       LocalDate toDate,
                                                       List<StockTransaction> stockTransactions,
                                                       List<CurrencyLedger> ledgers,
                                                       List<CurrencyTransaction> currencyTransactions) {
        Objects.requireNonNull(portfolio, "portfolio must not be null");
        Objects.requireNonNull(currencyTransactions, "currencyTransactions must not be null");

        Optional<CurrencyLedger> boundLedger = findBoundLedger(portfolio, ledgers);
        if (boundLedger.isEmpty()) {
            return List.of();
        }

        CurrencyLedger ledger = boundLedger.get();
        String currencyCode = ledger.getCurrencyCode();

        return currencyTransactions.stream()
                .filter(transaction -> !transaction.isDeleted())
                .filter(transaction -> ledger.getId().equals(transaction.getLedgerId()))
                .filter(transaction -> isWithin(transaction.getTransactionDate(), fromDate, toDate))
                .sorted(Comparator.comparing(CurrencyTransaction::getTransactionDate)
                        .thenComparing(CurrencyTransaction::getCreatedAt))
                .flatMap(transaction -> toEvent(portfolio, ledger, currencyCode, transaction).stream())
                .toList();
    }

    private Optional<ReturnCashFlowEvent> toEvent(Portfolio portfolio,
                                                  CurrencyLedger ledger,
                                                  String currencyCode,
                                                  CurrencyTransaction transaction) {
        CashFlowCategory category = classificationPolicy.classify(transaction, ledger);
        if (!category.isExternal()) {
            return Optional.empty();
        }

        BigDecimal amount = category == CashFlowCategory.EXTERNAL_INFLOW
                ? transaction.getForeignAmount()
                : transaction.getForeignAmount().negate();

        return Optional.of(new ReturnCashFlowEvent(
                portfolio.getId(),
                transaction.getId(),
                transaction.getTransactionDate(),
                amount,
                currencyCode,
                CashFlowSource.CURRENCY_LEDGER));
    }

    private static Optional<CurrencyLedger> findBoundLedger(Portfolio portfolio, List<CurrencyLedger> ledgers) {
        if (portfolio == null || !portfolio.hasBoundLedger() || ledgers == null) {
            return Optional.empty();
        }
        return ledgers.stream()
                .filter(ledger -> portfolio.getBoundLedgerId().equals(ledger.getId()))
                .findFirst();
    }

    private static boolean isWithin(LocalDate date, LocalDate fromDate, LocalDate toDate) {
        return (fromDate == null || !date.isBefore(fromDate)) && (toDate == null || !date.isAfter(toDate));
    }
}
