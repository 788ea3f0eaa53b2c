package com.familyportfolio.domain.service;

import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import com.familyportfolio.domain.model.AmountPresence;
import com.familyportfolio.domain.model.CashFlowCategory;
import com.familyportfolio.domain.model.CurrencyLedger;
import com.familyportfolio.domain.model.CurrencyTransaction;
import com.familyportfolio.domain.model.CurrencyTransactionType;
import com.familyportfolio.domain.model.TransactionDiagnostic;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The one place that decides what a currency transaction type means: its return cash-flow
 * category, its effect on a ledger's balance and cost, and whether it may be recorded on a
 * given ledger. Manual entry, CSV import, stock linking and the return strategies all go
 * through here.
 */
public class TransactionClassificationPolicy {

    public static final String INVALID_TRANSACTION_TYPE_FOR_LEDGER = "INVALID_TRANSACTION_TYPE_FOR_LEDGER";
    public static final String REQUIRED_FIELD_MISSING = "REQUIRED_FIELD_MISSING";

    public static final String FIELD_TRANSACTION_TYPE = "transactionType";
    public static final String FIELD_AMOUNT = "amount";
    public static final String FIELD_TARGET_AMOUNT = "targetAmount";

    /**
     * How a transaction type moves a ledger.
     */
    public enum LedgerEffect {
        /** Adds balance together with its home-currency cost. */
        COST_BEARING_INFLOW,
        /** Adds balance at zero cost, diluting the average cost. */
        ZERO_COST_INFLOW,
        /** Removes balance at the current average cost. */
        OUTFLOW;

        public boolean isInflow() {
            return this != OUTFLOW;
        }
    }

    public CashFlowCategory classify(CurrencyTransactionType type, boolean homeCurrencyLedger) {
        Objects.requireNonNull(type, "type must not be null");

        return switch (type) {
            case TRANSFER_IN_BALANCE, DEPOSIT, OTHER_INCOME -> CashFlowCategory.EXTERNAL_INFLOW;
            case WITHDRAW, OTHER_EXPENSE -> CashFlowCategory.EXTERNAL_OUTFLOW;
            case EXCHANGE_BUY -> homeCurrencyLedger ? CashFlowCategory.NOT_APPLICABLE : CashFlowCategory.EXTERNAL_INFLOW;
            case EXCHANGE_SELL -> homeCurrencyLedger ? CashFlowCategory.NOT_APPLICABLE : CashFlowCategory.EXTERNAL_OUTFLOW;
            case INTEREST, DIVIDEND -> CashFlowCategory.INTERNAL_RETURN;
            case SPEND, STOCK_SELL_PROCEEDS -> CashFlowCategory.INTERNAL_REALLOCATION;
        };
    }

    public CashFlowCategory classify(CurrencyTransactionType type, String ledgerCurrency, String homeCurrency) {
        Objects.requireNonNull(ledgerCurrency, "ledgerCurrency must not be null");
        return classify(type, ledgerCurrency.equalsIgnoreCase(homeCurrency));
    }

    /**
     * Category of a recorded transaction. Rows created to settle a stock trade are internal
     * whatever their type.
     */
    public CashFlowCategory classify(CurrencyTransaction transaction, CurrencyLedger ledger) {
        Objects.requireNonNull(transaction, "transaction must not be null");
        Objects.requireNonNull(ledger, "ledger must not be null");

        if (transaction.isInternalSettlement()) {
            return CashFlowCategory.INTERNAL_REALLOCATION;
        }
        return classify(transaction.getTransactionType(), ledger.isHomeCurrencyLedger());
    }

    public LedgerEffect ledgerEffect(CurrencyTransactionType type) {
        Objects.requireNonNull(type, "type must not be null");

        return switch (type) {
            case EXCHANGE_BUY, DEPOSIT, TRANSFER_IN_BALANCE -> LedgerEffect.COST_BEARING_INFLOW;
            case INTEREST, DIVIDEND, OTHER_INCOME, STOCK_SELL_PROCEEDS -> LedgerEffect.ZERO_COST_INFLOW;
            case EXCHANGE_SELL, WITHDRAW, SPEND, OTHER_EXPENSE -> LedgerEffect.OUTFLOW;
        };
    }

    public boolean isAllowed(CurrencyTransactionType type, CurrencyLedger ledger) {
        return classify(type, ledger.isHomeCurrencyLedger()) != CashFlowCategory.NOT_APPLICABLE;
    }

    /**
     * Every problem with recording {@code type} on {@code ledger}, in field order. Empty when valid.
     */
    public List<TransactionDiagnostic> validate(CurrencyLedger ledger, CurrencyTransactionType type, AmountPresence amounts) {
        Objects.requireNonNull(ledger, "ledger must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(amounts, "amounts must not be null");

        List<TransactionDiagnostic> diagnostics = new ArrayList<>();
        boolean allowed = isAllowed(type, ledger);

        if (!allowed) {
            diagnostics.add(new TransactionDiagnostic(
                    INVALID_TRANSACTION_TYPE_FOR_LEDGER,
                    FIELD_TRANSACTION_TYPE,
                    type.getDisplayName() + " is not allowed on a " + ledger.getCurrencyCode() + " home-currency ledger",
                    "Use Deposit or Withdraw to move home currency in or out of this ledger.",
                    type.getDisplayName()));
        }
        if (!amounts.hasAmount()) {
            diagnostics.add(new TransactionDiagnostic(
                    REQUIRED_FIELD_MISSING,
                    FIELD_AMOUNT,
                    "Amount is required",
                    "Enter an amount greater than 0.",
                    null));
        }
        if (allowed && type.isExchange() && !amounts.hasTargetAmount()) {
            diagnostics.add(new TransactionDiagnostic(
                    REQUIRED_FIELD_MISSING,
                    FIELD_TARGET_AMOUNT,
                    type.getDisplayName() + " requires the " + ledger.getHomeCurrency() + " amount",
                    "Enter the " + ledger.getHomeCurrency() + " amount paid or received for the exchange.",
                    null));
        }
        return diagnostics;
    }

    public void ensureValidOrThrow(CurrencyLedger ledger, CurrencyTransactionType type, AmountPresence amounts) {
        List<TransactionDiagnostic> diagnostics = validate(ledger, type, amounts);
        if (diagnostics.isEmpty()) {
            return;
        }

        TransactionDiagnostic first = diagnostics.get(0);
        throw new ServiceException(
                INVALID_TRANSACTION_TYPE_FOR_LEDGER.equals(first.errorCode())
                        ? Errors.CurrencyTransaction.TYPE_NOT_ALLOWED_FOR_LEDGER
                        : Errors.CurrencyTransaction.REQUIRED_FIELD_MISSING,
                first.message());
    }
}
