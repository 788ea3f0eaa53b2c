package com.familyportfolio.domain.service;

import com.familyportfolio.domain.model.CurrencyTransaction;
import com.familyportfolio.domain.model.CurrencyTransactionType;
import com.familyportfolio.domain.model.LedgerSummary;
import com.familyportfolio.domain.service.TransactionClassificationPolicy.LedgerEffect;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Balance and moving weighted-average cost of a currency ledger.
 * <p>
 * Cost-bearing inflows add their home-currency value to the cost pool, zero-cost inflows
 * (interest, dividends, other income, stock sale proceeds) add balance only, and outflows remove
 * cost at the current average. Transactions are replayed by date, then by creation time.
 */
public class CurrencyLedgerService {

    private static final Comparator<CurrencyTransaction> CHRONOLOGICAL = Comparator
            .comparing(CurrencyTransaction::getTransactionDate)
            .thenComparing(CurrencyTransaction::getCreatedAt);

    private final TransactionClassificationPolicy classificationPolicy;

    public CurrencyLedgerService(TransactionClassificationPolicy classificationPolicy) {
        this.classificationPolicy = classificationPolicy;
    }

    public BigDecimal calculateBalance(List<CurrencyTransaction> transactions) {
        return replay(transactions).balance;
    }

    /**
     * Home-currency cost per unit of the current balance, 6 decimal places; 0 when the balance
     * is not positive.
     */
    public BigDecimal calculateWeightedAverageCost(List<CurrencyTransaction> transactions) {
        return replay(transactions).averageCost();
    }

    public BigDecimal calculateTotalCost(List<CurrencyTransaction> transactions) {
        return DecimalMath.round(replay(transactions).totalCost, 2);
    }

    /**
     * Realized gain of all currency sales: home-currency proceeds less the cost removed.
     */
    public BigDecimal calculateRealizedPnl(List<CurrencyTransaction> transactions) {
        return DecimalMath.round(replay(transactions).realizedPnl, 2);
    }

    /**
     * Gain of a single sale measured against the ledger as it stood before the sale.
     */
    public BigDecimal calculateExchangeSellPnl(List<CurrencyTransaction> priorTransactions, CurrencyTransaction sale) {
        Objects.requireNonNull(sale, "sale must not be null");

        LedgerState state = replay(priorTransactions);
        BigDecimal averageCost = state.rawAverageCost();
        BigDecimal costBasis = sale.getForeignAmount().multiply(averageCost);
        return DecimalMath.round(sale.resolveHomeAmount().subtract(costBasis), 2);
    }

    /**
     * Whether {@code amount} can be paid from the balance; spending the exact balance is allowed.
     */
    public boolean validateSpend(List<CurrencyTransaction> transactions, BigDecimal amount) {
        Objects.requireNonNull(amount, "amount must not be null");
        return amount.compareTo(calculateBalance(transactions)) <= 0;
    }

    public LedgerSummary summarize(List<CurrencyTransaction> transactions) {
        LedgerState state = replay(transactions);
        return new LedgerSummary(
                state.balance,
                state.averageCost(),
                DecimalMath.round(state.totalCost, 2),
                DecimalMath.round(state.realizedPnl, 2));
    }

    private LedgerState replay(List<CurrencyTransaction> transactions) {
        Objects.requireNonNull(transactions, "transactions must not be null");

        LedgerState state = new LedgerState();
        transactions.stream()
                .filter(transaction -> !transaction.isDeleted())
                .sorted(CHRONOLOGICAL)
                .forEach(transaction -> apply(state, transaction));
        return state;
    }

    private void apply(LedgerState state, CurrencyTransaction transaction) {
        BigDecimal amount = transaction.getForeignAmount();
        LedgerEffect effect = classificationPolicy.ledgerEffect(transaction.getTransactionType());

        switch (effect) {
            case COST_BEARING_INFLOW -> {
                state.totalCost = state.totalCost.add(transaction.resolveHomeAmount());
                state.balance = state.balance.add(amount);
            }
            case ZERO_COST_INFLOW -> state.balance = state.balance.add(amount);
            case OUTFLOW -> {
                if (state.balance.signum() > 0) {
                    BigDecimal costRemoved = amount.multiply(state.rawAverageCost());
                    if (transaction.getTransactionType() == CurrencyTransactionType.EXCHANGE_SELL) {
                        state.realizedPnl = state.realizedPnl.add(transaction.resolveHomeAmount().subtract(costRemoved));
                    }
                    state.totalCost = DecimalMath.max(state.totalCost.subtract(costRemoved), BigDecimal.ZERO);
                }
                state.balance = state.balance.subtract(amount);
            }
        }

        if (state.balance.signum() <= 0) {
            state.totalCost = BigDecimal.ZERO;
        }
    }

    private static final class LedgerState {
        private BigDecimal balance = BigDecimal.ZERO;
        private BigDecimal totalCost = BigDecimal.ZERO;
        private BigDecimal realizedPnl = BigDecimal.ZERO;

        private BigDecimal rawAverageCost() {
            return balance.signum() > 0 ? DecimalMath.divide(totalCost, balance) : BigDecimal.ZERO;
        }

        private BigDecimal averageCost() {
            return balance.signum() > 0 ? DecimalMath.round(rawAverageCost(), 6) : BigDecimal.ZERO;
        }
    }
}
