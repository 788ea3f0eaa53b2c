package com.familyportfolio.domain.service;

import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import com.familyportfolio.domain.model.AmountPresence;
import com.familyportfolio.domain.model.CurrencyLedger;
import com.familyportfolio.domain.model.CurrencyTransaction;
import com.familyportfolio.domain.model.CurrencyTransactionType;
import com.familyportfolio.domain.model.StockTransaction;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the ledger movement that settles a stock trade on the portfolio's bound ledger. The
 * movement is flagged as an internal settlement so return calculations never see it as new
 * capital.
 */
public class StockTransactionLinkingService {

    private final TransactionClassificationPolicy classificationPolicy;
    private final StockPositionCalculator positionCalculator;

    public StockTransactionLinkingService(TransactionClassificationPolicy classificationPolicy,
                                          StockPositionCalculator positionCalculator) {
        this.classificationPolicy = classificationPolicy;
        this.positionCalculator = positionCalculator;
    }

    public void ensureCurrencyMatches(StockTransaction transaction, CurrencyLedger ledger) {
        Objects.requireNonNull(transaction, "transaction must not be null");
        Objects.requireNonNull(ledger, "ledger must not be null");

        if (transaction.getCurrency() != null && !transaction.getCurrency().equalsIgnoreCase(ledger.getCurrencyCode())) {
            throw new ServiceException(Errors.StockTransaction.CURRENCY_MISMATCH,
                    "Stock currency " + transaction.getCurrency() + " does not match ledger currency " + ledger.getCurrencyCode());
        }
    }

    /**
     * Cash a buy takes out of the ledger: market-rounded subtotal plus fees.
     */
    public BigDecimal requiredFunds(StockTransaction transaction) {
        return transaction.getSubtotalSource().add(transaction.getFees());
    }

    /**
     * The settling movement for a buy or sell; empty for splits, adjustments and sales whose fees
     * consume the whole proceeds.
     */
    public Optional<CurrencyTransaction> createLinkedTransaction(StockTransaction transaction,
                                                                 CurrencyLedger ledger,
                                                                 Instant createdAt) {
        ensureCurrencyMatches(transaction, ledger);

        CurrencyTransactionType type;
        BigDecimal amount;
        switch (transaction.getTransactionType()) {
            case BUY -> {
                type = CurrencyTransactionType.SPEND;
                amount = requiredFunds(transaction);
            }
            case SELL -> {
                type = CurrencyTransactionType.STOCK_SELL_PROCEEDS;
                amount = positionCalculator.calculateNetProceedsSource(transaction);
            }
            default -> {
                return Optional.empty();
            }
        }

        if (amount.signum() <= 0) {
            return Optional.empty();
        }
        classificationPolicy.ensureValidOrThrow(ledger, type, new AmountPresence(true, false));

        return Optional.of(CurrencyTransaction.builder()
                .ledgerId(ledger.getId())
                .transactionDate(transaction.getTransactionDate())
                .transactionType(type)
                .foreignAmount(amount)
                .exchangeRate(transaction.getExchangeRate())
                .relatedStockTransactionId(transaction.getId())
                .internalSettlement(true)
                .notes(describe(transaction))
                .createdAt(createdAt)
                .build());
    }

    private static String describe(StockTransaction transaction) {
        String action = transaction.isBuy() ? "Buy" : "Sell";
        return action + " " + DecimalMath.normalize(transaction.getShares()).toPlainString() + " " + transaction.getTicker();
    }
}
