package com.familyportfolio.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of currency-ledger transaction types. How each type affects balance, cost and
 * return cash flows is decided in one place, {@code TransactionClassificationPolicy}.
 */
public enum CurrencyTransactionType {
    EXCHANGE_BUY(1, "ExchangeBuy"),
    EXCHANGE_SELL(2, "ExchangeSell"),
    INTEREST(3, "Interest"),
    SPEND(4, "Spend"),
    TRANSFER_IN_BALANCE(5, "TransferInBalance"),
    OTHER_INCOME(6, "OtherIncome"),
    OTHER_EXPENSE(7, "OtherExpense"),
    DEPOSIT(8, "Deposit"),
    WITHDRAW(9, "Withdraw"),
    DIVIDEND(10, "Dividend"),
    STOCK_SELL_PROCEEDS(11, "StockSellProceeds");

    private static final String LEGACY_INITIAL_BALANCE = "InitialBalance";

    private final int code;
    private final String displayName;

    CurrencyTransactionType(int code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public int getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isExchange() {
        return this == EXCHANGE_BUY || this == EXCHANGE_SELL;
    }

    public static Optional<CurrencyTransactionType> fromCode(int code) {
        return Arrays.stream(values()).filter(type -> type.code == code).findFirst();
    }

    /**
     * Accepts the numeric code, the display name or the constant name, case-insensitively.
     * The legacy name {@code InitialBalance} maps to {@link #TRANSFER_IN_BALANCE}.
     */
    public static Optional<CurrencyTransactionType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (trimmed.length() <= 3 && trimmed.chars().allMatch(Character::isDigit)) {
            return fromCode(Integer.parseInt(trimmed));
        }
        if (LEGACY_INITIAL_BALANCE.equalsIgnoreCase(trimmed)) {
            return Optional.of(TRANSFER_IN_BALANCE);
        }
        String constantName = trimmed.toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.displayName.equalsIgnoreCase(trimmed) || type.name().equals(constantName))
                .findFirst();
    }
}
