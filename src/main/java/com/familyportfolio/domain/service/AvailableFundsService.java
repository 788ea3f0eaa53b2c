package com.familyportfolio.domain.service;

import com.familyportfolio.domain.model.AvailableFundsSummary;
import com.familyportfolio.domain.model.BankAccount;
import com.familyportfolio.domain.model.Installment;
import com.familyportfolio.domain.model.LedgerBalance;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Rolls ledgers, bank accounts and installment debt up into home-currency spendable funds.
 * <p>
 * Ledger balances count as they are, negative ones included. A matured fixed deposit releases its
 * expected interest on top of the principal already held in the account's total assets; active
 * deposits stay locked and closed or early-withdrawn ones were settled elsewhere. Foreign amounts
 * are converted with {@code getExchangeRate} once per amount, zero amounts included, and home
 * currency amounts never reach it.
 */
public class AvailableFundsService {

    private final String homeCurrency;
    private final Clock clock;

    public AvailableFundsService(String homeCurrency, Clock clock) {
        this.homeCurrency = Objects.requireNonNull(homeCurrency, "homeCurrency must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public AvailableFundsSummary calculate(List<LedgerBalance> ledgers,
                                           List<BankAccount> bankAccounts,
                                           List<Installment> installments,
                                           Function<String, BigDecimal> getExchangeRate) {
        Objects.requireNonNull(ledgers, "ledgers must not be null");
        Objects.requireNonNull(bankAccounts, "bankAccounts must not be null");
        Objects.requireNonNull(installments, "installments must not be null");
        Objects.requireNonNull(getExchangeRate, "getExchangeRate must not be null");

        LocalDate today = LocalDate.now(clock);

        BigDecimal ledgerTotal = BigDecimal.ZERO;
        for (LedgerBalance ledger : ledgers) {
            ledgerTotal = ledgerTotal.add(toHomeCurrency(ledger.balance(), ledger.currencyCode(), getExchangeRate));
        }

        BigDecimal bankTotal = BigDecimal.ZERO;
        for (BankAccount account : bankAccounts) {
            bankTotal = bankTotal.add(toHomeCurrency(account.getTotalAssets(), account.getCurrency(), getExchangeRate));
        }

        List<BankAccount> maturedDeposits = bankAccounts.stream()
                .filter(account -> account.isMaturedFixedDeposit(today))
                .toList();

        BigDecimal maturedInterest = BigDecimal.ZERO;
        for (BankAccount deposit : maturedDeposits) {
            maturedInterest = maturedInterest.add(toHomeCurrency(
                    deposit.getFixedDeposit().expectedInterest(), deposit.getCurrency(), getExchangeRate));
        }

        BigDecimal fixedDepositsPrincipal = BigDecimal.ZERO;
        for (BankAccount deposit : maturedDeposits) {
            BigDecimal principalAndInterest = deposit.getTotalAssets().add(deposit.getFixedDeposit().expectedInterest());
            fixedDepositsPrincipal = fixedDepositsPrincipal.add(
                    toHomeCurrency(principalAndInterest, deposit.getCurrency(), getExchangeRate));
        }

        BigDecimal unpaidInstallments = installments.stream()
                .map(Installment::getUnpaidBalance)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal totalBankAssets = ledgerTotal.add(bankTotal).add(maturedInterest);

        return new AvailableFundsSummary(
                totalBankAssets,
                fixedDepositsPrincipal,
                unpaidInstallments,
                totalBankAssets.subtract(unpaidInstallments));
    }

    private BigDecimal toHomeCurrency(BigDecimal amount, String currency, Function<String, BigDecimal> getExchangeRate) {
        if (currency == null || homeCurrency.equalsIgnoreCase(currency)) {
            return amount;
        }
        return DecimalMath.round(amount.multiply(getExchangeRate.apply(currency)), 2);
    }
}
