package com.familyportfolio.domain.service;

import com.familyportfolio.domain.model.BankAccount;
import com.familyportfolio.domain.model.InterestEstimate;
import com.familyportfolio.domain.model.TotalAssetsSummary;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Splits net worth between investments and bank holdings.
 */
public class TotalAssetsService {

    private final InterestEstimationService interestEstimationService;
    private final String homeCurrency;

    public TotalAssetsService(InterestEstimationService interestEstimationService, String homeCurrency) {
        this.interestEstimationService = interestEstimationService;
        this.homeCurrency = Objects.requireNonNull(homeCurrency, "homeCurrency must not be null");
    }

    /**
     * Bank total is the plain sum of account balances.
     */
    public TotalAssetsSummary calculate(BigDecimal investmentTotal, List<BankAccount> bankAccounts) {
        Objects.requireNonNull(bankAccounts, "bankAccounts must not be null");
        return summarize(investmentTotal, bankAccounts, account -> BigDecimal.ONE);
    }

    /**
     * Converts foreign-currency accounts with {@code ratesToHome}: balances to 4 decimal places,
     * interest to cents. An account whose currency has no positive rate is left out of both the
     * bank total and the interest totals.
     */
    public TotalAssetsSummary calculate(BigDecimal investmentTotal,
                                        List<BankAccount> bankAccounts,
                                        Map<String, BigDecimal> ratesToHome) {
        Objects.requireNonNull(bankAccounts, "bankAccounts must not be null");
        Objects.requireNonNull(ratesToHome, "ratesToHome must not be null");
        return summarize(investmentTotal, bankAccounts, account -> rateToHome(account, ratesToHome));
    }

    private TotalAssetsSummary summarize(BigDecimal investmentTotal,
                                         List<BankAccount> bankAccounts,
                                         Function<BankAccount, BigDecimal> rateOf) {
        Objects.requireNonNull(investmentTotal, "investmentTotal must not be null");

        BigDecimal bankTotal = BigDecimal.ZERO;
        BigDecimal totalMonthlyInterest = BigDecimal.ZERO;
        BigDecimal totalYearlyInterest = BigDecimal.ZERO;
        for (BankAccount account : bankAccounts) {
            BigDecimal rate = rateOf.apply(account);
            if (rate == null) {
                continue;
            }
            InterestEstimate estimate = interestEstimationService.calculate(account);
            bankTotal = bankTotal.add(convert(account.getTotalAssets(), rate, 4));
            totalMonthlyInterest = totalMonthlyInterest.add(convert(estimate.monthlyInterest(), rate, 2));
            totalYearlyInterest = totalYearlyInterest.add(convert(estimate.yearlyInterest(), rate, 2));
        }

        BigDecimal grandTotal = investmentTotal.add(bankTotal);
        BigDecimal investmentPercentage = percentageOf(investmentTotal, grandTotal);
        BigDecimal bankPercentage = percentageOf(bankTotal, grandTotal);

        return new TotalAssetsSummary(
                investmentTotal,
                bankTotal,
                grandTotal,
                investmentPercentage,
                bankPercentage,
                totalMonthlyInterest,
                totalYearlyInterest);
    }

    /**
     * One for home-currency accounts, null when the account cannot be converted.
     */
    private BigDecimal rateToHome(BankAccount account, Map<String, BigDecimal> ratesToHome) {
        if (homeCurrency.equalsIgnoreCase(account.getCurrency())) {
            return BigDecimal.ONE;
        }
        BigDecimal rate = ratesToHome.get(account.getCurrency());
        return DecimalMath.isPositive(rate) ? rate : null;
    }

    private static BigDecimal convert(BigDecimal amount, BigDecimal rate, int scale) {
        if (rate.compareTo(BigDecimal.ONE) == 0) {
            return amount;
        }
        return DecimalMath.round(amount.multiply(rate), scale);
    }

    private static BigDecimal percentageOf(BigDecimal component, BigDecimal grandTotal) {
        if (grandTotal.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return DecimalMath.divide(component, grandTotal).multiply(DecimalMath.HUNDRED);
    }
}
