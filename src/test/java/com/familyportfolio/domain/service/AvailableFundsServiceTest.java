package com.familyportfolio.domain.service;

import com.familyportfolio.domain.model.AvailableFundsSummary;
import com.familyportfolio.domain.model.BankAccount;
import com.familyportfolio.domain.model.FixedDepositDetails;
import com.familyportfolio.domain.model.FixedDepositStatus;
import com.familyportfolio.domain.model.Installment;
import com.familyportfolio.domain.model.LedgerBalance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class AvailableFundsServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-15T00:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate TODAY = LocalDate.of(2025, 6, 15);

    private AvailableFundsService service;

    @BeforeEach
    void setUp() {
        service = new AvailableFundsService("TWD", CLOCK);
    }

    @Test
    void testCalculate_HomeCurrencyOnly_NeverAsksForRates() {
        // Given
        List<LedgerBalance> ledgers = List.of(new LedgerBalance(new BigDecimal("1000"), "TWD"));
        List<BankAccount> accounts = List.of(
                account("Bank A", "500", "TWD", null),
                account("Bank B", "300", "TWD", deposit(TODAY.minusMonths(13), FixedDepositStatus.MATURED, "30")));
        List<Installment> installments = List.of(new Installment(null, "Laptop", new BigDecimal("600"), 6, 3));
        Function<String, BigDecimal> rates = currency -> {
            throw new AssertionError("Unexpected rate lookup for " + currency);
        };

        // When
        AvailableFundsSummary summary = service.calculate(ledgers, accounts, installments, rates);

        // Then
        assertEquals(0, new BigDecimal("1830").compareTo(summary.totalBankAssets()));
        assertEquals(0, new BigDecimal("330").compareTo(summary.fixedDepositsPrincipal()));
        assertEquals(0, new BigDecimal("300").compareTo(summary.unpaidInstallmentBalance()));
        assertEquals(0, new BigDecimal("1530").compareTo(summary.availableFunds()));
    }

    @Test
    void testCalculate_MultiCurrency_ConvertsEachForeignAmount() {
        // Given
        List<LedgerBalance> ledgers = List.of(new LedgerBalance(new BigDecimal("50"), "USD"));
        List<BankAccount> accounts = List.of(
                account("TW Bank", "1000", "TWD", null),
                account("JP Bank", "10000", "JPY", null),
                account("US Bank", "100", "USD", deposit(TODAY.minusMonths(13), FixedDepositStatus.MATURED, "5")));
        List<Installment> installments = List.of(new Installment(null, "Phone", new BigDecimal("120"), 12, 6));
        Map<String, BigDecimal> rateTable = Map.of("USD", new BigDecimal("30"), "JPY", new BigDecimal("0.22"));
        List<String> lookups = new ArrayList<>();
        Function<String, BigDecimal> rates = currency -> {
            lookups.add(currency);
            return rateTable.get(currency);
        };

        // When
        AvailableFundsSummary summary = service.calculate(ledgers, accounts, installments, rates);

        // Then
        assertEquals(0, new BigDecimal("7850").compareTo(summary.totalBankAssets()));
        assertEquals(0, new BigDecimal("3150").compareTo(summary.fixedDepositsPrincipal()));
        assertEquals(0, new BigDecimal("60").compareTo(summary.unpaidInstallmentBalance()));
        assertEquals(0, new BigDecimal("7790").compareTo(summary.availableFunds()));
        assertEquals(List.of("USD", "JPY", "USD", "USD", "USD"), lookups);
    }

    @Test
    void testCalculate_OnlyMaturedDepositsReleaseInterest() {
        // Given
        LocalDate longAgo = TODAY.minusMonths(13);
        List<BankAccount> accounts = List.of(
                account("Savings", "2000", "TWD", null),
                account("Active FD", "200", "TWD", deposit(TODAY.minusMonths(1), FixedDepositStatus.ACTIVE, "20")),
                account("Matured FD", "300", "TWD", deposit(longAgo, FixedDepositStatus.MATURED, "30")),
                account("Closed FD", "400", "TWD", deposit(longAgo, FixedDepositStatus.CLOSED, "40")),
                account("Broken FD", "500", "TWD", deposit(longAgo, FixedDepositStatus.EARLY_WITHDRAWAL, "50")));

        // When
        AvailableFundsSummary summary = service.calculate(
                List.of(new LedgerBalance(BigDecimal.ZERO, "TWD")), accounts, List.of(), currency -> BigDecimal.ONE);

        // Then
        assertEquals(0, new BigDecimal("330").compareTo(summary.fixedDepositsPrincipal()));
        assertEquals(0, new BigDecimal("3430").compareTo(summary.totalBankAssets()));
        assertEquals(0, new BigDecimal("3430").compareTo(summary.availableFunds()));
    }

    @Test
    void testCalculate_ActiveDepositPastMaturity_CountsAsMatured() {
        // Given
        List<BankAccount> accounts = List.of(
                account("FD", "1000", "TWD", deposit(TODAY.minusMonths(12), FixedDepositStatus.ACTIVE, "15")));

        // When
        AvailableFundsSummary summary = service.calculate(List.of(), accounts, List.of(), currency -> BigDecimal.ONE);

        // Then
        assertEquals(0, new BigDecimal("1015").compareTo(summary.totalBankAssets()));
        assertEquals(0, new BigDecimal("1015").compareTo(summary.fixedDepositsPrincipal()));
    }

    @Test
    void testCalculate_OnlyOutstandingInstallmentsCount() {
        // Given
        Installment active = new Installment(null, "TV", new BigDecimal("1200"), 12, 4);
        Installment completed = new Installment(null, "Sofa", new BigDecimal("600"), 6, 0);
        Installment cancelled = new Installment(null, "Trip", new BigDecimal("800"), 10, 8);
        cancelled.cancel();

        // When
        AvailableFundsSummary summary = service.calculate(
                List.of(),
                List.of(account("Bank", "5000", "TWD", null)),
                List.of(active, completed, cancelled),
                currency -> BigDecimal.ONE);

        // Then
        assertEquals(0, new BigDecimal("400").compareTo(summary.unpaidInstallmentBalance()));
        assertEquals(0, new BigDecimal("4600").compareTo(summary.availableFunds()));
    }

    @Test
    void testCalculate_ZeroForeignAmounts_StillConverted() {
        // Given
        List<String> lookups = new ArrayList<>();
        Function<String, BigDecimal> rates = currency -> {
            lookups.add(currency);
            return new BigDecimal("30");
        };

        // When
        AvailableFundsSummary summary = service.calculate(
                List.of(new LedgerBalance(BigDecimal.ZERO, "EUR")),
                List.of(account("US Bank", "0", "USD", null)),
                List.of(new Installment(null, "Done", BigDecimal.ONE, 1, 0)),
                rates);

        // Then
        assertEquals(0, summary.totalBankAssets().signum());
        assertEquals(0, summary.fixedDepositsPrincipal().signum());
        assertEquals(0, summary.unpaidInstallmentBalance().signum());
        assertEquals(0, summary.availableFunds().signum());
        assertEquals(2, lookups.size());
    }

    @Test
    void testCalculate_NegativeLedgerBalance_ReducesFunds() {
        // When
        AvailableFundsSummary summary = service.calculate(
                List.of(new LedgerBalance(new BigDecimal("-200"), "TWD")),
                List.of(account("Bank", "1000", "TWD", null)),
                List.of(),
                currency -> BigDecimal.ONE);

        // Then
        assertEquals(0, new BigDecimal("800").compareTo(summary.availableFunds()));
    }

    @Test
    void testCalculate_NullArguments_Rejected() {
        Function<String, BigDecimal> rates = currency -> BigDecimal.ONE;

        assertThrows(NullPointerException.class, () -> service.calculate(null, List.of(), List.of(), rates));
        assertThrows(NullPointerException.class, () -> service.calculate(List.of(), null, List.of(), rates));
        assertThrows(NullPointerException.class, () -> service.calculate(List.of(), List.of(), null, rates));
        assertThrows(NullPointerException.class, () -> service.calculate(List.of(), List.of(), List.of(), null));
    }

    private static BankAccount account(String name, String totalAssets, String currency, FixedDepositDetails deposit) {
        return BankAccount.builder()
                .bankName(name)
                .totalAssets(new BigDecimal(totalAssets))
                .currency(currency)
                .fixedDeposit(deposit)
                .build();
    }

    private static FixedDepositDetails deposit(LocalDate startDate, FixedDepositStatus status, String expectedInterest) {
        return new FixedDepositDetails(12, startDate, status, new BigDecimal(expectedInterest), null);
    }
}
