package com.familyportfolio.application.usecase.assets;

import com.familyportfolio.application.service.ExchangeRateTableService;
import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.model.AvailableFundsSummary;
import com.familyportfolio.domain.model.BankAccount;
import com.familyportfolio.domain.model.CurrencyLedger;
import com.familyportfolio.domain.model.CurrencyTransaction;
import com.familyportfolio.domain.model.CurrencyTransactionType;
import com.familyportfolio.domain.model.Installment;
import com.familyportfolio.domain.port.BankAccountRepository;
import com.familyportfolio.domain.port.CurrencyLedgerRepository;
import com.familyportfolio.domain.port.CurrencyTransactionRepository;
import com.familyportfolio.domain.port.InstallmentRepository;
import com.familyportfolio.domain.service.AvailableFundsService;
import com.familyportfolio.domain.service.CurrencyLedgerService;
import com.familyportfolio.domain.service.TransactionClassificationPolicy;
import com.familyportfolio.domain.usecase.GetAvailableFundsSummaryUseCase;
import com.familyportfolio.infrastructure.config.CalculationConfig;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class GetAvailableFundsSummaryServiceTest {

    private static final UUID USER_ID = UUID.randomUUID();

    private CurrencyLedgerRepository ledgerRepository;
    private CurrencyTransactionRepository transactionRepository;
    private BankAccountRepository bankAccountRepository;
    private InstallmentRepository installmentRepository;
    private ExchangeRateTableService exchangeRateTableService;
    private GetAvailableFundsSummaryService service;

    private CurrencyLedger twdLedger;
    private CurrencyLedger usdLedger;

    @BeforeEach
    void setUp() {
        ledgerRepository = mock(CurrencyLedgerRepository.class);
        transactionRepository = mock(CurrencyTransactionRepository.class);
        bankAccountRepository = mock(BankAccountRepository.class);
        installmentRepository = mock(InstallmentRepository.class);
        exchangeRateTableService = mock(ExchangeRateTableService.class);
        CalculationConfig config = mock(CalculationConfig.class);
        when(config.homeCurrency()).thenReturn("TWD");

        Clock clock = Clock.fixed(Instant.parse("2025-06-15T00:00:00Z"), ZoneOffset.UTC);
        service = new GetAvailableFundsSummaryService(ledgerRepository, transactionRepository, bankAccountRepository,
                installmentRepository, new CurrencyLedgerService(new TransactionClassificationPolicy()),
                new AvailableFundsService("TWD", clock), exchangeRateTableService, config);

        twdLedger = new CurrencyLedger(UUID.randomUUID(), USER_ID, "TWD", "TWD", "Cash", true);
        usdLedger = new CurrencyLedger(UUID.randomUUID(), USER_ID, "USD", "TWD", "Brokerage", true);
        CurrencyLedger closedJpyLedger = new CurrencyLedger(UUID.randomUUID(), USER_ID, "JPY", "TWD", "Travel", false);

        when(ledgerRepository.findByUserId(USER_ID))
                .thenReturn(Uni.createFrom().item(List.of(twdLedger, usdLedger, closedJpyLedger)));
        when(transactionRepository.findByLedgerIds(anyList())).thenReturn(Uni.createFrom().item(List.of(
                transaction(twdLedger, CurrencyTransactionType.DEPOSIT, "1000", null),
                transaction(usdLedger, CurrencyTransactionType.EXCHANGE_BUY, "100", "3000"))));
        when(bankAccountRepository.findActiveByUserId(USER_ID)).thenReturn(Uni.createFrom().item(List.of(
                account("Local", "5000", "TWD"),
                account("Overseas", "200", "USD"))));
        when(installmentRepository.findByUserId(USER_ID)).thenReturn(Uni.createFrom().item(List.of(
                new Installment(null, "TV", new BigDecimal("1200"), 12, 4))));
    }

    @Test
    void testExecute_CombinesLedgersBanksAndInstallments() {
        // Given
        when(exchangeRateTableService.fetchAvailableRates(any()))
                .thenReturn(Uni.createFrom().item(Map.of("USD", new BigDecimal("30"))));

        // When
        GetAvailableFundsSummaryUseCase.Result result = execute();

        // Then
        AvailableFundsSummary summary =
                assertInstanceOf(GetAvailableFundsSummaryUseCase.Result.Success.class, result).summary();
        assertEquals(0, new BigDecimal("15000").compareTo(summary.totalBankAssets()));
        assertEquals(0, BigDecimal.ZERO.compareTo(summary.fixedDepositsPrincipal()));
        assertEquals(0, new BigDecimal("400").compareTo(summary.unpaidInstallmentBalance()));
        assertEquals(0, new BigDecimal("14600").compareTo(summary.availableFunds()));
        verify(exchangeRateTableService).fetchAvailableRates(argThat(currencies ->
                currencies.size() == 1 && currencies.contains("USD")));
        verify(transactionRepository).findByLedgerIds(List.of(twdLedger.getId(), usdLedger.getId()));
    }

    @Test
    void testExecute_NoActiveLedgers_SkipsLedgerTransactions() {
        // Given
        when(ledgerRepository.findByUserId(USER_ID)).thenReturn(Uni.createFrom().item(List.of()));
        when(bankAccountRepository.findActiveByUserId(USER_ID))
                .thenReturn(Uni.createFrom().item(List.of(account("Local", "5000", "TWD"))));
        when(exchangeRateTableService.fetchAvailableRates(any())).thenReturn(Uni.createFrom().item(Map.of()));

        // When
        GetAvailableFundsSummaryUseCase.Result result = execute();

        // Then
        AvailableFundsSummary summary = ((GetAvailableFundsSummaryUseCase.Result.Success) result).summary();
        assertEquals(0, new BigDecimal("4600").compareTo(summary.availableFunds()));
        verifyNoInteractions(transactionRepository);
    }

    @Test
    void testExecute_RateLookupFails_ExchangeRateUnavailable() {
        // Given
        when(exchangeRateTableService.fetchAvailableRates(any()))
                .thenReturn(Uni.createFrom().failure(new RuntimeException("provider down")));

        // When
        GetAvailableFundsSummaryUseCase.Result result = execute();

        // Then
        GetAvailableFundsSummaryUseCase.Result.Error error =
                assertInstanceOf(GetAvailableFundsSummaryUseCase.Result.Error.class, result);
        assertEquals(Errors.AssetsSummary.EXCHANGE_RATE_UNAVAILABLE, error.error());
        assertTrue(error.message().contains("provider down"));
    }

    @Test
    void testExecute_RateMissingFromTable_ForeignBalancesExcluded() {
        // Given
        when(exchangeRateTableService.fetchAvailableRates(any())).thenReturn(Uni.createFrom().item(Map.of()));

        // When
        GetAvailableFundsSummaryUseCase.Result result = execute();

        // Then
        AvailableFundsSummary summary =
                assertInstanceOf(GetAvailableFundsSummaryUseCase.Result.Success.class, result).summary();
        assertEquals(0, new BigDecimal("6000").compareTo(summary.totalBankAssets()));
        assertEquals(0, new BigDecimal("400").compareTo(summary.unpaidInstallmentBalance()));
        assertEquals(0, new BigDecimal("5600").compareTo(summary.availableFunds()));
    }

    @Test
    void testExecute_RepositoryFails_PersistenceError() {
        // Given
        when(installmentRepository.findByUserId(USER_ID))
                .thenReturn(Uni.createFrom().failure(new RuntimeException("Connection reset")));

        // When
        GetAvailableFundsSummaryUseCase.Result result = execute();

        // Then
        assertEquals(Errors.AssetsSummary.PERSISTENCE_ERROR,
                ((GetAvailableFundsSummaryUseCase.Result.Error) result).error());
    }

    private static CurrencyTransaction transaction(CurrencyLedger ledger, CurrencyTransactionType type,
                                                   String amount, String homeAmount) {
        return CurrencyTransaction.builder()
                .ledgerId(ledger.getId())
                .transactionType(type)
                .foreignAmount(new BigDecimal(amount))
                .homeAmount(homeAmount != null ? new BigDecimal(homeAmount) : null)
                .transactionDate(LocalDate.of(2025, 1, 10))
                .build();
    }

    private static BankAccount account(String name, String totalAssets, String currency) {
        return BankAccount.builder()
                .userId(USER_ID)
                .bankName(name)
                .totalAssets(new BigDecimal(totalAssets))
                .currency(currency)
                .build();
    }

    private GetAvailableFundsSummaryUseCase.Result execute() {
        return service.execute(new GetAvailableFundsSummaryUseCase.Command(USER_ID))
                .subscribe()
                .withSubscriber(UniAssertSubscriber.create())
                .assertCompleted()
                .getItem();
    }
}
