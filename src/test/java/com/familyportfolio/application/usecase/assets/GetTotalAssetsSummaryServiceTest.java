package com.familyportfolio.application.usecase.assets;

import com.familyportfolio.application.service.ExchangeRateTableService;
import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.model.BankAccount;
import com.familyportfolio.domain.model.TotalAssetsSummary;
import com.familyportfolio.domain.port.BankAccountRepository;
import com.familyportfolio.domain.service.InterestEstimationService;
import com.familyportfolio.domain.service.TotalAssetsService;
import com.familyportfolio.domain.usecase.GetTotalAssetsSummaryUseCase;
import com.familyportfolio.infrastructure.config.CalculationConfig;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class GetTotalAssetsSummaryServiceTest {

    private static final UUID USER_ID = UUID.randomUUID();

    private BankAccountRepository bankAccountRepository;
    private ExchangeRateTableService exchangeRateTableService;
    private GetTotalAssetsSummaryService service;

    @BeforeEach
    void setUp() {
        bankAccountRepository = mock(BankAccountRepository.class);
        exchangeRateTableService = mock(ExchangeRateTableService.class);
        CalculationConfig config = mock(CalculationConfig.class);
        when(config.homeCurrency()).thenReturn("TWD");

        service = new GetTotalAssetsSummaryService(bankAccountRepository,
                new TotalAssetsService(new InterestEstimationService(), "TWD"), exchangeRateTableService, config);
    }

    @Test
    void testExecute_ConvertsForeignAccountsAndSplitsTotals() {
        // Given
        when(bankAccountRepository.findActiveByUserId(USER_ID)).thenReturn(Uni.createFrom().item(List.of(
                account("Savings", "400000", "TWD", "1.5"),
                account("Overseas", "1000", "USD", "0"),
                account("Overseas 2", "500", "usd", "0"))));
        when(exchangeRateTableService.fetchAvailableRates(any()))
                .thenReturn(Uni.createFrom().item(Map.of("USD", new BigDecimal("20"))));

        // When
        GetTotalAssetsSummaryUseCase.Result result = execute(new BigDecimal("570000"));

        // Then
        TotalAssetsSummary summary = assertInstanceOf(GetTotalAssetsSummaryUseCase.Result.Success.class, result).summary();
        assertEquals(0, new BigDecimal("430000").compareTo(summary.bankTotal()));
        assertEquals(0, new BigDecimal("1000000").compareTo(summary.grandTotal()));
        assertEquals(0, new BigDecimal("57").compareTo(summary.investmentPercentage()));
        assertEquals(0, new BigDecimal("43").compareTo(summary.bankPercentage()));
        assertEquals(new BigDecimal("500.00"), summary.totalMonthlyInterest());
        verify(exchangeRateTableService).fetchAvailableRates(List.of("USD"));
    }

    @Test
    void testExecute_UnavailableRate_AccountLeftOut() {
        // Given
        when(bankAccountRepository.findActiveByUserId(USER_ID)).thenReturn(Uni.createFrom().item(List.of(
                account("Local", "10000", "TWD", "0"),
                account("Tokyo", "50000", "JPY", "0"))));
        when(exchangeRateTableService.fetchAvailableRates(any())).thenReturn(Uni.createFrom().item(Map.of()));

        // When
        GetTotalAssetsSummaryUseCase.Result result = execute(new BigDecimal("10000"));

        // Then
        TotalAssetsSummary summary = ((GetTotalAssetsSummaryUseCase.Result.Success) result).summary();
        assertEquals(0, new BigDecimal("10000").compareTo(summary.bankTotal()));
        assertEquals(0, new BigDecimal("50").compareTo(summary.bankPercentage()));
    }

    @Test
    void testExecute_NullInvestmentTotal_InvalidInput() {
        // When
        GetTotalAssetsSummaryUseCase.Result result = execute(null);

        // Then
        GetTotalAssetsSummaryUseCase.Result.Error error =
                assertInstanceOf(GetTotalAssetsSummaryUseCase.Result.Error.class, result);
        assertEquals(Errors.AssetsSummary.INVALID_INPUT, error.error());
        verifyNoInteractions(bankAccountRepository, exchangeRateTableService);
    }

    @Test
    void testExecute_RepositoryFails_PersistenceError() {
        // Given
        when(bankAccountRepository.findActiveByUserId(USER_ID))
                .thenReturn(Uni.createFrom().failure(new RuntimeException("Connection refused")));

        // When
        GetTotalAssetsSummaryUseCase.Result result = execute(BigDecimal.ZERO);

        // Then
        assertEquals(Errors.AssetsSummary.PERSISTENCE_ERROR, ((GetTotalAssetsSummaryUseCase.Result.Error) result).error());
    }

    private static BankAccount account(String name, String totalAssets, String currency, String rate) {
        return BankAccount.builder()
                .userId(USER_ID)
                .bankName(name)
                .totalAssets(new BigDecimal(totalAssets))
                .currency(currency)
                .interestRate(new BigDecimal(rate))
                .build();
    }

    private GetTotalAssetsSummaryUseCase.Result execute(BigDecimal investmentTotal) {
        return service.execute(new GetTotalAssetsSummaryUseCase.Command(USER_ID, investmentTotal))
                .subscribe()
                .withSubscriber(UniAssertSubscriber.create())
                .assertCompleted()
                .getItem();
    }
}
