package com.familyportfolio.application.usecase.assets;

import com.familyportfolio.application.service.ExchangeRateTableService;
import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import com.familyportfolio.domain.model.BankAccount;
import com.familyportfolio.domain.port.BankAccountRepository;
import com.familyportfolio.domain.service.TotalAssetsService;
import com.familyportfolio.domain.usecase.GetTotalAssetsSummaryUseCase;
import com.familyportfolio.infrastructure.config.CalculationConfig;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

@ApplicationScoped
public class GetTotalAssetsSummaryService implements GetTotalAssetsSummaryUseCase {

    private static final Logger log = LoggerFactory.getLogger(GetTotalAssetsSummaryService.class);

    private final BankAccountRepository bankAccountRepository;
    private final TotalAssetsService totalAssetsService;
    private final ExchangeRateTableService exchangeRateTableService;
    private final CalculationConfig config;

    public GetTotalAssetsSummaryService(BankAccountRepository bankAccountRepository,
                                        TotalAssetsService totalAssetsService,
                                        ExchangeRateTableService exchangeRateTableService,
                                        CalculationConfig config) {
        this.bankAccountRepository = bankAccountRepository;
        this.totalAssetsService = totalAssetsService;
        this.exchangeRateTableService = exchangeRateTableService;
        this.config = config;
    }

    @Override
    public Uni<Result> execute(Command command) {
        log.info("Calculating total assets: userId={}", command.userId());

        if (command.investmentTotal() == null) {
            return Uni.createFrom().item((Result) new Result.Error(Errors.AssetsSummary.INVALID_INPUT, "Investment total is required"));
        }

        return bankAccountRepository.findActiveByUserId(command.userId())
                .flatMap(accounts -> exchangeRateTableService.fetchAvailableRates(foreignCurrencies(accounts))
                        .map(rates -> (Result) new Result.Success(
                                totalAssetsService.calculate(command.investmentTotal(), accounts, rates))))
                .onFailure().recoverWithItem(throwable -> {
                    log.error("Error calculating total assets for user {}", command.userId(), throwable);
                    if (throwable instanceof ServiceException serviceException) {
                        return new Result.Error(serviceException.getError(), serviceException.getMessage());
                    }
                    return new Result.Error(Errors.AssetsSummary.PERSISTENCE_ERROR,
                            "Failed to calculate total assets: " + throwable.getMessage());
                });
    }

    private List<String> foreignCurrencies(List<BankAccount> accounts) {
        return accounts.stream()
                .map(BankAccount::getCurrency)
                .filter(currency -> !currency.equalsIgnoreCase(config.homeCurrency()))
                .distinct()
                .toList();
    }
}
