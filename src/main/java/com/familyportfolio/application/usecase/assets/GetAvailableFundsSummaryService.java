package com.familyportfolio.application.usecase.assets;

import com.familyportfolio.application.service.ExchangeRateTableService;
import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import com.familyportfolio.domain.model.BankAccount;
import com.familyportfolio.domain.model.CurrencyLedger;
import com.familyportfolio.domain.model.CurrencyTransaction;
import com.familyportfolio.domain.model.Installment;
import com.familyportfolio.domain.model.LedgerBalance;
import com.familyportfolio.domain.port.BankAccountRepository;
import com.familyportfolio.domain.port.CurrencyLedgerRepository;
import com.familyportfolio.domain.port.CurrencyTransactionRepository;
import com.familyportfolio.domain.port.InstallmentRepository;
import com.familyportfolio.domain.service.AvailableFundsService;
import com.familyportfolio.domain.service.CurrencyLedgerService;
import com.familyportfolio.domain.usecase.GetAvailableFundsSummaryUseCase;
import com.familyportfolio.infrastructure.config.CalculationConfig;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Service aggregating ledger cash, bank balances and outstanding installments into the funds a
 * family can still spend
 */
@ApplicationScoped
public class GetAvailableFundsSummaryService implements GetAvailableFundsSummaryUseCase {

    private static final Logger log = LoggerFactory.getLogger(GetAvailableFundsSummaryService.class);

    private final CurrencyLedgerRepository ledgerRepository;
    private final CurrencyTransactionRepository transactionRepository;
    private final BankAccountRepository bankAccountRepository;
    private final InstallmentRepository installmentRepository;
    private final CurrencyLedgerService ledgerService;
    private final AvailableFundsService availableFundsService;
    private final ExchangeRateTableService exchangeRateTableService;
    private final CalculationConfig config;

    public GetAvailableFundsSummaryService(CurrencyLedgerRepository ledgerRepository,
                                           CurrencyTransactionRepository transactionRepository,
                                           BankAccountRepository bankAccountRepository,
                                           InstallmentRepository installmentRepository,
                                           CurrencyLedgerService ledgerService,
                                           AvailableFundsService availableFundsService,
                                           ExchangeRateTableService exchangeRateTableService,
                                           CalculationConfig config) {
        this.ledgerRepository = ledgerRepository;
        this.transactionRepository = transactionRepository;
        this.bankAccountRepository = bankAccountRepository;
        this.installmentRepository = installmentRepository;
        this.ledgerService = ledgerService;
        this.availableFundsService = availableFundsService;
        this.exchangeRateTableService = exchangeRateTableService;
        this.config = config;
    }

    @Override
    public Uni<Result> execute(Command command) {
        log.info("Calculating available funds: userId={}", command.userId());

        return Uni.combine().all()
                .unis(loadLedgerBalances(command.userId()),
                        bankAccountRepository.findActiveByUserId(command.userId()),
                        installmentRepository.findByUserId(command.userId()))
                .asTuple()
                .flatMap(tuple -> {
                    List<LedgerBalance> balances = tuple.getItem1();
                    List<BankAccount> accounts = tuple.getItem2();
                    List<Installment> installments = tuple.getItem3();

                    return fetchRates(balances, accounts)
                            .map(rates -> (Result) new Result.Success(
                                    availableFundsService.calculate(balances, accounts, installments, currency -> rateFor(rates, currency))));
                })
                .onFailure().recoverWithItem(throwable -> {
                    if (throwable instanceof ServiceException serviceException) {
                        log.warn("Available funds not calculated for user {}: {}", command.userId(), serviceException.getMessage());
                        return new Result.Error(serviceException.getError(), serviceException.getMessage());
                    }
                    log.error("Error calculating available funds for user {}", command.userId(), throwable);
                    return new Result.Error(Errors.AssetsSummary.PERSISTENCE_ERROR,
                            "Failed to calculate available funds: " + throwable.getMessage());
                });
    }

    private Uni<List<LedgerBalance>> loadLedgerBalances(UUID userId) {
        return ledgerRepository.findByUserId(userId)
                .flatMap(ledgers -> {
                    List<CurrencyLedger> active = ledgers.stream()
                            .filter(CurrencyLedger::isActive)
                            .toList();
                    if (active.isEmpty()) {
                        return Uni.createFrom().item(List.<LedgerBalance>of());
                    }
                    return transactionRepository.findByLedgerIds(active.stream().map(CurrencyLedger::getId).toList())
                            .map(transactions -> active.stream()
                                    .map(ledger -> new LedgerBalance(
                                            ledgerService.calculateBalance(transactionsOf(ledger, transactions)),
                                            ledger.getCurrencyCode()))
                                    .toList());
                });
    }

    private static List<CurrencyTransaction> transactionsOf(CurrencyLedger ledger, List<CurrencyTransaction> transactions) {
        return transactions.stream()
                .filter(transaction -> ledger.getId().equals(transaction.getLedgerId()))
                .toList();
    }

    private Uni<Map<String, BigDecimal>> fetchRates(List<LedgerBalance> balances, List<BankAccount> accounts) {
        Set<String> currencies = new LinkedHashSet<>();
        balances.forEach(balance -> currencies.add(balance.currencyCode()));
        accounts.forEach(account -> currencies.add(account.getCurrency()));
        currencies.removeIf(currency -> currency.equalsIgnoreCase(config.homeCurrency()));

        return exchangeRateTableService.fetchAvailableRates(currencies)
                .onFailure().transform(throwable -> new ServiceException(Errors.AssetsSummary.EXCHANGE_RATE_UNAVAILABLE,
                        "Exchange rate unavailable: " + throwable.getMessage(), throwable));
    }

    /**
     * A currency without a rate contributes nothing to the home-currency totals.
     */
    private static BigDecimal rateFor(Map<String, BigDecimal> rates, String currency) {
        BigDecimal rate = rates.get(currency.toUpperCase(Locale.ROOT));
        if (rate == null || rate.signum() <= 0) {
            log.warn("No exchange rate for {}, excluding its balances from available funds", currency);
            return BigDecimal.ZERO;
        }
        return rate;
    }
}
