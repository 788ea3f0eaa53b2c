package com.familyportfolio.application.usecase.stock;

import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import com.familyportfolio.domain.model.CurrencyLedger;
import com.familyportfolio.domain.model.CurrencyTransaction;
import com.familyportfolio.domain.model.Portfolio;
import com.familyportfolio.domain.model.StockMarket;
import com.familyportfolio.domain.model.StockTransaction;
import com.familyportfolio.domain.port.CurrencyLedgerRepository;
import com.familyportfolio.domain.port.CurrencyTransactionRepository;
import com.familyportfolio.domain.port.PortfolioRepository;
import com.familyportfolio.domain.port.StockTransactionRepository;
import com.familyportfolio.domain.service.CurrencyLedgerService;
import com.familyportfolio.domain.service.StockSplitAdjustmentService;
import com.familyportfolio.domain.service.StockTransactionLinkingService;
import com.familyportfolio.domain.usecase.CreateStockTransactionUseCase;
import com.familyportfolio.infrastructure.config.CalculationConfig;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Service recording a stock trade. When the portfolio has a bound ledger the trade is settled
 * on it: a buy spends ledger cash and a sell books the net proceeds.
 */
@ApplicationScoped
public class CreateStockTransactionService implements CreateStockTransactionUseCase {

    private static final Logger log = LoggerFactory.getLogger(CreateStockTransactionService.class);

    private final PortfolioRepository portfolioRepository;
    private final StockTransactionRepository stockTransactionRepository;
    private final CurrencyLedgerRepository ledgerRepository;
    private final CurrencyTransactionRepository currencyTransactionRepository;
    private final StockSplitAdjustmentService splitAdjustmentService;
    private final StockTransactionLinkingService linkingService;
    private final CurrencyLedgerService ledgerService;
    private final CalculationConfig config;
    private final Clock clock;

    public CreateStockTransactionService(PortfolioRepository portfolioRepository,
                                         StockTransactionRepository stockTransactionRepository,
                                         CurrencyLedgerRepository ledgerRepository,
                                         CurrencyTransactionRepository currencyTransactionRepository,
                                         StockSplitAdjustmentService splitAdjustmentService,
                                         StockTransactionLinkingService linkingService,
                                         CurrencyLedgerService ledgerService,
                                         CalculationConfig config,
                                         Clock clock) {
        this.portfolioRepository = portfolioRepository;
        this.stockTransactionRepository = stockTransactionRepository;
        this.ledgerRepository = ledgerRepository;
        this.currencyTransactionRepository = currencyTransactionRepository;
        this.splitAdjustmentService = splitAdjustmentService;
        this.linkingService = linkingService;
        this.ledgerService = ledgerService;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<Result> execute(Command command) {
        log.info("Creating stock transaction: portfolioId={}, ticker={}, type={}, date={}",
                command.portfolioId(), command.ticker(), command.transactionType(), command.transactionDate());

        return portfolioRepository.findById(command.portfolioId())
                .flatMap(portfolio -> {
                    if (portfolio == null) {
                        throw new ServiceException(Errors.StockTransaction.PORTFOLIO_NOT_FOUND,
                                "Portfolio not found: " + command.portfolioId());
                    }
                    StockTransaction transaction = buildTransaction(portfolio, command);

                    if (!config.stockLinking().enabled() || !portfolio.hasBoundLedger()) {
                        return stockTransactionRepository.save(transaction)
                                .map(saved -> (Result) new Result.Success(saved, null));
                    }
                    return ledgerRepository.findById(portfolio.getBoundLedgerId())
                            .flatMap(ledger -> {
                                if (ledger == null) {
                                    throw new ServiceException(Errors.CurrencyTransaction.LEDGER_NOT_FOUND,
                                            "Bound currency ledger not found: " + portfolio.getBoundLedgerId());
                                }
                                return settleOnLedger(transaction, ledger);
                            });
                })
                .onFailure().recoverWithItem(throwable -> {
                    if (throwable instanceof ServiceException serviceException) {
                        log.warn("Stock transaction rejected for portfolio {}: {}", command.portfolioId(), serviceException.getMessage());
                        return new Result.Error(serviceException.getError(), serviceException.getMessage());
                    }
                    log.error("Error creating stock transaction for portfolio {}", command.portfolioId(), throwable);
                    return new Result.Error(Errors.StockTransaction.PERSISTENCE_ERROR,
                            "Failed to create stock transaction: " + throwable.getMessage());
                });
    }

    private Uni<Result> settleOnLedger(StockTransaction transaction, CurrencyLedger ledger) {
        linkingService.ensureCurrencyMatches(transaction, ledger);

        Uni<Void> balanceCheck = transaction.isBuy() && config.stockLinking().strictBalance()
                ? ensureSufficientBalance(transaction, ledger)
                : Uni.createFrom().voidItem();

        return balanceCheck.flatMap(ignored -> {
            Optional<CurrencyTransaction> linked = linkingService.createLinkedTransaction(transaction, ledger, clock.instant());
            if (linked.isEmpty()) {
                return stockTransactionRepository.save(transaction)
                        .map(saved -> (Result) new Result.Success(saved, null));
            }

            CurrencyTransaction settlement = linked.get();
            transaction.linkCurrencyTransaction(settlement.getId());
            return stockTransactionRepository.save(transaction)
                    .flatMap(saved -> currencyTransactionRepository.save(settlement)
                            .onFailure().call(failure -> discardUnsettled(saved))
                            .map(savedSettlement -> {
                                log.info("Stock transaction {} settled on ledger {} by {} {}",
                                        saved.getId(), ledger.getId(),
                                        savedSettlement.getTransactionType().getDisplayName(), savedSettlement.getForeignAmount());
                                return (Result) new Result.Success(saved, savedSettlement);
                            }));
        });
    }

    /**
     * Removes a stock row whose ledger settlement could not be stored. The settlement failure is
     * still reported to the caller.
     */
    private Uni<Void> discardUnsettled(StockTransaction saved) {
        log.warn("Settlement for stock transaction {} failed, removing the unsettled row", saved.getId());
        return stockTransactionRepository.deleteById(saved.getId())
                .onFailure().invoke(deleteFailure -> log.error(
                        "Could not remove unsettled stock transaction {}", saved.getId(), deleteFailure))
                .onFailure().recoverWithNull();
    }

    private Uni<Void> ensureSufficientBalance(StockTransaction transaction, CurrencyLedger ledger) {
        return currencyTransactionRepository.findByLedgerId(ledger.getId())
                .invoke(ledgerTransactions -> {
                    if (!ledgerService.validateSpend(ledgerTransactions, linkingService.requiredFunds(transaction))) {
                        throw new ServiceException(Errors.StockTransaction.INSUFFICIENT_BALANCE,
                                "Ledger balance " + ledgerService.calculateBalance(ledgerTransactions).toPlainString()
                                        + " " + ledger.getCurrencyCode() + " does not cover "
                                        + linkingService.requiredFunds(transaction).toPlainString());
                    }
                })
                .replaceWithVoid();
    }

    private StockTransaction buildTransaction(Portfolio portfolio, Command command) {
        StockMarket market = command.market() != null
                ? command.market()
                : splitAdjustmentService.detectMarket(command.ticker());

        return StockTransaction.builder()
                .portfolioId(portfolio.getId())
                .transactionDate(command.transactionDate())
                .ticker(command.ticker())
                .market(market)
                .transactionType(command.transactionType())
                .shares(command.shares())
                .pricePerShare(command.pricePerShare())
                .exchangeRate(command.exchangeRate())
                .fees(command.fees())
                .currency(command.currency() != null ? command.currency() : portfolio.getBaseCurrency())
                .notes(command.notes())
                .build();
    }
}
