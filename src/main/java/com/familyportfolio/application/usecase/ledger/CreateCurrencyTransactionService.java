package com.familyportfolio.application.usecase.ledger;

import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import com.familyportfolio.domain.model.AmountPresence;
import com.familyportfolio.domain.model.CurrencyLedger;
import com.familyportfolio.domain.model.CurrencyTransaction;
import com.familyportfolio.domain.port.CurrencyLedgerRepository;
import com.familyportfolio.domain.port.CurrencyTransactionRepository;
import com.familyportfolio.domain.service.TransactionClassificationPolicy;
import com.familyportfolio.domain.usecase.CreateCurrencyTransactionUseCase;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Service recording a manually entered ledger movement
 */
@ApplicationScoped
public class CreateCurrencyTransactionService implements CreateCurrencyTransactionUseCase {

    private static final Logger log = LoggerFactory.getLogger(CreateCurrencyTransactionService.class);

    private final CurrencyLedgerRepository ledgerRepository;
    private final CurrencyTransactionRepository transactionRepository;
    private final TransactionClassificationPolicy classificationPolicy;
    private final Clock clock;

    public CreateCurrencyTransactionService(CurrencyLedgerRepository ledgerRepository,
                                            CurrencyTransactionRepository transactionRepository,
                                            TransactionClassificationPolicy classificationPolicy,
                                            Clock clock) {
        this.ledgerRepository = ledgerRepository;
        this.transactionRepository = transactionRepository;
        this.classificationPolicy = classificationPolicy;
        this.clock = clock;
    }

    @Override
    public Uni<Result> execute(Command command) {
        log.info("Creating currency transaction: ledgerId={}, type={}, date={}",
                command.ledgerId(), command.transactionType(), command.transactionDate());

        return ledgerRepository.findById(command.ledgerId())
                .flatMap(ledger -> {
                    if (ledger == null) {
                        throw new ServiceException(Errors.CurrencyTransaction.LEDGER_NOT_FOUND,
                                "Currency ledger not found: " + command.ledgerId());
                    }
                    CurrencyTransaction transaction = buildTransaction(ledger, command);
                    return transactionRepository.save(transaction);
                })
                .map(saved -> {
                    log.info("Currency transaction created: id={}, ledgerId={}", saved.getId(), saved.getLedgerId());
                    return (Result) new Result.Success(saved);
                })
                .onFailure().recoverWithItem(throwable -> {
                    if (throwable instanceof ServiceException serviceException) {
                        log.warn("Currency transaction rejected for ledger {}: {}", command.ledgerId(), serviceException.getMessage());
                        return new Result.Error(serviceException.getError(), serviceException.getMessage());
                    }
                    log.error("Error creating currency transaction for ledger {}", command.ledgerId(), throwable);
                    return new Result.Error(Errors.CurrencyTransaction.PERSISTENCE_ERROR,
                            "Failed to create currency transaction: " + throwable.getMessage());
                });
    }

    private CurrencyTransaction buildTransaction(CurrencyLedger ledger, Command command) {
        if (command.transactionType() == null) {
            throw new ServiceException(Errors.CurrencyTransaction.INVALID_INPUT, "Transaction type is required");
        }
        classificationPolicy.ensureValidOrThrow(ledger, command.transactionType(), new AmountPresence(
                command.foreignAmount() != null,
                command.homeAmount() != null || command.exchangeRate() != null));

        BigDecimal homeAmount = command.homeAmount();
        BigDecimal exchangeRate = command.exchangeRate();
        // on a home-currency ledger both sides are the same money
        if (ledger.isHomeCurrencyLedger()) {
            homeAmount = command.foreignAmount();
            exchangeRate = BigDecimal.ONE;
        }

        return CurrencyTransaction.builder()
                .ledgerId(ledger.getId())
                .transactionDate(command.transactionDate())
                .transactionType(command.transactionType())
                .foreignAmount(command.foreignAmount())
                .homeAmount(homeAmount)
                .exchangeRate(exchangeRate)
                .relatedStockTransactionId(command.relatedStockTransactionId())
                .internalSettlement(command.internalSettlement())
                .notes(command.notes())
                .createdAt(clock.instant())
                .build();
    }
}
