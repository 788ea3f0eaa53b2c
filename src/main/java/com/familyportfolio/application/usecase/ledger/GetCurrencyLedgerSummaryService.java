package com.familyportfolio.application.usecase.ledger;

import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import com.familyportfolio.domain.port.CurrencyLedgerRepository;
import com.familyportfolio.domain.port.CurrencyTransactionRepository;
import com.familyportfolio.domain.service.CurrencyLedgerService;
import com.familyportfolio.domain.usecase.GetCurrencyLedgerSummaryUseCase;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ApplicationScoped
public class GetCurrencyLedgerSummaryService implements GetCurrencyLedgerSummaryUseCase {

    private static final Logger log = LoggerFactory.getLogger(GetCurrencyLedgerSummaryService.class);

    private final CurrencyLedgerRepository ledgerRepository;
    private final CurrencyTransactionRepository transactionRepository;
    private final CurrencyLedgerService ledgerService;

    public GetCurrencyLedgerSummaryService(CurrencyLedgerRepository ledgerRepository,
                                           CurrencyTransactionRepository transactionRepository,
                                           CurrencyLedgerService ledgerService) {
        this.ledgerRepository = ledgerRepository;
        this.transactionRepository = transactionRepository;
        this.ledgerService = ledgerService;
    }

    @Override
    public Uni<Result> execute(Command command) {
        log.debug("Summarizing currency ledger: ledgerId={}", command.ledgerId());

        return ledgerRepository.findById(command.ledgerId())
                .flatMap(ledger -> {
                    if (ledger == null) {
                        return Uni.createFrom().item((Result) new Result.NotFound(command.ledgerId()));
                    }
                    return transactionRepository.findByLedgerId(ledger.getId())
                            .map(transactions -> (Result) new Result.Success(ledger, ledgerService.summarize(transactions)));
                })
                .onFailure().recoverWithItem(throwable -> {
                    log.error("Error summarizing currency ledger {}", command.ledgerId(), throwable);
                    if (throwable instanceof ServiceException serviceException) {
                        return new Result.Error(serviceException.getError(), serviceException.getMessage());
                    }
                    return new Result.Error(Errors.CurrencyLedger.PERSISTENCE_ERROR,
                            "Failed to summarize currency ledger: " + throwable.getMessage());
                });
    }
}
