package com.familyportfolio.application.usecase.ledger;

import com.familyportfolio.domain.exception.Errors;
import com.familyportfolio.domain.exception.ServiceException;
import com.familyportfolio.domain.model.AmountPresence;
import com.familyportfolio.domain.model.CurrencyLedger;
import com.familyportfolio.domain.model.CurrencyTransaction;
import com.familyportfolio.domain.model.CurrencyTransactionType;
import com.familyportfolio.domain.model.ImportRowError;
import com.familyportfolio.domain.model.ImportSummary;
import com.familyportfolio.domain.model.TransactionDiagnostic;
import com.familyportfolio.domain.port.CurrencyLedgerRepository;
import com.familyportfolio.domain.port.CurrencyTransactionRepository;
import com.familyportfolio.domain.service.TransactionClassificationPolicy;
import com.familyportfolio.domain.usecase.ImportCurrencyTransactionsUseCase;
import com.familyportfolio.infrastructure.config.CalculationConfig;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Service validating and committing a CSV batch of ledger movements. Every row is validated
 * before anything is written; a single invalid row rejects the whole batch with the full list
 * of problems.
 */
@ApplicationScoped
public class ImportCurrencyTransactionsService implements ImportCurrencyTransactionsUseCase {

    private static final Logger log = LoggerFactory.getLogger(ImportCurrencyTransactionsService.class);

    static final String CSV_EMPTY = "CSV_EMPTY";
    static final String CSV_NO_DATA_ROWS = "CSV_NO_DATA_ROWS";
    static final String CSV_HEADER_MISSING = "CSV_HEADER_MISSING";
    static final String CSV_ROW_LIMIT_EXCEEDED = "CSV_ROW_LIMIT_EXCEEDED";
    static final String INVALID_DATE_FORMAT = "INVALID_DATE_FORMAT";
    static final String INVALID_NUMBER_FORMAT = "INVALID_NUMBER_FORMAT";
    static final String INVALID_ENUM_VALUE = "INVALID_ENUM_VALUE";
    static final String VALUE_OUT_OF_RANGE = "VALUE_OUT_OF_RANGE";
    static final String FIELD_LENGTH_EXCEEDED = "FIELD_LENGTH_EXCEEDED";

    static final String FIELD_FILE = "file";
    static final String FIELD_DATE = "transactionDate";
    static final String FIELD_TYPE = "transactionType";
    static final String FIELD_FOREIGN_AMOUNT = "foreignAmount";
    static final String FIELD_HOME_AMOUNT = "homeAmount";
    static final String FIELD_EXCHANGE_RATE = "exchangeRate";
    static final String FIELD_NOTES = "notes";

    private static final int HEADER_ROW = 1;

    private static final Map<String, List<String>> HEADER_ALIASES = Map.of(
            FIELD_DATE, List.of("transactionDate", "transaction_date", "date", "交易日期", "日期"),
            FIELD_TYPE, List.of("transactionType", "transaction_type", "type", "transaction", "交易類型", "類型", "種類"),
            FIELD_FOREIGN_AMOUNT, List.of("foreignAmount", "foreign_amount", "amount", "外幣金額", "外幣", "金額"),
            FIELD_HOME_AMOUNT, List.of("homeAmount", "home_amount", "targetAmount", "target_amount", "台幣金額", "台幣", "twdAmount"),
            FIELD_EXCHANGE_RATE, List.of("exchangeRate", "exchange_rate", "rate", "匯率"),
            FIELD_NOTES, List.of("notes", "memo", "description", "備註", "說明")
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("uuuu-M-d"),
            DateTimeFormatter.ofPattern("uuuu/M/d"),
            DateTimeFormatter.ofPattern("M/d/uuuu")
    ).stream().map(formatter -> formatter.withResolverStyle(ResolverStyle.STRICT)).toList();

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ofPattern("uuuu-M-d HH:mm:ss"),
            DateTimeFormatter.ofPattern("uuuu/M/d HH:mm:ss"),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME
    ).stream().map(formatter -> formatter.withResolverStyle(ResolverStyle.STRICT)).toList();

    private final CurrencyLedgerRepository ledgerRepository;
    private final CurrencyTransactionRepository transactionRepository;
    private final TransactionClassificationPolicy classificationPolicy;
    private final CalculationConfig config;
    private final Clock clock;

    public ImportCurrencyTransactionsService(CurrencyLedgerRepository ledgerRepository,
                                             CurrencyTransactionRepository transactionRepository,
                                             TransactionClassificationPolicy classificationPolicy,
                                             CalculationConfig config,
                                             Clock clock) {
        this.ledgerRepository = ledgerRepository;
        this.transactionRepository = transactionRepository;
        this.classificationPolicy = classificationPolicy;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<Result> execute(Command command) {
        log.info("Importing currency transactions: ledgerId={}, rows={}",
                command.ledgerId(), command.dataRows() != null ? command.dataRows().size() : 0);

        return ledgerRepository.findById(command.ledgerId())
                .flatMap(ledger -> {
                    if (ledger == null) {
                        return Uni.createFrom().item((Result) new Result.NotFound(command.ledgerId()));
                    }
                    return importRows(ledger, command);
                })
                .onFailure().recoverWithItem(throwable -> {
                    log.error("Error importing currency transactions into ledger {}", command.ledgerId(), throwable);
                    if (throwable instanceof ServiceException serviceException) {
                        return new Result.Error(serviceException.getError(), serviceException.getMessage());
                    }
                    return new Result.Error(Errors.ImportCurrencyTransactions.PERSISTENCE_ERROR,
                            "Failed to import currency transactions: " + throwable.getMessage());
                });
    }

    private Uni<Result> importRows(CurrencyLedger ledger, Command command) {
        ImportBatch batch = validate(ledger, command);

        if (!batch.errors().isEmpty()) {
            List<ImportRowError> errors = batch.errors().stream()
                    .sorted(Comparator.comparingInt(ImportRowError::rowNumber)
                            .thenComparing(ImportRowError::fieldName, String.CASE_INSENSITIVE_ORDER))
                    .toList();
            log.warn("Currency import rejected for ledger {}: {} rows, {} errors",
                    ledger.getId(), batch.totalRows(), errors.size());
            return Uni.createFrom().item((Result) new Result.Rejected(
                    ImportSummary.rejected(batch.totalRows(), batch.totalRows(), errors.size()), errors));
        }

        return transactionRepository.saveAll(batch.transactions())
                .map(saved -> {
                    log.info("Currency import committed for ledger {}: {} rows", ledger.getId(), saved.size());
                    return (Result) new Result.Committed(ImportSummary.committed(batch.totalRows()));
                });
    }

    private ImportBatch validate(CurrencyLedger ledger, Command command) {
        List<String> header = command.headerColumns() != null ? command.headerColumns() : List.of();
        List<List<String>> rows = command.dataRows() != null ? command.dataRows() : List.of();

        if (isBlank(header)) {
            return ImportBatch.rejected(0, fileError(HEADER_ROW, "", CSV_EMPTY,
                    "CSV content is empty",
                    "Upload a CSV file with a header line and at least one data row."));
        }

        ColumnMapping mapping = ColumnMapping.of(header);
        List<ImportRowError> headerErrors = new ArrayList<>();
        for (String field : List.of(FIELD_DATE, FIELD_TYPE, FIELD_FOREIGN_AMOUNT)) {
            if (mapping.indexOf(field) < 0) {
                headerErrors.add(new ImportRowError(HEADER_ROW, field, String.join(",", header), CSV_HEADER_MISSING,
                        "CSV header is missing the required column " + field,
                        "Add a \"" + field + "\" column to the header line."));
            }
        }

        List<NumberedRow> dataRows = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            List<String> columns = rows.get(i) != null ? rows.get(i) : List.of();
            if (!isBlank(columns) && !isComment(columns)) {
                dataRows.add(new NumberedRow(i + 2, columns));
            }
        }
        int totalRows = dataRows.size();

        if (!headerErrors.isEmpty()) {
            return new ImportBatch(totalRows, List.of(), headerErrors);
        }
        if (totalRows == 0) {
            return ImportBatch.rejected(0, fileError(HEADER_ROW, "", CSV_NO_DATA_ROWS,
                    "CSV has no data rows to import",
                    "Provide at least one transaction row."));
        }
        int maxRows = config.imports().maxRows();
        if (totalRows > maxRows) {
            return ImportBatch.rejected(totalRows, fileError(HEADER_ROW, String.valueOf(totalRows), CSV_ROW_LIMIT_EXCEEDED,
                    "CSV has more than " + maxRows + " data rows",
                    "Split the file and import at most " + maxRows + " rows at a time."));
        }

        List<CurrencyTransaction> transactions = new ArrayList<>();
        List<ImportRowError> errors = new ArrayList<>();
        for (NumberedRow row : dataRows) {
            RowValidator validator = new RowValidator(row, mapping);
            Optional<CurrencyTransaction> transaction = validator.validate(ledger);
            errors.addAll(validator.errors());
            transaction.ifPresent(transactions::add);
        }
        return new ImportBatch(totalRows, transactions, errors);
    }

    private static ImportRowError fileError(int rowNumber, String invalidValue, String code, String message, String guidance) {
        return new ImportRowError(rowNumber, FIELD_FILE, invalidValue, code, message, guidance);
    }

    private static boolean isBlank(List<String> columns) {
        return columns.stream().allMatch(column -> column == null || column.isBlank());
    }

    private static boolean isComment(List<String> columns) {
        return columns.get(0) != null && columns.get(0).stripLeading().startsWith("#");
    }

    private static String normalizeHeader(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\uFEFF", "")
                .replace("_", "")
                .replace("-", "")
                .replace(" ", "")
                .trim()
                .toLowerCase(Locale.ROOT);
    }

    /**
     * Validates one data row, collecting every problem rather than stopping at the first
     */
    private final class RowValidator {

        private final NumberedRow row;
        private final ColumnMapping mapping;
        private final List<ImportRowError> errors = new ArrayList<>();
        private final Set<String> seen = new LinkedHashSet<>();

        private RowValidator(NumberedRow row, ColumnMapping mapping) {
            this.row = row;
            this.mapping = mapping;
        }

        List<ImportRowError> errors() {
            return errors;
        }

        Optional<CurrencyTransaction> validate(CurrencyLedger ledger) {
            String rawDate = value(FIELD_DATE);
            String rawType = value(FIELD_TYPE);
            String rawForeignAmount = value(FIELD_FOREIGN_AMOUNT);
            String rawHomeAmount = value(FIELD_HOME_AMOUNT);
            String rawExchangeRate = value(FIELD_EXCHANGE_RATE);
            String rawNotes = value(FIELD_NOTES);

            LocalDate transactionDate = parseTransactionDate(rawDate);
            CurrencyTransactionType transactionType = parseTransactionType(rawType);
            BigDecimal foreignAmount = parseForeignAmount(rawForeignAmount);
            BigDecimal homeAmount = parseOptionalPositive(FIELD_HOME_AMOUNT, rawHomeAmount);
            BigDecimal exchangeRate = parseOptionalPositive(FIELD_EXCHANGE_RATE, rawExchangeRate);

            String notes = rawNotes.isBlank() ? null : rawNotes;
            int maxNotesLength = Math.min(config.imports().maxNotesLength(), CurrencyTransaction.MAX_NOTES_LENGTH);
            if (notes != null && notes.length() > maxNotesLength) {
                add(FIELD_NOTES, rawNotes, FIELD_LENGTH_EXCEEDED,
                        "Notes cannot exceed " + maxNotesLength + " characters",
                        "Shorten the notes to at most " + maxNotesLength + " characters.");
            }

            if (transactionType != null) {
                AmountPresence presence = new AmountPresence(!rawForeignAmount.isBlank(), !rawHomeAmount.isBlank());
                for (TransactionDiagnostic diagnostic : classificationPolicy.validate(ledger, transactionType, presence)) {
                    String field = mapPolicyField(diagnostic.fieldName());
                    String invalidValue = diagnostic.invalidValue() != null ? diagnostic.invalidValue() : switch (field) {
                        case FIELD_TYPE -> rawType;
                        case FIELD_FOREIGN_AMOUNT -> rawForeignAmount;
                        case FIELD_HOME_AMOUNT -> rawHomeAmount;
                        default -> "";
                    };
                    add(field, invalidValue, diagnostic.errorCode(), diagnostic.message(), diagnostic.correctionGuidance());
                }
                if (transactionType.isExchange() && rawExchangeRate.isBlank()) {
                    add(FIELD_EXCHANGE_RATE, rawExchangeRate, TransactionClassificationPolicy.REQUIRED_FIELD_MISSING,
                            transactionType.getDisplayName() + " requires an exchange rate",
                            "Enter an exchange rate greater than 0.");
                }
            }

            if (!errors.isEmpty() || transactionDate == null || transactionType == null || foreignAmount == null) {
                return Optional.empty();
            }

            if (ledger.isHomeCurrencyLedger()) {
                homeAmount = foreignAmount;
                exchangeRate = BigDecimal.ONE;
            }
            return Optional.of(CurrencyTransaction.builder()
                    .ledgerId(ledger.getId())
                    .transactionDate(transactionDate)
                    .transactionType(transactionType)
                    .foreignAmount(foreignAmount)
                    .homeAmount(homeAmount)
                    .exchangeRate(exchangeRate)
                    .notes(notes)
                    .createdAt(clock.instant())
                    .build());
        }

        private LocalDate parseTransactionDate(String raw) {
            if (raw.isBlank()) {
                add(FIELD_DATE, raw, TransactionClassificationPolicy.REQUIRED_FIELD_MISSING,
                        "Transaction date is required", "Enter the transaction date, for example 2026-02-13.");
                return null;
            }
            Optional<LocalDate> parsed = parseDate(raw);
            if (parsed.isEmpty()) {
                add(FIELD_DATE, raw, INVALID_DATE_FORMAT,
                        "Transaction date format is invalid", "Use a parseable date format, preferably yyyy-MM-dd.");
                return null;
            }
            if (parsed.get().isAfter(LocalDate.now(clock).plusDays(1))) {
                add(FIELD_DATE, raw, VALUE_OUT_OF_RANGE,
                        "Transaction date cannot be in the future", "Enter today's date or an earlier one.");
                return null;
            }
            return parsed.get();
        }

        private CurrencyTransactionType parseTransactionType(String raw) {
            if (raw.isBlank()) {
                add(FIELD_TYPE, raw, TransactionClassificationPolicy.REQUIRED_FIELD_MISSING,
                        "Transaction type is required", "Enter a valid transactionType.");
                return null;
            }
            Optional<CurrencyTransactionType> parsed = CurrencyTransactionType.parse(raw);
            if (parsed.isEmpty()) {
                add(FIELD_TYPE, raw, INVALID_ENUM_VALUE,
                        "Transaction type is invalid", "Use a transactionType name or its numeric code.");
                return null;
            }
            return parsed.get();
        }

        private BigDecimal parseForeignAmount(String raw) {
            if (raw.isBlank()) {
                add(FIELD_FOREIGN_AMOUNT, raw, TransactionClassificationPolicy.REQUIRED_FIELD_MISSING,
                        "Foreign amount is required", "Enter a foreignAmount greater than 0.");
                return null;
            }
            return parsePositive(FIELD_FOREIGN_AMOUNT, raw);
        }

        private BigDecimal parseOptionalPositive(String field, String raw) {
            return raw.isBlank() ? null : parsePositive(field, raw);
        }

        private BigDecimal parsePositive(String field, String raw) {
            Optional<BigDecimal> parsed = parseNumber(raw);
            if (parsed.isEmpty()) {
                add(field, raw, INVALID_NUMBER_FORMAT, field + " is not a valid number", "Enter a numeric value.");
                return null;
            }
            if (parsed.get().signum() <= 0) {
                add(field, raw, VALUE_OUT_OF_RANGE, field + " must be greater than 0", "Enter a " + field + " greater than 0.");
                return null;
            }
            return parsed.get();
        }

        private String value(String field) {
            int index = mapping.indexOf(field);
            if (index < 0 || index >= row.columns().size() || row.columns().get(index) == null) {
                return "";
            }
            return row.columns().get(index).trim();
        }

        private void add(String field, String invalidValue, String code, String message, String guidance) {
            String value = invalidValue != null ? invalidValue : "";
            if (seen.add(row.rowNumber() + "|" + field + "|" + code + "|" + value)) {
                errors.add(new ImportRowError(row.rowNumber(), field, value, code, message, guidance));
            }
        }
    }

    private static String mapPolicyField(String policyField) {
        return switch (policyField) {
            case TransactionClassificationPolicy.FIELD_AMOUNT -> FIELD_FOREIGN_AMOUNT;
            case TransactionClassificationPolicy.FIELD_TARGET_AMOUNT -> FIELD_HOME_AMOUNT;
            default -> policyField;
        };
    }

    static Optional<LocalDate> parseDate(String raw) {
        for (DateTimeFormatter formatter : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(raw, formatter));
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' does not match {}", raw, formatter);
            }
        }
        for (DateTimeFormatter formatter : DATE_TIME_FORMATS) {
            try {
                return Optional.of(LocalDateTime.parse(raw, formatter).toLocalDate());
            } catch (DateTimeParseException e) {
                log.trace("Date-time '{}' does not match {}", raw, formatter);
            }
        }
        return Optional.empty();
    }

    static Optional<BigDecimal> parseNumber(String raw) {
        try {
            return Optional.of(new BigDecimal(raw.replace(",", "")));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private record NumberedRow(int rowNumber, List<String> columns) {
    }

    private record ColumnMapping(Map<String, Integer> indexes) {

        static ColumnMapping of(List<String> header) {
            Map<String, Integer> indexes = new HashMap<>();
            HEADER_ALIASES.forEach((field, aliases) -> {
                Set<String> normalized = new LinkedHashSet<>();
                aliases.forEach(alias -> normalized.add(normalizeHeader(alias)));
                for (int i = 0; i < header.size(); i++) {
                    if (normalized.contains(normalizeHeader(header.get(i)))) {
                        indexes.put(field, i);
                        break;
                    }
                }
            });
            return new ColumnMapping(indexes);
        }

        int indexOf(String field) {
            return indexes.getOrDefault(field, -1);
        }
    }

    private record ImportBatch(int totalRows, List<CurrencyTransaction> transactions, List<ImportRowError> errors) {

        static ImportBatch rejected(int totalRows, ImportRowError error) {
            return new ImportBatch(totalRows, List.of(), List.of(error));
        }
    }
}
