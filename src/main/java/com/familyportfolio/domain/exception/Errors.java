package com.familyportfolio.domain.exception;

public interface Errors {

    interface Position {
        String errorCode = "01";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error NOT_A_SELL_TRANSACTION = new Error(errorCode + "02");
    }

    interface StockSplit {
        String errorCode = "02";

        Error INVALID_INPUT = new Error(errorCode + "01");
    }

    interface StockTransaction {
        String errorCode = "03";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error CURRENCY_MISMATCH = new Error(errorCode + "02");
        Error INSUFFICIENT_BALANCE = new Error(errorCode + "03");
        Error PORTFOLIO_NOT_FOUND = new Error(errorCode + "04");
        Error PERSISTENCE_ERROR = new Error(errorCode + "05");
    }

    interface CurrencyTransaction {
        String errorCode = "04";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error TYPE_NOT_ALLOWED_FOR_LEDGER = new Error(errorCode + "02");
        Error REQUIRED_FIELD_MISSING = new Error(errorCode + "03");
        Error LEDGER_NOT_FOUND = new Error(errorCode + "04");
        Error PERSISTENCE_ERROR = new Error(errorCode + "05");
    }

    interface CurrencyLedger {
        String errorCode = "05";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error NOT_FOUND = new Error(errorCode + "02");
        Error PERSISTENCE_ERROR = new Error(errorCode + "03");
    }

    interface BankAccount {
        String errorCode = "06";

        Error INVALID_INPUT = new Error(errorCode + "01");
    }

    interface Installment {
        String errorCode = "07";

        Error INVALID_INPUT = new Error(errorCode + "01");
    }

    interface ImportCurrencyTransactions {
        String errorCode = "08";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error LEDGER_NOT_FOUND = new Error(errorCode + "02");
        Error PERSISTENCE_ERROR = new Error(errorCode + "03");
    }

    interface PortfolioPerformance {
        String errorCode = "09";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error PORTFOLIO_NOT_FOUND = new Error(errorCode + "02");
        Error PERSISTENCE_ERROR = new Error(errorCode + "03");
    }

    interface AssetsSummary {
        String errorCode = "10";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error PERSISTENCE_ERROR = new Error(errorCode + "02");
        Error EXCHANGE_RATE_UNAVAILABLE = new Error(errorCode + "03");
    }

    interface ExchangeRate {
        String errorCode = "11";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error RATE_NOT_FOUND = new Error(errorCode + "02");
        Error API_ERROR = new Error(errorCode + "03");
    }

}
