package com.familyportfolio.infrastructure.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration properties for the calculation core and its entry points
 */
@ConfigMapping(prefix = "app.calculation")
public interface CalculationConfig {

    /**
     * Currency every aggregate is reported in
     */
    @WithDefault("TWD")
    String homeCurrency();

    @WithName("import")
    Import imports();

    StockLinking stockLinking();

    interface Import {

        /**
         * Maximum number of data rows accepted in one CSV import
         */
        @WithDefault("5000")
        int maxRows();

        @WithDefault("500")
        int maxNotesLength();
    }

    interface StockLinking {

        /**
         * Settle stock trades on the portfolio's bound ledger
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Reject buys the bound ledger cannot pay for
         */
        @WithDefault("false")
        boolean strictBalance();
    }
}
