package com.familyportfolio.domain.model;

import java.math.BigDecimal;

/**
 * Home-currency roll-up of cash that can be spent.
 *
 * @param totalBankAssets          ledger balances, bank balances and interest of matured deposits
 * @param fixedDepositsPrincipal   principal plus expected interest of matured deposits
 * @param unpaidInstallmentBalance outstanding installment payments
 * @param availableFunds           {@code totalBankAssets - unpaidInstallmentBalance}
 */
public record AvailableFundsSummary(BigDecimal totalBankAssets,
                                    BigDecimal fixedDepositsPrincipal,
                                    BigDecimal unpaidInstallmentBalance,
                                    BigDecimal availableFunds) {
}
