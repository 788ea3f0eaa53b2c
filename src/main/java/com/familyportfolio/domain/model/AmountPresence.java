package com.familyportfolio.domain.model;

/**
 * Which amount fields a caller supplied. {@code targetAmount} is the home-currency side of an
 * exchange.
 */
public record AmountPresence(boolean hasAmount, boolean hasTargetAmount) {
}
