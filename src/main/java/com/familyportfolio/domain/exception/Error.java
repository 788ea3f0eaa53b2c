package com.familyportfolio.domain.exception;

/**
 * Error identifier shared by every {@link ServiceException}. Codes are the two-digit group of
 * {@link Errors} followed by a two-digit item.
 */
public record Error(String code) {
}
