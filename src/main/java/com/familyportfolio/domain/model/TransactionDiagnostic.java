package com.familyportfolio.domain.model;

/**
 * A single validation finding for a currency transaction, shaped so it can be shown next to the
 * offending field.
 */
public record TransactionDiagnostic(String errorCode,
                                    String fieldName,
                                    String message,
                                    String correctionGuidance,
                                    String invalidValue) {
}
