package com.familyportfolio.domain.model;

/**
 * One problem found in an import. Row 1 is the header and carries the file-level problems;
 * data rows start at 2.
 */
public record ImportRowError(int rowNumber,
                             String fieldName,
                             String invalidValue,
                             String errorCode,
                             String message,
                             String correctionGuidance) {
}
