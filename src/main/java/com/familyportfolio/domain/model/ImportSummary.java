package com.familyportfolio.domain.model;

public record ImportSummary(String status,
                            int totalRows,
                            int insertedRows,
                            int rejectedRows,
                            int errorCount) {

    public static final String STATUS_COMMITTED = "committed";
    public static final String STATUS_REJECTED = "rejected";

    public static ImportSummary committed(int rows) {
        return new ImportSummary(STATUS_COMMITTED, rows, rows, 0, 0);
    }

    public static ImportSummary rejected(int totalRows, int rejectedRows, int errorCount) {
        return new ImportSummary(STATUS_REJECTED, totalRows, 0, rejectedRows, errorCount);
    }
}
