package com.familyportfolio.domain.model;

public enum StockTransactionType {
    BUY,
    SELL,
    /** Share count multiplied by the ratio carried in the shares field; cost unchanged. */
    SPLIT,
    /** Manual correction adding the given shares and cost. */
    ADJUSTMENT
}
