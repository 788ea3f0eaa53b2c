package com.familyportfolio.domain.model;

public enum StockMarket {
    TW,
    US,
    UK,
    EU;

    public boolean isTaiwan() {
        return this == TW;
    }
}
