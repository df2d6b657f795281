package com.snuffles.lotflow.domain;

import java.time.LocalDate;

/**
 * A sell that asked for more shares than the open lots held at that point.
 */
public record OverSellWarning(String scripName, LocalDate tradeDate, long requested, long shortfall) {

    public String message() {
        return String.format("Could not match %d of %d shares sold for %s on %s",
            shortfall, requested, scripName, tradeDate);
    }
}
