package com.snuffles.lotflow.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A purchase batch tracked for FIFO consumption: a single buy, or the same-day buys of
 * one scrip collapsed together. Only the remaining quantity and cost change after
 * construction.
 */
@Getter
@Setter
@Builder
public class Lot implements LedgerEvent {

    public static final String AGGREGATED_ORDER_PREFIX = "Aggregated-";

    private final String scripName;
    private final String segment;
    private final LocalDate tradeDate;
    private final long originalQuantity;
    private final BigDecimal price;
    private final BigDecimal cost;
    private final String clientCode;
    private final String orderNo;
    private final int tradeCount;
    private final int position;
    private final int rowNumber;

    private long remainingQuantity;
    private BigDecimal remainingCost;

    @Override
    public boolean isPurchase() {
        return true;
    }

    public boolean isOpen() {
        return remainingQuantity > 0;
    }

    public boolean isAggregated() {
        return tradeCount > 1;
    }
}
