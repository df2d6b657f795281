package com.snuffles.lotflow.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class SellEvent implements LedgerEvent {

    String scripName;
    LocalDate tradeDate;
    long quantity;
    // kept for audit only, never used for remaining cost
    BigDecimal price;
    BigDecimal amount;
    String orderNo;
    int position;
    int rowNumber;

    @Override
    public boolean isPurchase() {
        return false;
    }
}
