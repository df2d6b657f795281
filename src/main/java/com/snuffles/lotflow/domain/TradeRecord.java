package com.snuffles.lotflow.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One normalized row of a broker trade export. Exactly one side carries a quantity,
 * or neither does for an inert row.
 */
public record TradeRecord(
    String clientCode,
    LocalDate tradeDate,
    String segment,
    String scripName,
    long buyQuantity,
    BigDecimal buyPrice,
    BigDecimal buyAmount,
    long sellQuantity,
    BigDecimal sellPrice,
    BigDecimal sellAmount,
    String orderNo
) {

    public TradeType type() {
        if (buyQuantity > 0) {
            return TradeType.Buy;
        }
        if (sellQuantity > 0) {
            return TradeType.Sell;
        }
        return TradeType.Noop;
    }

    public enum TradeType {
        Buy, Sell, Noop
    }
}
