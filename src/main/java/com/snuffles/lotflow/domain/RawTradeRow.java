package com.snuffles.lotflow.domain;

/**
 * One data row of a trade export exactly as read, before any coercion.
 *
 * @param rowNumber 1-based data row number, counting neither the header nor blank rows
 */
public record RawTradeRow(
    int rowNumber,
    String clientCode,
    String tradeDate,
    String segment,
    String scripName,
    String buyQty,
    String buyPrice,
    String buyAmount,
    String sellQty,
    String sellPrice,
    String sellAmount,
    String orderNo
) {
}
