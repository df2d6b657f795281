package com.snuffles.lotflow.csv;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;

@JsonPropertyOrder({
    "ScripName", "Segment", "TradeDate", "BuyQty", "BuyPrice",
    "RemainingQty", "RemainingCost", "ClientCode", "OrderNo", "NumTrades"
})
public record RemainingLotCsvRow(
    @JsonProperty("ScripName") String scripName,
    @JsonProperty("Segment") String segment,
    @JsonProperty("TradeDate") String tradeDate,
    @JsonProperty("BuyQty") long buyQty,
    @JsonProperty("BuyPrice") BigDecimal buyPrice,
    @JsonProperty("RemainingQty") long remainingQty,
    @JsonProperty("RemainingCost") BigDecimal remainingCost,
    @JsonProperty("ClientCode") String clientCode,
    @JsonProperty("OrderNo") String orderNo,
    @JsonProperty("NumTrades") int numTrades
) {
}
