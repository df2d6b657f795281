package com.snuffles.lotflow.csv;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;

@JsonPropertyOrder({
    "ScripName", "Total_Remaining_Shares", "Total_Remaining_Cost", "Earliest_Purchase",
    "Latest_Purchase", "Purchases_Count", "Avg_Cost_Per_Share"
})
public record SummaryCsvRow(
    @JsonProperty("ScripName") String scripName,
    @JsonProperty("Total_Remaining_Shares") long totalRemainingShares,
    @JsonProperty("Total_Remaining_Cost") BigDecimal totalRemainingCost,
    @JsonProperty("Earliest_Purchase") String earliestPurchase,
    @JsonProperty("Latest_Purchase") String latestPurchase,
    @JsonProperty("Purchases_Count") int purchasesCount,
    @JsonProperty("Avg_Cost_Per_Share") BigDecimal avgCostPerShare
) {
}
