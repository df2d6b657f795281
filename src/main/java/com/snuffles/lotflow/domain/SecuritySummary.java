package com.snuffles.lotflow.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Remaining holdings of one scrip. Dates are null when nothing remains.
 */
public record SecuritySummary(
    String scripName,
    long totalRemainingShares,
    BigDecimal totalRemainingCost,
    LocalDate earliestPurchase,
    LocalDate latestPurchase,
    int purchasesCount,
    BigDecimal averageCostPerShare
) {
}
