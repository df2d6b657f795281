package com.snuffles.lotflow.web.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class SecuritySummaryDto {
    private String scripName;
    private long totalRemainingShares;
    private BigDecimal totalRemainingCost;
    private LocalDate earliestPurchase;
    private LocalDate latestPurchase;
    private int purchasesCount;
    private BigDecimal avgCostPerShare;
}
