package com.snuffles.lotflow.web.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class RemainingLotDto {
    private String scripName;
    private String segment;
    private LocalDate tradeDate;
    private long buyQty;
    private BigDecimal buyPrice;
    private long remainingQty;
    private BigDecimal remainingCost;
    private String clientCode;
    private String orderNo;
    private int numTrades;
}
