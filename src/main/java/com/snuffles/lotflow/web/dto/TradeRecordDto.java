package com.snuffles.lotflow.web.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class TradeRecordDto {

    private String clientCode;

    @NotNull
    private LocalDate tradeDate;

    private String segment;

    @NotBlank
    private String scripName;

    @PositiveOrZero
    private long buyQuantity;

    @PositiveOrZero
    private BigDecimal buyPrice;

    @PositiveOrZero
    private BigDecimal buyAmount;

    @PositiveOrZero
    private long sellQuantity;

    @PositiveOrZero
    private BigDecimal sellPrice;

    @PositiveOrZero
    private BigDecimal sellAmount;

    private String orderNo;

    @JsonIgnore
    @AssertTrue(message = "buyQuantity and sellQuantity cannot both be positive")
    public boolean isSingleSided() {
        return buyQuantity == 0 || sellQuantity == 0;
    }

    @JsonIgnore
    @AssertTrue(message = "a buy needs a buyPrice")
    public boolean isPricedWhenBuying() {
        return buyQuantity == 0 || buyPrice != null;
    }
}
