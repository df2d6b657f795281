package com.snuffles.lotflow.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FifoRequestDto {

    /** Trades in chronological input order. */
    @NotNull
    private List<@Valid TradeRecordDto> trades;
}
