package com.snuffles.lotflow.web.dto;

import lombok.Data;

import java.util.List;

@Data
public class FifoReportDto {
    private List<RemainingLotDto> remainingLots;
    private List<SecuritySummaryDto> summary;
    private DiagnosticsDto diagnostics;
    /** Scrips left out because their trades were not in date order. */
    private List<String> skippedScrips;
}
