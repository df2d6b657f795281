package com.snuffles.lotflow.web.mapper;

import com.snuffles.lotflow.domain.FifoDiagnostics;
import com.snuffles.lotflow.domain.FifoReport;
import com.snuffles.lotflow.domain.Lot;
import com.snuffles.lotflow.domain.SecuritySummary;
import com.snuffles.lotflow.domain.TradeRecord;
import com.snuffles.lotflow.web.dto.DiagnosticsDto;
import com.snuffles.lotflow.web.dto.FifoReportDto;
import com.snuffles.lotflow.web.dto.RemainingLotDto;
import com.snuffles.lotflow.web.dto.SecuritySummaryDto;
import com.snuffles.lotflow.web.dto.TradeRecordDto;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

@Mapper(componentModel = "spring")
public interface FifoReportMapper {

    @Mapping(target = "skippedScrips", expression = "java(report.skippedScrips())")
    FifoReportDto toDto(FifoReport report);

    @Mapping(source = "originalQuantity", target = "buyQty")
    @Mapping(source = "price", target = "buyPrice")
    @Mapping(source = "remainingQuantity", target = "remainingQty")
    @Mapping(source = "tradeCount", target = "numTrades")
    RemainingLotDto toDto(Lot lot);

    @Mapping(source = "averageCostPerShare", target = "avgCostPerShare")
    SecuritySummaryDto toDto(SecuritySummary summary);

    DiagnosticsDto toDto(FifoDiagnostics diagnostics);

    TradeRecord toRecord(TradeRecordDto dto);

    List<TradeRecord> toRecords(List<TradeRecordDto> dtos);
}
