package com.snuffles.lotflow.csv;

import com.snuffles.lotflow.domain.Lot;
import com.snuffles.lotflow.domain.SecuritySummary;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface CsvRowMapper {

    String DATE_FORMAT = "dd/MM/yyyy";

    @Mapping(source = "tradeDate", target = "tradeDate", dateFormat = DATE_FORMAT)
    @Mapping(source = "originalQuantity", target = "buyQty")
    @Mapping(source = "price", target = "buyPrice")
    @Mapping(source = "remainingQuantity", target = "remainingQty")
    @Mapping(source = "tradeCount", target = "numTrades")
    RemainingLotCsvRow toCsvRow(Lot lot);

    @Mapping(source = "earliestPurchase", target = "earliestPurchase", dateFormat = DATE_FORMAT)
    @Mapping(source = "latestPurchase", target = "latestPurchase", dateFormat = DATE_FORMAT)
    @Mapping(source = "averageCostPerShare", target = "avgCostPerShare")
    SummaryCsvRow toCsvRow(SecuritySummary summary);
}
