package com.snuffles.lotflow.web.dto;

import com.snuffles.lotflow.domain.MalformedRecord;
import com.snuffles.lotflow.domain.OutOfOrderWarning;
import com.snuffles.lotflow.domain.OverSellWarning;
import lombok.Data;

import java.util.List;

@Data
public class DiagnosticsDto {
    private int malformedCount;
    private List<MalformedRecord> malformedRecords;
    private int noopCount;
    private List<OutOfOrderWarning> outOfOrderWarnings;
    private List<OverSellWarning> overSellWarnings;
}
