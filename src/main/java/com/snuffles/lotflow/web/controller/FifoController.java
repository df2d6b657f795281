package com.snuffles.lotflow.web.controller;

import com.snuffles.lotflow.csv.TradeCsvReader;
import com.snuffles.lotflow.domain.FifoReport;
import com.snuffles.lotflow.service.FifoMatchingService;
import com.snuffles.lotflow.web.dto.FifoReportDto;
import com.snuffles.lotflow.web.dto.FifoRequestDto;
import com.snuffles.lotflow.web.mapper.FifoReportMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/fifo")
@RequiredArgsConstructor
@Tag(name = "FIFO", description = "Match sells against the oldest purchase lots")
public class FifoController {

    static final String TEXT_CSV_VALUE = "text/csv";

    private final FifoMatchingService matchingService;
    private final TradeCsvReader csvReader;
    private final FifoReportMapper reportMapper;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Match trades", description = "Runs FIFO matching over trades given in input order.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Remaining lots and summary", content = @Content(schema = @Schema(implementation = FifoReportDto.class))),
        @ApiResponse(responseCode = "400", description = "Validation error", content = @Content)
    })
    public ResponseEntity<FifoReportDto> match(@Valid @RequestBody FifoRequestDto request) {
        FifoReport report = matchingService.process(reportMapper.toRecords(request.getTrades()));
        return ResponseEntity.ok(toDto(report));
    }

    @PostMapping(path = "/csv", consumes = {TEXT_CSV_VALUE, MediaType.TEXT_PLAIN_VALUE})
    @Operation(summary = "Match a trade export", description = "Runs FIFO matching over a CSV trade export with a header row.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Remaining lots and summary", content = @Content(schema = @Schema(implementation = FifoReportDto.class))),
        @ApiResponse(responseCode = "400", description = "Required columns missing", content = @Content)
    })
    public ResponseEntity<FifoReportDto> matchCsv(@RequestBody String csv) {
        FifoReport report = matchingService.processRows(csvReader.read(csv));
        return ResponseEntity.ok(toDto(report));
    }

    private FifoReportDto toDto(FifoReport report) {
        if (!report.diagnostics().isClean()) {
            log.warn("FIFO run finished with {} dropped rows, {} out-of-order scrips, {} over-sells",
                report.diagnostics().getMalformedCount(),
                report.diagnostics().getOutOfOrderWarnings().size(),
                report.diagnostics().getOverSellWarnings().size());
        }
        return reportMapper.toDto(report);
    }
}
