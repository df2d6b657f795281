package com.snuffles.lotflow.csv;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.snuffles.lotflow.config.LotflowProperties;
import com.snuffles.lotflow.domain.FifoReport;
import com.snuffles.lotflow.domain.Lot;
import com.snuffles.lotflow.domain.SecuritySummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the remaining-lots and summary files of a report.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReportCsvWriter {

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
        .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN)
        .build();
    private static final CsvSchema LOT_SCHEMA = CSV_MAPPER.schemaFor(RemainingLotCsvRow.class).withHeader();
    private static final CsvSchema SUMMARY_SCHEMA = CSV_MAPPER.schemaFor(SummaryCsvRow.class).withHeader();

    private final CsvRowMapper rowMapper;
    private final LotflowProperties properties;

    public WrittenFiles write(FifoReport report, Path outputDirectory) throws IOException {
        Files.createDirectories(outputDirectory);
        Path lotsFile = outputDirectory.resolve(properties.getOutput().getRemainingLotsFile());
        Path summaryFile = outputDirectory.resolve(properties.getOutput().getSummaryFile());

        writeRemainingLots(report.remainingLots(), lotsFile);
        writeSummary(report.summary(), summaryFile);
        return new WrittenFiles(lotsFile, summaryFile);
    }

    public void writeRemainingLots(List<Lot> lots, Path file) throws IOException {
        List<RemainingLotCsvRow> rows = lots.stream().map(rowMapper::toCsvRow).toList();
        writeRows(rows, LOT_SCHEMA, file);
        log.info("Remaining purchases ({}) saved to {}", rows.size(), file);
    }

    public void writeSummary(List<SecuritySummary> summary, Path file) throws IOException {
        List<SummaryCsvRow> rows = summary.stream().map(rowMapper::toCsvRow).toList();
        writeRows(rows, SUMMARY_SCHEMA, file);
        log.info("Summary information ({} scrips) saved to {}", rows.size(), file);
    }

    private void writeRows(List<?> rows, CsvSchema schema, Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            if (rows.isEmpty()) {
                // the generator only emits the header together with the first row
                List<String> header = new ArrayList<>();
                schema.forEach(column -> header.add(column.getName()));
                writer.write(String.join(String.valueOf(schema.getColumnSeparator()), header));
                writer.write(schema.getLineSeparator());
                return;
            }
            CSV_MAPPER.writer(schema).writeValue(writer, rows);
        }
    }

    public record WrittenFiles(Path remainingLotsFile, Path summaryFile) {
    }
}
