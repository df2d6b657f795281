package com.snuffles.lotflow.cli;

import com.snuffles.lotflow.csv.ReportCsvWriter;
import com.snuffles.lotflow.csv.TradeCsvReader;
import com.snuffles.lotflow.domain.FifoDiagnostics;
import com.snuffles.lotflow.domain.FifoReport;
import com.snuffles.lotflow.domain.MalformedRecord;
import com.snuffles.lotflow.domain.OutOfOrderWarning;
import com.snuffles.lotflow.domain.OverSellWarning;
import com.snuffles.lotflow.domain.RawTradeRow;
import com.snuffles.lotflow.service.FifoMatchingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Batch entry point: {@code --input=trades.csv [--output-dir=dir]}. Does nothing when no
 * input is given, so the same application can run as a web service.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FifoCommandLineRunner implements ApplicationRunner {

    static final String INPUT_OPTION = "input";
    static final String OUTPUT_DIR_OPTION = "output-dir";

    private final TradeCsvReader reader;
    private final FifoMatchingService matchingService;
    private final ReportCsvWriter writer;
    private final SummaryTableFormatter tableFormatter;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<String> inputs = args.getOptionValues(INPUT_OPTION);
        if (inputs == null || inputs.isEmpty()) {
            log.debug("No --{} given; skipping file run", INPUT_OPTION);
            return;
        }

        Path input = Path.of(inputs.get(0));
        List<String> outputs = args.getOptionValues(OUTPUT_DIR_OPTION);
        Path outputDirectory = outputs == null || outputs.isEmpty()
            ? defaultOutputDirectory(input)
            : Path.of(outputs.get(0));

        List<RawTradeRow> rows = reader.read(input);
        FifoReport report = matchingService.processRows(rows);
        logDiagnostics(report);

        ReportCsvWriter.WrittenFiles files = writer.write(report, outputDirectory);
        if (report.remainingLots().isEmpty()) {
            log.info("No remaining purchases found.");
        } else {
            log.info("Summary of remaining purchases by scrip:{}{}", System.lineSeparator(), tableFormatter.format(report.summary()));
        }
        log.info("Wrote {} and {}", files.remainingLotsFile(), files.summaryFile());
    }

    private Path defaultOutputDirectory(Path input) {
        Path parent = input.toAbsolutePath().getParent();
        return parent != null ? parent : Path.of(".");
    }

    private void logDiagnostics(FifoReport report) {
        FifoDiagnostics diagnostics = report.diagnostics();
        List<String> skipped = report.skippedScrips();
        for (MalformedRecord record : diagnostics.getMalformedRecords()) {
            log.warn("Dropped row {}: {}", record.rowNumber(), record.reason());
        }
        for (OutOfOrderWarning warning : diagnostics.getOutOfOrderWarnings()) {
            log.warn("{}; {}", warning.message(),
                skipped.contains(warning.scripName()) ? "excluded from results" : "matched in file order");
        }
        for (OverSellWarning warning : diagnostics.getOverSellWarnings()) {
            log.warn("{}", warning.message());
        }
        if (diagnostics.getNoopCount() > 0) {
            log.info("Ignored {} rows without buy or sell quantity", diagnostics.getNoopCount());
        }
    }
}
