package com.snuffles.lotflow.service;

import com.snuffles.lotflow.config.LotflowProperties;
import com.snuffles.lotflow.domain.FifoDiagnostics;
import com.snuffles.lotflow.domain.MalformedRecord;
import com.snuffles.lotflow.domain.RawTradeRow;
import com.snuffles.lotflow.domain.TradeRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns raw export rows into typed {@link TradeRecord}s. Rows that cannot be coerced are
 * dropped and recorded in the diagnostics; processing always continues.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeRecordNormalizer {

    public static final DateTimeFormatter TRADE_DATE_FORMATTER =
        DateTimeFormatter.ofPattern("d/M/uuuu", Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);

    private static final Pattern NUMERIC_NOISE = Pattern.compile("[,\\s₹$€£]");

    private final LotflowProperties properties;

    public List<TradeRecord> normalize(List<RawTradeRow> rows, FifoDiagnostics diagnostics) {
        List<TradeRecord> records = new ArrayList<>(rows.size());
        for (RawTradeRow row : rows) {
            normalize(row, diagnostics).ifPresent(records::add);
        }
        log.debug("Normalized {} of {} rows ({} dropped)", records.size(), rows.size(), rows.size() - records.size());
        return records;
    }

    public Optional<TradeRecord> normalize(RawTradeRow row, FifoDiagnostics diagnostics) {
        RowParser parser = new RowParser(row);
        TradeRecord record = parser.parse();
        if (record == null) {
            log.debug("Dropping row {}: {}", row.rowNumber(), parser.reason);
            diagnostics.recordMalformed(new MalformedRecord(row.rowNumber(), parser.reason));
            return Optional.empty();
        }
        return Optional.of(record);
    }

    static String clean(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = NUMERIC_NOISE.matcher(value).replaceAll("");
        return cleaned.isEmpty() ? null : cleaned;
    }

    static BigDecimal toDecimal(String cleaned) {
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static String text(String value) {
        return value == null ? "" : value.trim();
    }

    /**
     * Single-use parser for one row; the first problem found is kept in {@link #reason}.
     */
    private final class RowParser {

        private final RawTradeRow row;
        private String reason;

        private RowParser(RawTradeRow row) {
            this.row = row;
        }

        private TradeRecord parse() {
            LocalDate tradeDate = date(row.tradeDate());
            String scripName = text(row.scripName());
            if (scripName.isEmpty()) {
                reject("missing ScripName");
            }
            long buyQuantity = quantity("BuyQty", row.buyQty());
            long sellQuantity = quantity("SellQty", row.sellQty());
            BigDecimal buyPrice = decimal("BuyPrice", row.buyPrice());
            BigDecimal buyAmount = decimal("BuyAmount", row.buyAmount());
            BigDecimal sellPrice = decimal("SellPrice", row.sellPrice());
            BigDecimal sellAmount = decimal("SellAmount", row.sellAmount());
            if (reason != null) {
                return null;
            }

            if (buyQuantity > 0 && sellQuantity > 0) {
                reason = "both BuyQty and SellQty are positive";
                return null;
            }
            if (buyQuantity > 0 && buyPrice == null) {
                if (buyAmount == null) {
                    reason = "buy without BuyPrice or BuyAmount";
                    return null;
                }
                buyPrice = buyAmount.divide(BigDecimal.valueOf(buyQuantity),
                    properties.getPriceScale(), properties.getRoundingMode());
            }

            return new TradeRecord(
                text(row.clientCode()),
                tradeDate,
                text(row.segment()),
                scripName,
                buyQuantity,
                buyPrice,
                buyAmount,
                sellQuantity,
                sellPrice,
                sellAmount,
                text(row.orderNo())
            );
        }

        private LocalDate date(String value) {
            String trimmed = text(value);
            if (trimmed.isEmpty()) {
                reject("missing TradeDate");
                return null;
            }
            try {
                return LocalDate.parse(trimmed, TRADE_DATE_FORMATTER);
            } catch (DateTimeParseException ex) {
                reject("unparseable TradeDate '" + trimmed + "'");
                return null;
            }
        }

        private long quantity(String column, String value) {
            BigDecimal parsed = decimal(column, value);
            if (parsed == null) {
                return 0;
            }
            BigDecimal whole = parsed.stripTrailingZeros();
            if (whole.scale() > 0) {
                reject("fractional " + column + " '" + text(value) + "'");
                return 0;
            }
            try {
                return whole.longValueExact();
            } catch (ArithmeticException ex) {
                reject(column + " out of range '" + text(value) + "'");
                return 0;
            }
        }

        private BigDecimal decimal(String column, String value) {
            String cleaned = clean(value);
            if (cleaned == null) {
                return null;
            }
            BigDecimal parsed = toDecimal(cleaned);
            if (parsed == null) {
                reject("non-numeric " + column + " '" + text(value) + "'");
                return null;
            }
            if (parsed.signum() < 0) {
                reject("negative " + column + " '" + text(value) + "'");
                return null;
            }
            return parsed;
        }

        private void reject(String problem) {
            if (reason == null) {
                reason = problem;
            }
        }
    }
}
