package com.snuffles.lotflow.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.snuffles.lotflow.domain.RawTradeRow;
import com.snuffles.lotflow.service.exception.InputFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a broker trade export (header row plus data rows) into {@link RawTradeRow}s.
 * Columns are found by header name, so their order does not matter and extra columns are
 * ignored.
 */
@Slf4j
@Component
public class TradeCsvReader {

    static final String CLIENT_CODE = "ClientCode";
    static final String TRADE_DATE = "TradeDate";
    static final String SEGMENT = "Segment";
    static final String SCRIP_NAME = "ScripName";
    static final String BUY_QTY = "BuyQty";
    static final String BUY_PRICE = "BuyPrice";
    static final String BUY_AMOUNT = "BuyAmount";
    static final String SELL_QTY = "SellQty";
    static final String SELL_PRICE = "SellPrice";
    static final String SELL_AMOUNT = "SellAmount";
    static final String ORDER_NO = "OrderNo";

    static final List<String> REQUIRED_COLUMNS = List.of(TRADE_DATE, SCRIP_NAME, BUY_QTY, SELL_QTY);

    private static final Map<String, String> COLUMN_ALIASES = Map.of("Client Code", CLIENT_CODE);

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final ObjectReader ROW_READER = CSV_MAPPER
        .readerForListOf(String.class)
        .with(CsvSchema.emptySchema())
        .with(CsvParser.Feature.WRAP_AS_ARRAY)
        .with(CsvParser.Feature.SKIP_EMPTY_LINES);

    public List<RawTradeRow> read(Path path) {
        log.info("Reading trade data from {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException ex) {
            throw new InputFormatException("Cannot read trade file " + path, ex);
        }
    }

    public List<RawTradeRow> read(String content) {
        return read(new StringReader(content));
    }

    public List<RawTradeRow> read(Reader reader) {
        List<RawTradeRow> rows = new ArrayList<>();
        try (MappingIterator<List<String>> iterator = ROW_READER.readValues(reader)) {
            if (!iterator.hasNextValue()) {
                throw new InputFormatException("Trade file is empty; expected a header row");
            }
            Map<String, Integer> columns = indexHeader(iterator.nextValue());

            int rowNumber = 0;
            while (iterator.hasNextValue()) {
                List<String> values = iterator.nextValue();
                if (isBlank(values)) {
                    continue;
                }
                rowNumber++;
                rows.add(toRow(rowNumber, values, columns));
            }
        } catch (IOException ex) {
            throw new InputFormatException("Malformed CSV: " + ex.getMessage(), ex);
        }
        log.debug("Read {} data rows", rows.size());
        return rows;
    }

    private Map<String, Integer> indexHeader(List<String> header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i) == null ? "" : header.get(i).replace("\uFEFF", "").trim();
            columns.putIfAbsent(COLUMN_ALIASES.getOrDefault(name, name), i);
        }

        List<String> missing = REQUIRED_COLUMNS.stream()
            .filter(column -> !columns.containsKey(column))
            .toList();
        if (!missing.isEmpty()) {
            throw new InputFormatException("Missing required columns: " + String.join(", ", missing));
        }
        return columns;
    }

    private RawTradeRow toRow(int rowNumber, List<String> values, Map<String, Integer> columns) {
        return new RawTradeRow(
            rowNumber,
            value(values, columns, CLIENT_CODE),
            value(values, columns, TRADE_DATE),
            value(values, columns, SEGMENT),
            value(values, columns, SCRIP_NAME),
            value(values, columns, BUY_QTY),
            value(values, columns, BUY_PRICE),
            value(values, columns, BUY_AMOUNT),
            value(values, columns, SELL_QTY),
            value(values, columns, SELL_PRICE),
            value(values, columns, SELL_AMOUNT),
            value(values, columns, ORDER_NO)
        );
    }

    private String value(List<String> values, Map<String, Integer> columns, String column) {
        Integer index = columns.get(column);
        if (index == null || index >= values.size()) {
            return null;
        }
        return values.get(index);
    }

    private boolean isBlank(List<String> values) {
        return values.stream().allMatch(value -> value == null || value.isBlank());
    }
}
