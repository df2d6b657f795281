package com.snuffles.lotflow.cli;

import com.snuffles.lotflow.domain.SecuritySummary;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders summary rows as a fixed-width text table for the console log.
 */
@Component
public class SummaryTableFormatter {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("dd/MM/yyyy");
    private static final String[] HEADERS = {
        "ScripName", "Total_Remaining_Shares", "Total_Remaining_Cost", "Earliest_Purchase",
        "Latest_Purchase", "Purchases_Count", "Avg_Cost_Per_Share"
    };

    public String format(List<SecuritySummary> summary) {
        List<String[]> rows = new ArrayList<>();
        rows.add(HEADERS);
        for (SecuritySummary row : summary) {
            rows.add(new String[]{
                row.scripName(),
                Long.toString(row.totalRemainingShares()),
                plain(row.totalRemainingCost()),
                date(row.earliestPurchase()),
                date(row.latestPurchase()),
                Integer.toString(row.purchasesCount()),
                plain(row.averageCostPerShare())
            });
        }

        int[] widths = new int[HEADERS.length];
        for (String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
        }

        StringBuilder table = new StringBuilder();
        for (String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                if (i > 0) {
                    table.append("  ");
                }
                // scrip names left-aligned, numbers and dates right-aligned
                String format = i == 0 ? "%-" + widths[i] + "s" : "%" + widths[i] + "s";
                table.append(String.format(format, row[i]));
            }
            table.append(System.lineSeparator());
        }
        return table.toString();
    }

    private String plain(BigDecimal value) {
        return value == null ? "" : value.toPlainString();
    }

    private String date(LocalDate value) {
        return value == null ? "" : DATE_FORMATTER.format(value);
    }
}
