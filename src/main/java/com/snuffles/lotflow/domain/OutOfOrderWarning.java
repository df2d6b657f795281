package com.snuffles.lotflow.domain;

import java.time.LocalDate;

/**
 * A scrip whose trades go back in time: the trade on source row {@code rowNumber} is
 * dated {@code offendingDate}, earlier than the {@code previousDate} already seen.
 *
 * @param rowNumber 1-based CSV data row, or 1-based index in a request's trade list
 */
public record OutOfOrderWarning(String scripName, LocalDate previousDate, LocalDate offendingDate, int rowNumber) {

    public String message() {
        return String.format("Trades for %s are not in chronological order: %s on row %d follows %s",
            scripName, offendingDate, rowNumber, previousDate);
    }
}
