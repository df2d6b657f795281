package com.snuffles.lotflow.domain;

/**
 * A trade together with where it came from.
 *
 * @param position  zero-based position in the normalized input sequence
 * @param rowNumber 1-based source row: the CSV data row, or the index in a request's
 *                  trade list
 */
public record SequencedTrade(int position, int rowNumber, TradeRecord trade) {

    public SequencedTrade(int position, TradeRecord trade) {
        this(position, position + 1, trade);
    }
}
