package com.snuffles.lotflow.domain;

/**
 * An input row dropped during normalization.
 *
 * @param rowNumber 1-based data row number, counting neither the header nor blank rows
 * @param reason    why the row could not be used
 */
public record MalformedRecord(int rowNumber, String reason) {
}
