package com.snuffles.lotflow.domain;

import java.time.LocalDate;

/**
 * Entry in a security's ledger: either a {@link Lot} or a {@link SellEvent}.
 */
public interface LedgerEvent {

    LocalDate getTradeDate();

    /** Zero-based position of the (earliest) source row in the input. */
    int getPosition();

    /** 1-based source row number of the (earliest) source row, for reporting. */
    int getRowNumber();

    boolean isPurchase();
}
