package com.snuffles.lotflow.domain;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lots and sells of one scrip in processing order. Built per run and discarded after
 * matching.
 */
@Getter
public class SecurityLedger {

    private final String scripName;
    private final List<LedgerEvent> events;

    public SecurityLedger(String scripName, List<? extends LedgerEvent> events) {
        this.scripName = scripName;
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
    }
}
