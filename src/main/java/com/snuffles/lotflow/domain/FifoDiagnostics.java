package com.snuffles.lotflow.domain;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Non-fatal findings of a run, handed back to the caller alongside the results.
 */
@Getter
public class FifoDiagnostics {

    private final List<MalformedRecord> malformedRecords = new ArrayList<>();
    private final List<OutOfOrderWarning> outOfOrderWarnings = new ArrayList<>();
    private final List<OverSellWarning> overSellWarnings = new ArrayList<>();
    private int noopCount;

    public void recordMalformed(MalformedRecord record) {
        malformedRecords.add(record);
    }

    public void recordNoop() {
        noopCount++;
    }

    public void recordOutOfOrder(OutOfOrderWarning warning) {
        outOfOrderWarnings.add(warning);
    }

    public void recordOverSells(List<OverSellWarning> warnings) {
        overSellWarnings.addAll(warnings);
    }

    public int getMalformedCount() {
        return malformedRecords.size();
    }

    public List<MalformedRecord> getMalformedRecords() {
        return Collections.unmodifiableList(malformedRecords);
    }

    public List<OutOfOrderWarning> getOutOfOrderWarnings() {
        return Collections.unmodifiableList(outOfOrderWarnings);
    }

    public List<OverSellWarning> getOverSellWarnings() {
        return Collections.unmodifiableList(overSellWarnings);
    }

    public boolean isClean() {
        return malformedRecords.isEmpty() && outOfOrderWarnings.isEmpty() && overSellWarnings.isEmpty();
    }
}
