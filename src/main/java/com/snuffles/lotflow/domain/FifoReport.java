package com.snuffles.lotflow.domain;

import java.util.List;

/**
 * Everything a matching run produces.
 *
 * @param remainingLots lots with shares left, in input order
 * @param summary       one row per processed scrip, sorted by scrip name
 * @param outcomes      per-scrip results in first-appearance order
 * @param diagnostics   dropped rows and warnings
 */
public record FifoReport(
    List<Lot> remainingLots,
    List<SecuritySummary> summary,
    List<SecurityOutcome> outcomes,
    FifoDiagnostics diagnostics
) {

    public List<String> skippedScrips() {
        return outcomes.stream()
            .filter(outcome -> !outcome.isProcessed())
            .map(SecurityOutcome::getScripName)
            .toList();
    }
}
