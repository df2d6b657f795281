package com.snuffles.lotflow.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Result of running one scrip through the matcher: either processed with its lots, or
 * skipped with the ordering violation that excluded it. A processed outcome may still
 * carry an ordering violation when the lenient policy is active.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SecurityOutcome {

    private final String scripName;
    private final Status status;
    private final List<Lot> lots;
    private final long soldQuantity;
    private final long matchedQuantity;
    private final List<OverSellWarning> overSells;
    private final OutOfOrderWarning outOfOrderWarning;

    public static SecurityOutcome processed(String scripName, List<Lot> lots, long soldQuantity,
                                            long matchedQuantity, List<OverSellWarning> overSells) {
        return new SecurityOutcome(scripName, Status.PROCESSED, List.copyOf(lots), soldQuantity,
            matchedQuantity, List.copyOf(overSells), null);
    }

    public static SecurityOutcome skipped(String scripName, OutOfOrderWarning reason) {
        return new SecurityOutcome(scripName, Status.SKIPPED, List.of(), 0, 0, List.of(), reason);
    }

    /**
     * Marks a processed outcome as matched despite an ordering violation.
     */
    public SecurityOutcome flaggedOutOfOrder(OutOfOrderWarning warning) {
        return new SecurityOutcome(scripName, status, lots, soldQuantity, matchedQuantity, overSells, warning);
    }

    public boolean isProcessed() {
        return status == Status.PROCESSED;
    }

    public List<Lot> remainingLots() {
        return lots.stream().filter(Lot::isOpen).toList();
    }

    public long shortfallQuantity() {
        return overSells.stream().mapToLong(OverSellWarning::shortfall).sum();
    }

    public enum Status {
        PROCESSED, SKIPPED
    }
}
