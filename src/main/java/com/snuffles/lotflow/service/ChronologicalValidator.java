package com.snuffles.lotflow.service;

import com.snuffles.lotflow.domain.LedgerEvent;
import com.snuffles.lotflow.domain.OutOfOrderWarning;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Checks that a scrip's lots and sells, in input order, never go back in time, and puts a
 * valid stream into matching order.
 */
@Slf4j
@Service
public class ChronologicalValidator {

    /** Input order, with aggregated lots standing at their earliest row. */
    public static final Comparator<LedgerEvent> INPUT_ORDER = Comparator.comparingInt(LedgerEvent::getPosition);

    /** Date first; on a shared date lots come before sells, then input order. */
    public static final Comparator<LedgerEvent> MATCHING_ORDER = Comparator
        .comparing(LedgerEvent::getTradeDate)
        .thenComparing(event -> !event.isPurchase())
        .thenComparingInt(LedgerEvent::getPosition);

    /**
     * @return the first event dated before an event that precedes it in input order
     */
    public Optional<OutOfOrderWarning> findViolation(String scripName, List<? extends LedgerEvent> events) {
        LocalDate latest = null;
        for (LedgerEvent event : events.stream().sorted(INPUT_ORDER).toList()) {
            if (latest != null && event.getTradeDate().isBefore(latest)) {
                OutOfOrderWarning warning = new OutOfOrderWarning(scripName, latest, event.getTradeDate(), event.getRowNumber());
                log.debug("{}", warning.message());
                return Optional.of(warning);
            }
            latest = event.getTradeDate();
        }
        return Optional.empty();
    }

    public List<LedgerEvent> matchingOrder(List<? extends LedgerEvent> events) {
        return events.stream()
            .sorted(MATCHING_ORDER)
            .map(LedgerEvent.class::cast)
            .toList();
    }

    public List<LedgerEvent> inputOrder(List<? extends LedgerEvent> events) {
        return events.stream()
            .sorted(INPUT_ORDER)
            .map(LedgerEvent.class::cast)
            .toList();
    }
}
