package com.snuffles.lotflow.service;

import com.snuffles.lotflow.config.LotflowProperties;
import com.snuffles.lotflow.domain.Lot;
import com.snuffles.lotflow.domain.SecurityOutcome;
import com.snuffles.lotflow.domain.SecuritySummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Rolls remaining lots up into one {@link SecuritySummary} per processed scrip.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HoldingsSummaryBuilder {

    private final LotflowProperties properties;

    public List<SecuritySummary> build(List<SecurityOutcome> outcomes) {
        List<SecuritySummary> summary = outcomes.stream()
            .filter(SecurityOutcome::isProcessed)
            .map(outcome -> summarize(outcome.getScripName(), outcome.remainingLots()))
            .sorted(Comparator.comparing(SecuritySummary::scripName))
            .toList();
        log.debug("Built summary for {} scrips", summary.size());
        return summary;
    }

    public SecuritySummary summarize(String scripName, List<Lot> remainingLots) {
        long shares = 0;
        BigDecimal cost = BigDecimal.ZERO;
        LocalDate earliest = null;
        LocalDate latest = null;
        int count = 0;

        for (Lot lot : remainingLots) {
            if (!lot.isOpen()) {
                continue;
            }
            shares += lot.getRemainingQuantity();
            cost = cost.add(lot.getRemainingCost());
            earliest = earliest == null || lot.getTradeDate().isBefore(earliest) ? lot.getTradeDate() : earliest;
            latest = latest == null || lot.getTradeDate().isAfter(latest) ? lot.getTradeDate() : latest;
            count++;
        }

        BigDecimal average = shares == 0
            ? BigDecimal.ZERO.setScale(properties.getAverageCostScale())
            : cost.divide(BigDecimal.valueOf(shares), properties.getAverageCostScale(), properties.getRoundingMode());

        return new SecuritySummary(scripName, shares, cost, earliest, latest, count, average);
    }
}
