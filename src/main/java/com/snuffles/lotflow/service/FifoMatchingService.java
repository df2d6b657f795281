package com.snuffles.lotflow.service;

import com.snuffles.lotflow.config.LotflowProperties;
import com.snuffles.lotflow.domain.FifoDiagnostics;
import com.snuffles.lotflow.domain.FifoReport;
import com.snuffles.lotflow.domain.LedgerEvent;
import com.snuffles.lotflow.domain.Lot;
import com.snuffles.lotflow.domain.OutOfOrderWarning;
import com.snuffles.lotflow.domain.RawTradeRow;
import com.snuffles.lotflow.domain.SecurityLedger;
import com.snuffles.lotflow.domain.SecurityOutcome;
import com.snuffles.lotflow.domain.SecuritySummary;
import com.snuffles.lotflow.domain.SellEvent;
import com.snuffles.lotflow.domain.SequencedTrade;
import com.snuffles.lotflow.domain.TradeRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Runs the whole pipeline: normalize, group by scrip, aggregate buys, validate order,
 * match, summarize. Scrips are independent of each other and may be matched in parallel;
 * results always come back in first-appearance order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FifoMatchingService {

    private final LotflowProperties properties;
    private final TradeRecordNormalizer normalizer;
    private final SameDayAggregator aggregator;
    private final ChronologicalValidator validator;
    private final FifoMatcher matcher;
    private final HoldingsSummaryBuilder summaryBuilder;

    /**
     * Normalizes export rows and matches the ones that survive. Warnings refer to the
     * rows' own row numbers.
     */
    public FifoReport processRows(List<RawTradeRow> rows) {
        FifoDiagnostics diagnostics = new FifoDiagnostics();
        List<SequencedTrade> trades = new ArrayList<>(rows.size());
        for (RawTradeRow row : rows) {
            normalizer.normalize(row, diagnostics)
                .ifPresent(trade -> trades.add(new SequencedTrade(trades.size(), row.rowNumber(), trade)));
        }
        log.debug("Normalized {} of {} rows", trades.size(), rows.size());
        return process(trades, diagnostics);
    }

    /**
     * Matches already typed trades. Warnings number the trades from 1 in list order.
     */
    public FifoReport process(List<TradeRecord> trades) {
        List<SequencedTrade> sequenced = new ArrayList<>(trades.size());
        for (int position = 0; position < trades.size(); position++) {
            sequenced.add(new SequencedTrade(position, trades.get(position)));
        }
        return process(sequenced, new FifoDiagnostics());
    }

    private FifoReport process(List<SequencedTrade> trades, FifoDiagnostics diagnostics) {
        Map<String, List<SequencedTrade>> byScrip = new LinkedHashMap<>();
        for (SequencedTrade sequenced : trades) {
            TradeRecord trade = sequenced.trade();
            if (trade.type() == TradeRecord.TradeType.Noop) {
                diagnostics.recordNoop();
                continue;
            }
            byScrip.computeIfAbsent(trade.scripName(), ignored -> new ArrayList<>()).add(sequenced);
        }
        log.info("Found {} unique scrips in {} trades", byScrip.size(), trades.size());

        Stream<Map.Entry<String, List<SequencedTrade>>> scrips = byScrip.entrySet().stream();
        if (properties.isParallel()) {
            scrips = scrips.parallel();
        }
        List<SecurityOutcome> outcomes = scrips
            .map(entry -> processScrip(entry.getKey(), entry.getValue()))
            .toList();

        for (SecurityOutcome outcome : outcomes) {
            if (outcome.getOutOfOrderWarning() != null) {
                diagnostics.recordOutOfOrder(outcome.getOutOfOrderWarning());
            }
            diagnostics.recordOverSells(outcome.getOverSells());
        }

        List<Lot> remainingLots = outcomes.stream()
            .flatMap(outcome -> outcome.remainingLots().stream())
            .sorted(Comparator.comparingInt(Lot::getPosition))
            .toList();
        List<SecuritySummary> summary = summaryBuilder.build(outcomes);

        log.info("Matched {} scrips: {} remaining lots, {} skipped, {} over-sells, {} malformed rows",
            outcomes.size(),
            remainingLots.size(),
            outcomes.stream().filter(outcome -> !outcome.isProcessed()).count(),
            diagnostics.getOverSellWarnings().size(),
            diagnostics.getMalformedCount());

        return new FifoReport(remainingLots, summary, outcomes, diagnostics);
    }

    private SecurityOutcome processScrip(String scripName, List<SequencedTrade> trades) {
        log.debug("Processing trades for: {}", scripName);

        List<SequencedTrade> buys = trades.stream()
            .filter(trade -> trade.trade().type() == TradeRecord.TradeType.Buy)
            .toList();
        List<LedgerEvent> events = new ArrayList<>(aggregator.aggregate(buys));
        trades.stream()
            .filter(trade -> trade.trade().type() == TradeRecord.TradeType.Sell)
            .map(this::toSellEvent)
            .forEach(events::add);

        Optional<OutOfOrderWarning> violation = validator.findViolation(scripName, events);
        if (violation.isPresent() && isSkipping()) {
            log.debug("Skipping {}: {}", scripName, violation.get().message());
            return SecurityOutcome.skipped(scripName, violation.get());
        }

        if (violation.isPresent()) {
            log.debug("{}; matching in file order", violation.get().message());
            SecurityOutcome outcome = matcher.match(new SecurityLedger(scripName, validator.inputOrder(events)));
            return outcome.flaggedOutOfOrder(violation.get());
        }
        return matcher.match(new SecurityLedger(scripName, validator.matchingOrder(events)));
    }

    private SellEvent toSellEvent(SequencedTrade sequenced) {
        TradeRecord trade = sequenced.trade();
        return SellEvent.builder()
            .scripName(trade.scripName())
            .tradeDate(trade.tradeDate())
            .quantity(trade.sellQuantity())
            .price(trade.sellPrice())
            .amount(trade.sellAmount())
            .orderNo(trade.orderNo())
            .position(sequenced.position())
            .rowNumber(sequenced.rowNumber())
            .build();
    }

    private boolean isSkipping() {
        return properties.getOutOfOrderPolicy() == LotflowProperties.OutOfOrderPolicy.SKIP;
    }
}
