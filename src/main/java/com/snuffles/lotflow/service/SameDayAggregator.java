package com.snuffles.lotflow.service;

import com.snuffles.lotflow.config.LotflowProperties;
import com.snuffles.lotflow.domain.Lot;
import com.snuffles.lotflow.domain.SequencedTrade;
import com.snuffles.lotflow.domain.TradeRecord;
import com.snuffles.lotflow.service.exception.InputFormatException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds purchase lots from buy trades, collapsing the buys of one scrip on one date into
 * a single lot priced at the quantity-weighted average.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SameDayAggregator {

    private final LotflowProperties properties;

    /**
     * @param buys buy trades in input order
     * @return one lot per (scrip, date) group, ordered by the earliest position in each group
     */
    public List<Lot> aggregate(List<SequencedTrade> buys) {
        Map<GroupKey, List<SequencedTrade>> groups = new LinkedHashMap<>();
        for (SequencedTrade buy : buys) {
            GroupKey key = properties.isAggregateSameDay()
                ? new GroupKey(buy.trade().scripName(), buy.trade().tradeDate(), -1)
                : new GroupKey(buy.trade().scripName(), buy.trade().tradeDate(), buy.position());
            groups.computeIfAbsent(key, ignored -> new ArrayList<>()).add(buy);
        }

        return groups.values().stream()
            .map(this::toLot)
            .sorted(Comparator.comparingInt(Lot::getPosition))
            .toList();
    }

    private Lot toLot(List<SequencedTrade> group) {
        TradeRecord first = group.get(0).trade();
        boolean useAmount = usesAmount(group);

        long quantity = 0;
        BigDecimal rawCost = BigDecimal.ZERO;
        for (SequencedTrade buy : group) {
            TradeRecord trade = buy.trade();
            quantity = addQuantity(quantity, trade.buyQuantity(), first);
            rawCost = rawCost.add(useAmount
                ? trade.buyAmount()
                : trade.buyPrice().multiply(BigDecimal.valueOf(trade.buyQuantity())));
        }

        BigDecimal price = rawCost.divide(BigDecimal.valueOf(quantity), properties.getPriceScale(), properties.getRoundingMode());
        BigDecimal cost = rawCost.setScale(properties.getCostScale(), properties.getRoundingMode());
        boolean aggregated = group.size() > 1;

        if (aggregated) {
            log.debug("Aggregated {} buys of {} on {} into {} shares at {}",
                group.size(), first.scripName(), first.tradeDate(), quantity, price);
        }

        return Lot.builder()
            .scripName(first.scripName())
            .segment(first.segment())
            .tradeDate(first.tradeDate())
            .originalQuantity(quantity)
            .price(price)
            .cost(cost)
            .clientCode(first.clientCode())
            .orderNo(aggregated ? Lot.AGGREGATED_ORDER_PREFIX + first.tradeDate() : first.orderNo())
            .tradeCount(group.size())
            .position(group.get(0).position())
            .rowNumber(group.get(0).rowNumber())
            .remainingQuantity(quantity)
            .remainingCost(cost)
            .build();
    }

    private long addQuantity(long total, long quantity, TradeRecord group) {
        try {
            return Math.addExact(total, quantity);
        } catch (ArithmeticException ex) {
            throw new InputFormatException("Total quantity bought of " + group.scripName()
                + " on " + group.tradeDate() + " is too large", ex);
        }
    }

    private boolean usesAmount(List<SequencedTrade> group) {
        if (properties.getCostBasis() != LotflowProperties.CostBasis.AMOUNT_WHEN_AVAILABLE) {
            return false;
        }
        return group.stream()
            .map(SequencedTrade::trade)
            .allMatch(trade -> trade.buyAmount() != null && trade.buyAmount().signum() > 0);
    }

    private record GroupKey(String scripName, LocalDate tradeDate, int position) {
    }
}
