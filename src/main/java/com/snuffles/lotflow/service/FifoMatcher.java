package com.snuffles.lotflow.service;

import com.snuffles.lotflow.config.LotflowProperties;
import com.snuffles.lotflow.domain.LedgerEvent;
import com.snuffles.lotflow.domain.Lot;
import com.snuffles.lotflow.domain.OverSellWarning;
import com.snuffles.lotflow.domain.SecurityLedger;
import com.snuffles.lotflow.domain.SecurityOutcome;
import com.snuffles.lotflow.domain.SellEvent;
import com.snuffles.lotflow.service.exception.InputFormatException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Consumes a scrip's lots oldest-first as its sells arrive.
 *
 * <p>Lots are appended to one list as they appear in the ledger and a head index marks
 * the oldest lot with shares left; a sell advances the index past every lot it empties.
 * Emptied lots stay in the list so the outcome reports every lot, open or not. A sell
 * larger than the open lots empties them all and records the shortfall; inventory never
 * goes negative. Each sale removes the sold fraction of the lot's remaining cost, so the
 * cost left always stays proportional to the shares left.
 *
 * <p>Holds no state between calls. Each ledger must carry lots created for this run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FifoMatcher {

    private final LotflowProperties properties;

    public SecurityOutcome match(SecurityLedger ledger) {
        List<Lot> lots = new ArrayList<>();
        List<OverSellWarning> overSells = new ArrayList<>();
        int head = 0;
        long sold = 0;
        long matched = 0;

        for (LedgerEvent event : ledger.getEvents()) {
            if (event.isPurchase()) {
                Lot lot = (Lot) event;
                lots.add(lot);
                log.debug("  Buy: {} shares of {} at {} on {}",
                    lot.getOriginalQuantity(), ledger.getScripName(), lot.getPrice(), lot.getTradeDate());
                continue;
            }

            SellEvent sell = (SellEvent) event;
            log.debug("  Sell: {} shares of {} on {}", sell.getQuantity(), ledger.getScripName(), sell.getTradeDate());
            sold = addQuantity(sold, sell.getQuantity(), ledger.getScripName());
            long outstanding = sell.getQuantity();

            while (outstanding > 0 && head < lots.size()) {
                Lot lot = lots.get(head);
                long take = Math.min(outstanding, lot.getRemainingQuantity());
                consume(lot, take);
                outstanding -= take;
                matched += take;
                log.trace("    Matched: {} shares from lot of {} ({} left)", take, lot.getTradeDate(), lot.getRemainingQuantity());
                if (!lot.isOpen()) {
                    head++;
                }
            }

            if (outstanding > 0) {
                OverSellWarning warning = new OverSellWarning(ledger.getScripName(), sell.getTradeDate(), sell.getQuantity(), outstanding);
                log.debug("  {}", warning.message());
                overSells.add(warning);
            }
        }

        return SecurityOutcome.processed(ledger.getScripName(), lots, sold, matched, overSells);
    }

    private void consume(Lot lot, long take) {
        long remainingQuantity = lot.getRemainingQuantity() - take;
        BigDecimal remainingCost;
        if (remainingQuantity == 0) {
            remainingCost = BigDecimal.ZERO.setScale(properties.getCostScale());
        } else {
            // pro rata share of the remaining cost
            BigDecimal decrement = lot.getRemainingCost()
                .multiply(BigDecimal.valueOf(take))
                .divide(BigDecimal.valueOf(lot.getRemainingQuantity()), properties.getCostScale(), properties.getRoundingMode());
            remainingCost = lot.getRemainingCost().subtract(decrement).max(BigDecimal.ZERO);
        }
        lot.setRemainingQuantity(remainingQuantity);
        lot.setRemainingCost(remainingCost);
    }

    private long addQuantity(long total, long quantity, String scripName) {
        try {
            return Math.addExact(total, quantity);
        } catch (ArithmeticException ex) {
            throw new InputFormatException("Total quantity sold of " + scripName + " is too large", ex);
        }
    }
}
