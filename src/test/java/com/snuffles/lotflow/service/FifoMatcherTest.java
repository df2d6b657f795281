package com.snuffles.lotflow.service;

import com.snuffles.lotflow.config.LotflowProperties;
import com.snuffles.lotflow.domain.LedgerEvent;
import com.snuffles.lotflow.domain.Lot;
import com.snuffles.lotflow.domain.OverSellWarning;
import com.snuffles.lotflow.domain.SecurityLedger;
import com.snuffles.lotflow.domain.SecurityOutcome;
import com.snuffles.lotflow.domain.SellEvent;
import com.snuffles.lotflow.service.exception.InputFormatException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static com.snuffles.lotflow.testing.TradeFixtures.lot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FifoMatcherTest {

    private static final LocalDate JAN_1 = LocalDate.of(2023, 1, 1);
    private static final LocalDate JAN_2 = LocalDate.of(2023, 1, 2);
    private static final LocalDate FEB_1 = LocalDate.of(2023, 2, 1);
    private static final LocalDate MAR_1 = LocalDate.of(2023, 3, 1);

    private final FifoMatcher matcher = new FifoMatcher(new LotflowProperties());

    @Test
    void consumesOldestLotFirst() {
        Lot older = lot("ACME", JAN_1, 10, "100", 0);
        Lot newer = lot("ACME", JAN_2, 10, "200", 1);

        SecurityOutcome outcome = match(older, newer, sell(FEB_1, 4, 2));

        assertThat(older.getRemainingQuantity()).isEqualTo(6);
        assertThat(older.getRemainingCost()).isEqualByComparingTo("600");
        assertThat(newer.getRemainingQuantity()).isEqualTo(newer.getOriginalQuantity());
        assertThat(newer.getRemainingCost()).isEqualByComparingTo("2000");
        assertThat(outcome.getSoldQuantity()).isEqualTo(4);
        assertThat(outcome.getMatchedQuantity()).isEqualTo(4);
        assertThat(outcome.getOverSells()).isEmpty();
    }

    @Test
    void sellSpanningLotsEmptiesOlderAndDipsIntoNewer() {
        Lot older = lot("ACME", JAN_1, 10, "100", 0);
        Lot newer = lot("ACME", JAN_2, 10, "200", 1);

        SecurityOutcome outcome = match(older, newer, sell(FEB_1, 13, 2));

        assertThat(older.getRemainingQuantity()).isZero();
        assertThat(older.getRemainingCost()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(newer.getRemainingQuantity()).isEqualTo(7);
        assertThat(newer.getRemainingCost()).isEqualByComparingTo("1400");
        assertThat(outcome.getLots()).containsExactly(older, newer);
        assertThat(outcome.remainingLots()).containsExactly(newer);
    }

    @Test
    void laterSellContinuesFromFirstOpenLot() {
        Lot first = lot("ACME", JAN_1, 5, "100", 0);
        Lot second = lot("ACME", JAN_2, 5, "110", 1);
        Lot third = lot("ACME", FEB_1, 5, "120", 3);

        match(first, second, sell(JAN_2, 7, 2), third, sell(MAR_1, 4, 4));

        assertThat(first.getRemainingQuantity()).isZero();
        assertThat(second.getRemainingQuantity()).isZero();
        assertThat(third.getRemainingQuantity()).isEqualTo(4);
    }

    @Test
    void overSellStopsAtZeroAndReportsShortfall() {
        Lot only = lot("ACME", JAN_1, 10, "100", 0);

        SecurityOutcome outcome = match(only, sell(FEB_1, 15, 1));

        assertThat(only.getRemainingQuantity()).isZero();
        assertThat(only.getRemainingCost()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(outcome.getOverSells()).containsExactly(new OverSellWarning("ACME", FEB_1, 15, 5));
        assertThat(outcome.shortfallQuantity()).isEqualTo(5);
        assertThat(outcome.getMatchedQuantity()).isEqualTo(10);
        assertThat(outcome.getSoldQuantity()).isEqualTo(15);
    }

    @Test
    void sellBeforeAnyLotIsEntirelyShortfall() {
        Lot lot = lot("ACME", FEB_1, 10, "100", 1);

        SecurityOutcome outcome = match(sell(JAN_1, 3, 0), lot);

        assertThat(outcome.getOverSells()).singleElement().extracting(OverSellWarning::shortfall).isEqualTo(3L);
        assertThat(lot.getRemainingQuantity()).isEqualTo(10);
    }

    @Test
    void fullConsumptionClampsRoundedCostToZero() {
        Lot lot = lot("ACME", JAN_1, 3, "66.6667", 0);
        lot.setRemainingCost(new BigDecimal("200.0000"));

        match(lot, sell(FEB_1, 1, 1), sell(FEB_1, 1, 2));
        assertThat(lot.getRemainingCost()).isEqualByComparingTo("66.6666");

        match(lot, sell(MAR_1, 1, 3));
        assertThat(lot.getRemainingQuantity()).isZero();
        assertThat(lot.getRemainingCost()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(lot.getRemainingCost().signum()).isZero();
    }

    @Test
    void costDecrementsAreRoundedToCostScale() {
        Lot lot = lot("ACME", JAN_1, 3, "33.33333", 0);
        lot.setRemainingCost(new BigDecimal("100.0000"));

        match(lot, sell(FEB_1, 1, 1));

        assertThat(lot.getRemainingCost()).isEqualByComparingTo("66.6667");
        assertThat(lot.getRemainingCost().scale()).isEqualTo(4);
    }

    @Test
    void remainingCostStaysProportionalAcrossPartialSales() {
        Lot lot = lot("ACME", JAN_1, 7, "1.4286", 0);
        lot.setRemainingCost(new BigDecimal("10.0000"));

        for (int position = 1; position < 7; position++) {
            match(lot, sell(FEB_1, 1, position));

            BigDecimal expected = lot.getPrice().multiply(BigDecimal.valueOf(lot.getRemainingQuantity()));
            assertThat(lot.getRemainingCost()).isCloseTo(expected, within(new BigDecimal("0.0005")));
        }
        assertThat(lot.getRemainingQuantity()).isEqualTo(1);
        assertThat(lot.getRemainingCost().signum()).isPositive();
    }

    @Test
    void lastShareOfLargeLotKeepsItsCost() {
        Lot lot = lot("ACME", JAN_1, 300_000, "1.6667", 0);
        lot.setRemainingCost(new BigDecimal("500000.0000"));

        match(lot, sell(FEB_1, 299_999, 1));

        assertThat(lot.getRemainingQuantity()).isEqualTo(1);
        assertThat(lot.getRemainingCost()).isEqualByComparingTo("1.6667");
    }

    @Test
    void soldTotalsTooLargeForLongAreRejected() {
        Lot lot = lot("ACME", JAN_1, 10, "100", 0);

        assertThatThrownBy(() -> match(lot, sell(FEB_1, Long.MAX_VALUE, 1), sell(FEB_1, Long.MAX_VALUE, 2)))
            .isInstanceOf(InputFormatException.class)
            .hasMessageContaining("ACME");
    }

    private SecurityOutcome match(LedgerEvent... events) {
        return matcher.match(new SecurityLedger("ACME", List.of(events)));
    }

    private SellEvent sell(LocalDate date, long quantity, int position) {
        return SellEvent.builder()
            .scripName("ACME")
            .tradeDate(date)
            .quantity(quantity)
            .position(position)
            .build();
    }
}
