package com.snuffles.lotflow.service;

import com.snuffles.lotflow.config.LotflowProperties;
import com.snuffles.lotflow.domain.Lot;
import com.snuffles.lotflow.domain.SequencedTrade;
import com.snuffles.lotflow.service.exception.InputFormatException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.snuffles.lotflow.testing.TradeFixtures.buy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SameDayAggregatorTest {

    private static final LocalDate JAN_1 = LocalDate.of(2023, 1, 1);
    private static final LocalDate JAN_2 = LocalDate.of(2023, 1, 2);

    private LotflowProperties properties;
    private SameDayAggregator aggregator;

    @BeforeEach
    void setUp() {
        properties = new LotflowProperties();
        aggregator = new SameDayAggregator(properties);
    }

    @Test
    void collapsesSameDayBuysIntoWeightedAverageLot() {
        List<Lot> lots = aggregator.aggregate(List.of(
            new SequencedTrade(3, buy("ACME", JAN_1, 10, "100")),
            new SequencedTrade(5, buy("ACME", JAN_1, 20, "130"))
        ));

        assertThat(lots).hasSize(1);
        Lot lot = lots.get(0);
        assertThat(lot.getOriginalQuantity()).isEqualTo(30);
        assertThat(lot.getPrice()).isEqualByComparingTo("120");
        assertThat(lot.getCost()).isEqualByComparingTo("3600");
        assertThat(lot.getRemainingQuantity()).isEqualTo(30);
        assertThat(lot.getRemainingCost()).isEqualByComparingTo("3600");
        assertThat(lot.getTradeCount()).isEqualTo(2);
        assertThat(lot.isAggregated()).isTrue();
        assertThat(lot.getOrderNo()).isEqualTo("Aggregated-2023-01-01");
        assertThat(lot.getPosition()).isEqualTo(3);
        assertThat(lot.getRowNumber()).isEqualTo(4);
    }

    @Test
    void singleBuyKeepsItsOrderNumber() {
        List<Lot> lots = aggregator.aggregate(List.of(new SequencedTrade(0, buy("ACME", JAN_1, 10, "100"))));

        assertThat(lots).singleElement().satisfies(lot -> {
            assertThat(lot.getOrderNo()).isEqualTo("B-ACME-2023-01-01");
            assertThat(lot.getTradeCount()).isEqualTo(1);
            assertThat(lot.getPrice()).isEqualByComparingTo("100");
        });
    }

    @Test
    void usesBuyAmountsWhenEveryBuyHasOne() {
        List<Lot> lots = aggregator.aggregate(List.of(
            new SequencedTrade(0, buy("ACME", JAN_1, 10, "100", "1010")),
            new SequencedTrade(1, buy("ACME", JAN_1, 20, "130", "2610"))
        ));

        Lot lot = lots.get(0);
        assertThat(lot.getCost()).isEqualByComparingTo("3620");
        assertThat(lot.getPrice()).isEqualByComparingTo("120.6667");
    }

    @Test
    void fallsBackToQuantityTimesPriceWhenAnAmountIsMissing() {
        List<Lot> lots = aggregator.aggregate(List.of(
            new SequencedTrade(0, buy("ACME", JAN_1, 10, "100", "1010")),
            new SequencedTrade(1, buy("ACME", JAN_1, 20, "130"))
        ));

        assertThat(lots.get(0).getCost()).isEqualByComparingTo("3600");
        assertThat(lots.get(0).getPrice()).isEqualByComparingTo("120");
    }

    @Test
    void quantityTimesPriceBasisIgnoresAmounts() {
        properties.setCostBasis(LotflowProperties.CostBasis.QUANTITY_TIMES_PRICE);

        List<Lot> lots = aggregator.aggregate(List.of(new SequencedTrade(0, buy("ACME", JAN_1, 10, "100", "1010"))));

        assertThat(lots.get(0).getCost()).isEqualByComparingTo("1000");
    }

    @Test
    void keepsDifferentDatesApartInInputOrder() {
        List<Lot> lots = aggregator.aggregate(List.of(
            new SequencedTrade(0, buy("ACME", JAN_1, 10, "100")),
            new SequencedTrade(1, buy("ACME", JAN_2, 5, "110")),
            new SequencedTrade(2, buy("ACME", JAN_1, 10, "120"))
        ));

        assertThat(lots).extracting(Lot::getTradeDate).containsExactly(JAN_1, JAN_2);
        assertThat(lots).extracting(Lot::getPosition).containsExactly(0, 1);
        assertThat(lots.get(0).getOriginalQuantity()).isEqualTo(20);
        assertThat(lots.get(0).getPrice()).isEqualByComparingTo("110");
        assertThat(lots.get(1).getOrderNo()).isEqualTo("B-ACME-2023-01-02");
    }

    @Test
    void quantityTotalTooLargeForLongIsRejected() {
        List<SequencedTrade> buys = List.of(
            new SequencedTrade(0, buy("ACME", JAN_1, Long.MAX_VALUE, "1")),
            new SequencedTrade(1, buy("ACME", JAN_1, 1, "1"))
        );

        assertThatThrownBy(() -> aggregator.aggregate(buys))
            .isInstanceOf(InputFormatException.class)
            .hasMessageContaining("ACME")
            .hasMessageContaining("2023-01-01");
    }

    @Test
    void aggregationCanBeSwitchedOff() {
        properties.setAggregateSameDay(false);

        List<Lot> lots = aggregator.aggregate(List.of(
            new SequencedTrade(0, buy("ACME", JAN_1, 10, "100")),
            new SequencedTrade(1, buy("ACME", JAN_1, 20, "130"))
        ));

        assertThat(lots).hasSize(2);
        assertThat(lots).extracting(Lot::getTradeCount).containsExactly(1, 1);
        assertThat(lots).extracting(Lot::getOriginalQuantity).containsExactly(10L, 20L);
    }
}
