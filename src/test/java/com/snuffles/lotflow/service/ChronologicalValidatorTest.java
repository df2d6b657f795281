package com.snuffles.lotflow.service;

import com.snuffles.lotflow.domain.LedgerEvent;
import com.snuffles.lotflow.domain.Lot;
import com.snuffles.lotflow.domain.OutOfOrderWarning;
import com.snuffles.lotflow.domain.SellEvent;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.snuffles.lotflow.testing.TradeFixtures.lot;
import static org.assertj.core.api.Assertions.assertThat;

class ChronologicalValidatorTest {

    private static final LocalDate JAN_1 = LocalDate.of(2023, 1, 1);
    private static final LocalDate FEB_1 = LocalDate.of(2023, 2, 1);
    private static final LocalDate MAR_1 = LocalDate.of(2023, 3, 1);

    private final ChronologicalValidator validator = new ChronologicalValidator();

    @Test
    void acceptsNonDecreasingDatesIncludingTies() {
        List<LedgerEvent> events = List.of(
            lot("ACME", JAN_1, 10, "100", 0),
            sell(JAN_1, 5, 1),
            lot("ACME", FEB_1, 10, "100", 2),
            sell(MAR_1, 5, 3)
        );

        assertThat(validator.findViolation("ACME", events)).isEmpty();
    }

    @Test
    void flagsSellDatedBeforeEarlierBuy() {
        List<LedgerEvent> events = List.of(
            lot("ACME", FEB_1, 10, "100", 0),
            sell(JAN_1, 5, 1)
        );

        Optional<OutOfOrderWarning> violation = validator.findViolation("ACME", events);

        assertThat(violation).contains(new OutOfOrderWarning("ACME", FEB_1, JAN_1, 2));
        assertThat(violation.get().message()).contains("ACME").contains("not in chronological order").contains("row 2");
    }

    @Test
    void judgesEventsByInputPositionNotListOrder() {
        List<LedgerEvent> events = List.of(
            sell(MAR_1, 5, 2),
            lot("ACME", JAN_1, 10, "100", 0),
            lot("ACME", FEB_1, 10, "100", 1)
        );

        assertThat(validator.findViolation("ACME", events)).isEmpty();
    }

    @Test
    void matchingOrderPutsSameDayLotsBeforeSells() {
        SellEvent sell = sell(JAN_1, 5, 0);
        Lot lot = lot("ACME", JAN_1, 10, "100", 1);
        Lot later = lot("ACME", FEB_1, 10, "100", 2);

        List<LedgerEvent> ordered = validator.matchingOrder(List.of(sell, later, lot));

        assertThat(ordered).containsExactly(lot, sell, later);
    }

    @Test
    void inputOrderFollowsPositions() {
        SellEvent sell = sell(JAN_1, 5, 0);
        Lot lot = lot("ACME", FEB_1, 10, "100", 1);

        assertThat(validator.inputOrder(List.of(lot, sell))).containsExactly(sell, lot);
    }

    private SellEvent sell(LocalDate date, long quantity, int position) {
        return SellEvent.builder()
            .scripName("ACME")
            .tradeDate(date)
            .quantity(quantity)
            .position(position)
            .rowNumber(position + 1)
            .build();
    }
}
