package com.snuffles.lotflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.RoundingMode;

/**
 * Settings under the {@code lotflow} prefix. Defaults apply when a key is absent, so
 * tests can use {@code new LotflowProperties()} directly.
 */
@Data
@ConfigurationProperties(prefix = "lotflow")
public class LotflowProperties {

    private OutOfOrderPolicy outOfOrderPolicy = OutOfOrderPolicy.SKIP;
    private boolean aggregateSameDay = true;
    private CostBasis costBasis = CostBasis.AMOUNT_WHEN_AVAILABLE;
    private int priceScale = 4;
    private int costScale = 4;
    private int averageCostScale = 2;
    private RoundingMode roundingMode = RoundingMode.HALF_UP;
    private boolean parallel = false;
    private Output output = new Output();

    @Data
    public static class Output {
        private String remainingLotsFile = "remaining_purchases.csv";
        private String summaryFile = "remaining_summary.csv";
    }

    public enum OutOfOrderPolicy {
        /** Report the scrip and leave it out of the results. */
        SKIP,
        /** Report the scrip and match it in file order anyway. */
        WARN
    }

    public enum CostBasis {
        /** BuyAmount when every buy in a group has one, otherwise quantity times price. */
        AMOUNT_WHEN_AVAILABLE,
        QUANTITY_TIMES_PRICE
    }
}
