package com.retail.backoffice.report;

import java.math.BigDecimal;

/**
 * Named defaults shared by the report engine.
 */
public final class ReportDefaults {

    /** Cost price assumed when a product has none recorded: 60% of its sell price. */
    public static final BigDecimal DEFAULT_COST_RATIO = new BigDecimal("0.60");

    public static final int DEFAULT_MIN_STOCK_LEVEL = 5;

    public static final int DEFAULT_LOW_STOCK_THRESHOLD = 10;
    public static final int DEFAULT_CUSTOMER_LIMIT = 50;
    public static final int DEFAULT_TREND_WEEKS = 8;
    public static final int DEFAULT_RANGE_DAYS = 30;

    /** Trailing window used to estimate monthly sales velocity. */
    public static final int SALES_VELOCITY_DAYS = 90;
    public static final int SALES_VELOCITY_MONTHS = 3;

    /** Months-of-stock reported when a product has not sold at all. */
    public static final BigDecimal NO_SALES_MONTHS_OF_STOCK = new BigDecimal("999");

    public static final String WALK_IN_CUSTOMER = "Walk-in";
    public static final String UNCATEGORIZED = "Uncategorized";

    private ReportDefaults() {
    }
}
