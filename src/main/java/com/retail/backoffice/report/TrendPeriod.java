package com.retail.backoffice.report;

import java.util.Locale;

public enum TrendPeriod {
    DAILY(GroupingDimension.DAY),
    WEEKLY(GroupingDimension.WEEK),
    MONTHLY(GroupingDimension.MONTH);

    private final GroupingDimension dimension;

    TrendPeriod(GroupingDimension dimension) {
        this.dimension = dimension;
    }

    public GroupingDimension getDimension() {
        return dimension;
    }

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TrendPeriod from(String value) {
        if (value == null || value.isBlank())
            return WEEKLY;
        for (TrendPeriod period : values()) {
            if (period.getCode().equalsIgnoreCase(value.trim()))
                return period;
        }
        throw new IllegalArgumentException("Period must be daily, weekly, or monthly");
    }
}
