package com.retail.backoffice.report;

public enum GroupingDimension {
    NONE(null),
    HOUR(Granularity.HOUR),
    DAY(Granularity.DAY),
    WEEK(Granularity.WEEK),
    MONTH(Granularity.MONTH),
    PAYMENT_METHOD(null),
    CHANNEL(null),
    PRODUCT(null),
    CATEGORY(null);

    private final Granularity granularity;

    GroupingDimension(Granularity granularity) {
        this.granularity = granularity;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public boolean isTimeBased() {
        return granularity != null;
    }

    public boolean isItemBased() {
        return this == PRODUCT || this == CATEGORY;
    }
}
