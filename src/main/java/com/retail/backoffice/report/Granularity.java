package com.retail.backoffice.report;

public enum Granularity {
    HOUR,
    DAY,
    WEEK,
    MONTH
}
