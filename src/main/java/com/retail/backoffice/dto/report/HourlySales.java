package com.retail.backoffice.dto.report;

import com.retail.backoffice.report.GroupTotals;
import com.retail.backoffice.report.ReportMath;
import com.retail.backoffice.report.TimeBucketer;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

public record HourlySales(String hour, BigDecimal sales, BigDecimal refunds, long orders) {

    public static HourlySales of(GroupTotals totals) {
        return new HourlySales(totals.getKey(), ReportMath.money(totals.getGrossAmount()),
                ReportMath.money(totals.getRefundAmount()), totals.getOrderCount());
    }

    public static List<HourlySales> emptyDay() {
        List<HourlySales> hours = new ArrayList<>(24);
        BigDecimal zero = ReportMath.money(BigDecimal.ZERO);
        for (int hour = 0; hour < 24; hour++) {
            hours.add(new HourlySales(TimeBucketer.hourKey(hour), zero, zero, 0));
        }
        return hours;
    }
}
