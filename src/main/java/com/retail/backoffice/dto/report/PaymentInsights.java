package com.retail.backoffice.dto.report;

import com.retail.backoffice.model.PaymentMethod;
import com.retail.backoffice.report.ReportMath;

import java.math.BigDecimal;
import java.util.List;

public record PaymentInsights(
        List<BreakdownRow> split,
        String dominantMethod,
        BigDecimal cashPercentage,
        BigDecimal digitalAdoption) {

    public static PaymentInsights empty() {
        BigDecimal zero = ReportMath.money(BigDecimal.ZERO);
        return new PaymentInsights(List.of(), PaymentMethod.CASH.getCode(), zero, zero);
    }
}
