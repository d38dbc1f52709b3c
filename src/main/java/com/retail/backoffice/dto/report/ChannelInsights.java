package com.retail.backoffice.dto.report;

import com.retail.backoffice.model.SalesChannel;
import com.retail.backoffice.report.ReportMath;

import java.math.BigDecimal;
import java.util.List;

public record ChannelInsights(
        List<BreakdownRow> split,
        String dominantChannel,
        BigDecimal onlinePercentage,
        BigDecimal onlineAvgOrderValue,
        BigDecimal offlineAvgOrderValue) {

    public static ChannelInsights empty() {
        BigDecimal zero = ReportMath.money(BigDecimal.ZERO);
        return new ChannelInsights(List.of(), SalesChannel.OFFLINE.getCode(), zero, zero, zero);
    }
}
