package com.retail.backoffice.report;

import java.math.BigDecimal;
import java.time.LocalDate;

public record RfmProfile(
        int recencyScore,
        int frequencyScore,
        int monetaryScore,
        int totalScore,
        CustomerSegment segment,
        int churnRisk,
        Long daysSinceLastOrder,
        double ordersPer30Days,
        BigDecimal netSpend,
        BigDecimal lifetimeValue,
        LocalDate nextPurchaseDate) {
}
