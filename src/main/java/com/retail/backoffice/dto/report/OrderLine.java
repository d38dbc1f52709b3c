package com.retail.backoffice.dto.report;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record OrderLine(
        Long id,
        String customer,
        String status,
        String paymentMethod,
        String channel,
        BigDecimal total,
        int itemCount,
        LocalDateTime time) {
}
