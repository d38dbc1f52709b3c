package com.retail.backoffice.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Order lifecycle states. Transitions are enforced by the order write-path;
 * reports only rely on the revenue/refund classification.
 */
public enum OrderStatus {
    PENDING("pending"),
    CONFIRMED("confirmed"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    CANCELLED("cancelled"),
    REFUNDED("refunded");

    private final String code;

    OrderStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<OrderStatus> from(String value) {
        if (value == null)
            return Optional.empty();
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (OrderStatus status : values()) {
            if (status.code.equals(normalized))
                return Optional.of(status);
        }
        return Optional.empty();
    }

    // pending, confirmed, processing and completed all count towards revenue
    public boolean isRevenueBearing() {
        return this == PENDING || this == CONFIRMED || this == PROCESSING || this == COMPLETED;
    }

    public boolean isRefund() {
        return this == REFUNDED;
    }

    public boolean isTerminal() {
        return this == CANCELLED || this == REFUNDED;
    }

    public Set<OrderStatus> allowedTransitions() {
        switch (this) {
            case PENDING:
                return EnumSet.of(CONFIRMED, CANCELLED);
            case CONFIRMED:
                return EnumSet.of(PROCESSING, CANCELLED);
            case PROCESSING:
                return EnumSet.of(COMPLETED, CANCELLED);
            case COMPLETED:
                return EnumSet.of(REFUNDED);
            default:
                return EnumSet.noneOf(OrderStatus.class);
        }
    }

    public boolean canTransitionTo(OrderStatus next) {
        return allowedTransitions().contains(next);
    }
}
