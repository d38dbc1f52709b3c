package com.retail.backoffice.report;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CustomerSegment {
    CHAMPION(14),
    LOYAL(11),
    POTENTIAL(8),
    NEW(5),
    AT_RISK(3),
    LOST(Integer.MIN_VALUE);

    private final int minimumScore;

    CustomerSegment(int minimumScore) {
        this.minimumScore = minimumScore;
    }

    /** Maps a combined R+F+M score (3..15) using inclusive lower bounds. */
    public static CustomerSegment fromScore(int totalScore) {
        for (CustomerSegment segment : values()) {
            if (totalScore >= segment.minimumScore)
                return segment;
        }
        return LOST;
    }

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }
}
