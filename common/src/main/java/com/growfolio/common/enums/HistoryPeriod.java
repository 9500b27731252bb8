package com.growfolio.common.enums;

/*
 * 09/15/2026 - 1:10 PM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Time range for price history
 */
public enum HistoryPeriod {
    ONE_DAY("1d"),
    ONE_WEEK("1w"),
    ONE_MONTH("1m"),
    THREE_MONTHS("3m"),
    SIX_MONTHS("6m"),
    ONE_YEAR("1y"),
    FIVE_YEARS("5y"),
    ALL("all");

    private final String value;

    HistoryPeriod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static HistoryPeriod fromValue(String value) {
        if (value == null) return ONE_MONTH;
        for (HistoryPeriod candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return ONE_MONTH;
    }
}
