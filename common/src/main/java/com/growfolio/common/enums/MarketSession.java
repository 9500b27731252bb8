package com.growfolio.common.enums;

/*
 * 09/15/2026 - 1:35 PM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Trading session of the exchange
 */
public enum MarketSession {
    PRE_MARKET("preMarket"),
    REGULAR("regular"),
    AFTER_HOURS("afterHours"),
    CLOSED("closed");

    private final String value;

    MarketSession(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static MarketSession fromValue(String value) {
        if (value == null) return CLOSED;
        for (MarketSession candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return CLOSED;
    }

    public boolean isTradingHours() {
        return this == REGULAR;
    }
}
