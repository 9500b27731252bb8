package com.growfolio.common.enums;

/*
 * 09/15/2026 - 1:17 PM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of an AI generated insight
 */
public enum InsightType {
    DIVERSIFICATION("diversification"),
    PERFORMANCE("performance"),
    RISK("risk"),
    OPPORTUNITY("opportunity"),
    MILESTONE("milestone"),
    TIP("tip");

    private final String value;

    InsightType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static InsightType fromValue(String value) {
        if (value == null) return TIP;
        for (InsightType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return TIP;
    }
}
