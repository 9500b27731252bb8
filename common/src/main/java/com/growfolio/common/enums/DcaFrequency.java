package com.growfolio.common.enums;

/*
 * 09/15/2026 - 12:35 PM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How often a recurring investment executes
 */
public enum DcaFrequency {
    DAILY("daily"),
    WEEKLY("weekly"),
    BIWEEKLY("biweekly"),
    MONTHLY("monthly"),
    QUARTERLY("quarterly");

    private final String value;

    DcaFrequency(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DcaFrequency fromValue(String value) {
        if (value == null) return MONTHLY;
        for (DcaFrequency candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return MONTHLY;
    }
}
