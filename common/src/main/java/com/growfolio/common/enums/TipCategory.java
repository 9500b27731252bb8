package com.growfolio.common.enums;

/*
 * 09/15/2026 - 2:02 PM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of an investing tip
 */
public enum TipCategory {
    DCA("dca"),
    DIVERSIFICATION("diversification"),
    FEES("fees"),
    AUTOMATION("automation"),
    RISK("risk"),
    GENERAL("general");

    private final String value;

    TipCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TipCategory fromValue(String value) {
        if (value == null) return GENERAL;
        for (TipCategory candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return GENERAL;
    }
}
