package com.growfolio.common.enums;

/*
 * 09/15/2026 - 1:00 PM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Savings goal category
 */
public enum GoalCategory {
    RETIREMENT("retirement"),
    EDUCATION("education"),
    HOUSE("house"),
    CAR("car"),
    VACATION("vacation"),
    EMERGENCY("emergency"),
    WEDDING("wedding"),
    INVESTMENT("investment"),
    OTHER("other");

    private final String value;

    GoalCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static GoalCategory fromValue(String value) {
        if (value == null) return OTHER;
        for (GoalCategory candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return OTHER;
    }
}
