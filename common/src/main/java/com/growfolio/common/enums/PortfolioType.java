package com.growfolio.common.enums;

/*
 * 09/15/2026 - 1:52 PM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of investment account a portfolio represents
 */
public enum PortfolioType {
    PERSONAL("personal"),
    RETIREMENT("retirement"),
    EDUCATION("education"),
    BROKERAGE("brokerage"),
    IRA("ira"),
    ROTH("roth"),
    HSA("hsa"),
    TRUST("trust"),
    JOINT("joint"),
    CUSTODIAL("custodial"),
    OTHER("other");

    private final String value;

    PortfolioType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PortfolioType fromValue(String value) {
        if (value == null) return OTHER;
        for (PortfolioType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return OTHER;
    }
}
