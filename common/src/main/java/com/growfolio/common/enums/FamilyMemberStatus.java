package com.growfolio.common.enums;

/*
 * 09/15/2026 - 12:52 PM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Membership status
 */
public enum FamilyMemberStatus {
    ACTIVE("active"),
    PENDING("pending"),
    INACTIVE("inactive");

    private final String value;

    FamilyMemberStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FamilyMemberStatus fromValue(String value) {
        if (value == null) return ACTIVE;
        for (FamilyMemberStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return ACTIVE;
    }
}
