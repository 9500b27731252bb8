package com.growfolio.common.enums;

/*
 * 09/15/2026 - 1:56 PM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Subscription plan of a user
 */
public enum SubscriptionTier {
    FREE("free"),
    PREMIUM("premium"),
    FAMILY("family");

    private final String value;

    SubscriptionTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SubscriptionTier fromValue(String value) {
        if (value == null) return FREE;
        for (SubscriptionTier candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return FREE;
    }
}
