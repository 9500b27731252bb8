package com.growfolio.common.enums;

/*
 * 09/15/2026 - 2:10 PM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a funding transfer
 */
public enum TransferStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    TransferStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TransferStatus fromValue(String value) {
        if (value == null) return PENDING;
        for (TransferStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return PENDING;
    }

    /**
     * A transfer can still be cancelled while it has not reached a terminal state.
     */
    public boolean isCancellable() {
        return this == PENDING || this == PROCESSING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
