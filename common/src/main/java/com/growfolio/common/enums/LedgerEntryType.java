package com.growfolio.common.enums;

/*
 * 09/15/2026 - 1:27 PM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of ledger movement recorded against a portfolio
 */
public enum LedgerEntryType {
    BUY("buy"),
    SELL("sell"),
    DEPOSIT("deposit"),
    WITHDRAWAL("withdrawal"),
    DIVIDEND("dividend"),
    INTEREST("interest"),
    FEE("fee"),
    TRANSFER("transfer"),
    ADJUSTMENT("adjustment");

    private final String value;

    LedgerEntryType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static LedgerEntryType fromValue(String value) {
        if (value == null) return ADJUSTMENT;
        for (LedgerEntryType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return ADJUSTMENT;
    }
}
