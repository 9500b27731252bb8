package com.growfolio.common.enums;

/*
 * 09/15/2026 - 12:25 PM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Asset class of a holding or stock
 */
public enum AssetType {
    STOCK("stock"),
    ETF("etf"),
    MUTUAL_FUND("mutualFund"),
    BOND("bond"),
    REIT("reit"),
    CRYPTO("crypto"),
    COMMODITY("commodity"),
    OPTION("option"),
    OTHER("other");

    private final String value;

    AssetType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AssetType fromValue(String value) {
        if (value == null) return OTHER;
        for (AssetType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return OTHER;
    }
}
