package com.growfolio.common.enums;

/*
 * 09/15/2026 - 12:46 PM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role of a member inside a family
 */
public enum FamilyMemberRole {
    ADMIN("admin"),
    MEMBER("member"),
    VIEWER("viewer");

    private final String value;

    FamilyMemberRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FamilyMemberRole fromValue(String value) {
        if (value == null) return MEMBER;
        for (FamilyMemberRole candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return MEMBER;
    }
}
