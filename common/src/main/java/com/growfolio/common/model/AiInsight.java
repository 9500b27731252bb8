package com.growfolio.common.model;

/*
 * 09/18/2026 - 9:08 AM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonProperty;
import com.growfolio.common.enums.InsightType;

import java.time.Instant;

public record AiInsight(
        String id,
        InsightType type,
        String title,
        String content,
        int priority,
        Action action,
        Instant generatedAt,
        @JsonProperty("is_dismissed") boolean isDismissed) {

    public record Action(String type, String label, String destination) {
    }
}
