package com.growfolio.common.model;

/*
 * 09/18/2026 - 10:26 AM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonProperty;
import com.growfolio.common.enums.MarketSession;

import java.time.Instant;

/**
 * Exchange trading status at {@code timestamp}.
 */
public record MarketHours(
        String exchange,
        @JsonProperty("is_open") boolean isOpen,
        MarketSession session,
        Instant nextOpen,
        Instant nextClose,
        Instant timestamp) {
}
