package com.growfolio.common.model;

/*
 * 09/18/2026 - 12:21 PM
 * @author Growfolio Engineering
 */

import java.time.Instant;

public record WatchlistItem(String symbol, Instant dateAdded, String notes) {
}
