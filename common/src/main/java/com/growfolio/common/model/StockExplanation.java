package com.growfolio.common.model;

/*
 * 09/18/2026 - 11:18 AM
 * @author Growfolio Engineering
 */

import java.time.Instant;

public record StockExplanation(String symbol, String explanation, Instant generatedAt) {
}
