package com.growfolio.common.model;

/*
 * 09/18/2026 - 11:36 AM
 * @author Growfolio Engineering
 */

import java.math.BigDecimal;
import java.time.Instant;

public record StockQuote(
        String symbol,
        BigDecimal price,
        BigDecimal change,
        BigDecimal changePercent,
        long volume,
        Instant timestamp) {

    public boolean isPriceUp() {
        return change != null && change.signum() >= 0;
    }
}
