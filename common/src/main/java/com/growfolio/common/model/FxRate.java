package com.growfolio.common.model;

/*
 * 09/18/2026 - 9:51 AM
 * @author Growfolio Engineering
 */

import java.math.BigDecimal;
import java.time.Instant;

public record FxRate(
        String fromCurrency,
        String toCurrency,
        BigDecimal rate,
        BigDecimal spread,
        Instant timestamp,
        Instant expiresAt) {

    public BigDecimal effectiveRate() {
        return rate.multiply(BigDecimal.ONE.subtract(spread != null ? spread : BigDecimal.ZERO));
    }

    public boolean isValid(Instant now) {
        return expiresAt != null && now.isBefore(expiresAt);
    }
}
