package com.growfolio.common.model;

/*
 * 09/18/2026 - 10:47 AM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonProperty;
import com.growfolio.common.enums.PortfolioType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Investment portfolio owned by the current user.
 */
@Builder(toBuilder = true)
public record Portfolio(
        String id,
        String userId,
        String name,
        String description,
        PortfolioType type,
        String currencyCode,
        BigDecimal totalValue,
        BigDecimal totalCostBasis,
        BigDecimal cashBalance,
        Instant lastValuationDate,
        @JsonProperty("is_default") boolean isDefault,
        String colorHex,
        String iconName,
        Instant createdAt,
        Instant updatedAt) {

    public BigDecimal totalReturn() {
        return nz(totalValue).subtract(nz(totalCostBasis));
    }

    public BigDecimal totalAssets() {
        return nz(totalValue).add(nz(cashBalance));
    }

    private static BigDecimal nz(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
