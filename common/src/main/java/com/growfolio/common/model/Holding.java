package com.growfolio.common.model;

/*
 * 09/18/2026 - 10:08 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.enums.AssetType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Position in a single security inside a portfolio.
 */
@Builder(toBuilder = true)
public record Holding(
        String id,
        String portfolioId,
        String stockSymbol,
        String stockName,
        BigDecimal quantity,
        BigDecimal averageCostPerShare,
        BigDecimal currentPricePerShare,
        Instant firstPurchaseDate,
        Instant lastPurchaseDate,
        Instant priceUpdatedAt,
        String sector,
        String industry,
        AssetType assetType,
        Instant createdAt,
        Instant updatedAt) {

    public BigDecimal costBasis() {
        return nz(quantity).multiply(nz(averageCostPerShare));
    }

    public BigDecimal marketValue() {
        return nz(quantity).multiply(nz(currentPricePerShare));
    }

    public BigDecimal unrealizedGainLoss() {
        return marketValue().subtract(costBasis());
    }

    public boolean isProfitable() {
        return unrealizedGainLoss().signum() > 0;
    }

    private static BigDecimal nz(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
