package com.growfolio.common.model;

/*
 * 09/18/2026 - 11:11 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.enums.AssetType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Security reference data with the last known price.
 */
@Builder(toBuilder = true)
public record Stock(
        String symbol,
        String name,
        String exchange,
        AssetType assetType,
        BigDecimal currentPrice,
        BigDecimal priceChange,
        BigDecimal priceChangePercent,
        BigDecimal previousClose,
        BigDecimal marketCap,
        BigDecimal peRatio,
        BigDecimal dividendYield,
        String sector,
        String industry,
        String companyDescription,
        String currencyCode,
        Instant lastUpdated) {
}
