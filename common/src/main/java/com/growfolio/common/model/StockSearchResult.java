package com.growfolio.common.model;

/*
 * 09/18/2026 - 11:46 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.enums.AssetType;

public record StockSearchResult(String symbol, String name, String exchange, AssetType assetType, String currencyCode) {
}
