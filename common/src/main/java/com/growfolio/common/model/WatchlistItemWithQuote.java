package com.growfolio.common.model;

/*
 * 09/18/2026 - 12:28 PM
 * @author Growfolio Engineering
 */

import java.math.BigDecimal;

/**
 * Watchlist entry enriched with reference data and a quote. Either part may be absent when its lookup failed.
 */
public record WatchlistItemWithQuote(WatchlistItem item, Stock stock, StockQuote quote) {

    public String symbol() {
        return item.symbol();
    }

    public String companyName() {
        return stock != null && stock.name() != null ? stock.name() : item.symbol();
    }

    public BigDecimal currentPrice() {
        if (quote != null) {
            return quote.price();
        }
        return stock != null ? stock.currentPrice() : null;
    }
}
