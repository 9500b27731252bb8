package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 2:53 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.enums.HistoryPeriod;
import com.growfolio.common.model.MarketHours;
import com.growfolio.common.model.Stock;
import com.growfolio.common.model.StockHistory;
import com.growfolio.common.model.StockOrder;
import com.growfolio.common.model.StockQuote;
import com.growfolio.common.model.StockSearchResult;
import com.growfolio.common.model.WatchlistItem;
import com.growfolio.common.model.WatchlistItemWithQuote;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;

/**
 * Market data, buy orders and the watchlist. Symbols are case-insensitive: {@code "aapl"} and
 * {@code "AAPL"} share one cache entry and are sent to the API upper-cased.
 */
public interface StocksRepository {

    List<StockSearchResult> searchStocks(String query, int limit);

    Stock getStock(String symbol);

    StockQuote getQuote(String symbol);

    /**
     * Quotes for every symbol that could be loaded, in request order. Failed symbols are left out.
     */
    List<StockQuote> getQuotes(Collection<String> symbols);

    StockHistory getHistory(String symbol, HistoryPeriod period);

    /**
     * Never fails: when the API cannot answer, a locally computed NYSE status is returned (and not cached).
     */
    MarketHours getMarketStatus();

    /**
     * Buy {@code notional} worth of {@code symbol}. Drops cached holdings, portfolio totals and funding balance.
     */
    StockOrder submitBuyOrder(String symbol, BigDecimal notional);

    // ==================== Watchlist ====================

    List<WatchlistItem> getWatchlist();

    WatchlistItem addToWatchlist(String symbol, String notes);

    void removeFromWatchlist(String symbol);

    boolean isInWatchlist(String symbol);

    /**
     * Watchlist newest first, with reference data and quotes. A part that fails to load is left empty.
     */
    List<WatchlistItemWithQuote> getWatchlistWithQuotes();

    void invalidateCache();

    void invalidateCache(String symbol);
}
