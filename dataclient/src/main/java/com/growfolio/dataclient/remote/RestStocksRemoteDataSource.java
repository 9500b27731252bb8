package com.growfolio.dataclient.remote;

/*
 * 09/24/2026 - 10:51 AM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.core.type.TypeReference;
import com.growfolio.common.dto.Requests.OrderRequest;
import com.growfolio.common.dto.Requests.WatchlistRequest;
import com.growfolio.common.enums.HistoryPeriod;
import com.growfolio.common.model.MarketHours;
import com.growfolio.common.model.Stock;
import com.growfolio.common.model.StockHistory;
import com.growfolio.common.model.StockOrder;
import com.growfolio.common.model.StockQuote;
import com.growfolio.common.model.StockSearchResult;
import com.growfolio.common.model.WatchlistItem;

import java.util.List;
import java.util.Map;

public class RestStocksRemoteDataSource implements StocksRemoteDataSource {

    private static final TypeReference<List<StockSearchResult>> SEARCH_RESULTS = new TypeReference<>() {};
    private static final TypeReference<Stock> STOCK = new TypeReference<>() {};
    private static final TypeReference<StockQuote> QUOTE = new TypeReference<>() {};
    private static final TypeReference<StockHistory> HISTORY = new TypeReference<>() {};
    private static final TypeReference<MarketHours> MARKET_HOURS = new TypeReference<>() {};
    private static final TypeReference<StockOrder> ORDER = new TypeReference<>() {};
    private static final TypeReference<List<WatchlistItem>> WATCHLIST = new TypeReference<>() {};
    private static final TypeReference<WatchlistItem> WATCHLIST_ITEM = new TypeReference<>() {};

    // the server keeps one watchlist per user under this id
    private static final String DEFAULT_WATCHLIST = "default";

    private final ApiClient api;

    public RestStocksRemoteDataSource(ApiClient api) {
        this.api = api;
    }

    @Override
    public List<StockSearchResult> search(String query, int limit) {
        return api.get(SEARCH_RESULTS, Map.of("q", query, "limit", limit), "/stocks/search");
    }

    @Override
    public Stock getStock(String symbol) {
        return api.get(STOCK, "/stocks/{symbol}", symbol);
    }

    @Override
    public StockQuote getQuote(String symbol) {
        return api.get(QUOTE, "/stocks/{symbol}/quote", symbol);
    }

    @Override
    public StockHistory getHistory(String symbol, HistoryPeriod period) {
        return api.get(HISTORY, Map.of("period", period.getValue()), "/stocks/{symbol}/history", symbol);
    }

    @Override
    public MarketHours getMarketStatus() {
        return api.get(MARKET_HOURS, "/stocks/market/status");
    }

    @Override
    public StockOrder submitOrder(OrderRequest request) {
        return api.post(ORDER, request, "/orders");
    }

    // ==================== Watchlist ====================

    @Override
    public List<WatchlistItem> listWatchlist() {
        return api.get(WATCHLIST, "/watchlists/{id}/symbols", DEFAULT_WATCHLIST);
    }

    @Override
    public WatchlistItem addToWatchlist(WatchlistRequest request) {
        return api.post(WATCHLIST_ITEM, request, "/watchlists/{id}/symbols", DEFAULT_WATCHLIST);
    }

    @Override
    public void removeFromWatchlist(String symbol) {
        api.delete("/watchlists/{id}/symbols/{symbol}", DEFAULT_WATCHLIST, symbol);
    }
}
