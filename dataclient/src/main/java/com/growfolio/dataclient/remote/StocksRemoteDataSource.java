package com.growfolio.dataclient.remote;

/*
 * 09/24/2026 - 11:01 AM
 * @author Growfolio Engineering
 */

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

/**
 * Market data, orders and the user's default watchlist. Symbols are passed as given.
 */
public interface StocksRemoteDataSource {

    List<StockSearchResult> search(String query, int limit);

    Stock getStock(String symbol);

    StockQuote getQuote(String symbol);

    StockHistory getHistory(String symbol, HistoryPeriod period);

    MarketHours getMarketStatus();

    StockOrder submitOrder(OrderRequest request);

    List<WatchlistItem> listWatchlist();

    WatchlistItem addToWatchlist(WatchlistRequest request);

    void removeFromWatchlist(String symbol);
}
