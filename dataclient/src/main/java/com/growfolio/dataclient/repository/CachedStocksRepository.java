package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 1:33 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.dto.Requests.OrderRequest;
import com.growfolio.common.dto.Requests.WatchlistRequest;
import com.growfolio.common.enums.HistoryPeriod;
import com.growfolio.common.enums.OrderSide;
import com.growfolio.common.exception.ApiExceptions.ApiException;
import com.growfolio.common.logging.LogContext;
import com.growfolio.common.model.MarketHours;
import com.growfolio.common.model.Stock;
import com.growfolio.common.model.StockHistory;
import com.growfolio.common.model.StockOrder;
import com.growfolio.common.model.StockQuote;
import com.growfolio.common.model.StockSearchResult;
import com.growfolio.common.model.WatchlistItem;
import com.growfolio.common.model.WatchlistItemWithQuote;
import com.growfolio.dataclient.market.MarketHoursCalculator;
import com.growfolio.dataclient.remote.StocksRemoteDataSource;
import com.growfolio.synccore.cache.CacheStoreFactory;
import com.growfolio.synccore.invalidation.InvalidationContext;
import com.growfolio.synccore.invalidation.InvalidationRules;
import com.growfolio.synccore.resource.CachedResource;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

import static com.growfolio.dataclient.repository.CacheTargets.MARKET_STATUS_KEY;
import static com.growfolio.dataclient.repository.CacheTargets.WATCHLIST;
import static com.growfolio.dataclient.repository.CacheTargets.WATCHLIST_KEY;
import static com.growfolio.dataclient.repository.CacheTargets.WATCHLIST_QUOTES;
import static com.growfolio.dataclient.repository.CacheTargets.WATCHLIST_QUOTES_KEY;
import static com.growfolio.dataclient.repository.CacheTargets.normalizeSymbol;
import static com.growfolio.dataclient.repository.CacheTargets.quoteKey;
import static com.growfolio.dataclient.repository.CacheTargets.stockKey;

@Slf4j
public class CachedStocksRepository implements StocksRepository {

    private static final String DOMAIN = "stocks";

    private final StocksRemoteDataSource remote;
    private final InvalidationRules rules;
    private final MarketHoursCalculator marketHours;
    private final Clock clock;

    private final CachedResource<Stock> stocks;
    private final CachedResource<StockQuote> quotes;
    private final CachedResource<MarketHours> marketStatus;
    private final CachedResource<List<WatchlistItem>> watchlist;
    private final CachedResource<List<WatchlistItemWithQuote>> watchlistQuotes;

    public CachedStocksRepository(StocksRemoteDataSource remote, CacheStoreFactory stores, InvalidationRules rules,
                                  MarketHoursCalculator marketHours) {
        this.remote = remote;
        this.rules = rules;
        this.marketHours = marketHours;
        this.clock = stores.clock();
        this.stocks = stores.newResource(Freshness.STOCK);
        this.quotes = stores.newResource(Freshness.QUOTE);
        this.marketStatus = stores.newResource(Freshness.MARKET_STATUS);
        this.watchlist = stores.newResource(Freshness.WATCHLIST);
        this.watchlistQuotes = stores.newResource(Freshness.WATCHLIST_QUOTES);
        rules.register(WATCHLIST, watchlist);
        rules.register(WATCHLIST_QUOTES, watchlistQuotes);
    }

    // ==================== Market data ====================

    @Override
    public List<StockSearchResult> searchStocks(String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return remote.search(query.trim(), limit);
    }

    @Override
    public Stock getStock(String symbol) {
        String normalized = normalizeSymbol(symbol);
        return stocks.fetch(stockKey(normalized), () -> remote.getStock(normalized));
    }

    @Override
    public StockQuote getQuote(String symbol) {
        String normalized = normalizeSymbol(symbol);
        return quotes.fetch(quoteKey(normalized), () -> remote.getQuote(normalized));
    }

    @Override
    public List<StockQuote> getQuotes(Collection<String> symbols) {
        List<StockQuote> result = new ArrayList<>();
        for (String symbol : symbols) {
            try {
                result.add(getQuote(symbol));
            } catch (ApiException e) {
                log.warn("Skipping quote for {}: {}", symbol, e.getMessage());
            }
        }
        return result;
    }

    @Override
    public StockHistory getHistory(String symbol, HistoryPeriod period) {
        return remote.getHistory(normalizeSymbol(symbol), period);
    }

    @Override
    public MarketHours getMarketStatus() {
        try {
            return marketStatus.fetch(MARKET_STATUS_KEY, remote::getMarketStatus);
        } catch (ApiException e) {
            Instant now = clock.instant();
            log.warn("Market status unavailable ({}), using local NYSE calendar", e.getErrorCode());
            return marketHours.statusAt(now);
        }
    }

    @Override
    public StockOrder submitBuyOrder(String symbol, BigDecimal notional) {
        OrderRequest request = new OrderRequest(normalizeSymbol(symbol), OrderSide.BUY,
                DomainRules.requirePositive(notional));
        return mutation("submitBuyOrder", request.symbol(), () -> {
            StockOrder order = remote.submitOrder(request);
            rules.apply(DataMutation.SUBMIT_BUY_ORDER, InvalidationContext.of(InvalidationContext.ID, order.id()));
            log.info("Submitted buy order {} for {} {}", order.id(), notional, request.symbol());
            return order;
        });
    }

    // ==================== Watchlist ====================

    @Override
    public List<WatchlistItem> getWatchlist() {
        return watchlist.fetch(WATCHLIST_KEY, remote::listWatchlist);
    }

    @Override
    public WatchlistItem addToWatchlist(String symbol, String notes) {
        String normalized = normalizeSymbol(symbol);
        return mutation("addToWatchlist", normalized, () -> {
            WatchlistItem added = remote.addToWatchlist(new WatchlistRequest(normalized, notes));
            rules.apply(DataMutation.ADD_TO_WATCHLIST, InvalidationContext.builder()
                    .with(InvalidationContext.ID, normalized)
                    .merge(WATCHLIST, r -> r.merge(WATCHLIST_KEY, list -> ListMerges.appended(
                            ListMerges.removed(list, item -> normalized.equalsIgnoreCase(item.symbol())), added)))
                    .build());
            log.info("Added {} to watchlist", normalized);
            return added;
        });
    }

    @Override
    public void removeFromWatchlist(String symbol) {
        String normalized = normalizeSymbol(symbol);
        mutation("removeFromWatchlist", normalized, () -> {
            remote.removeFromWatchlist(normalized);
            rules.apply(DataMutation.REMOVE_FROM_WATCHLIST, InvalidationContext.builder()
                    .with(InvalidationContext.ID, normalized)
                    .merge(WATCHLIST, r -> r.merge(WATCHLIST_KEY,
                            list -> ListMerges.removed(list, item -> normalized.equalsIgnoreCase(item.symbol()))))
                    .build());
            log.info("Removed {} from watchlist", normalized);
            return null;
        });
    }

    @Override
    public boolean isInWatchlist(String symbol) {
        String normalized = normalizeSymbol(symbol);
        return getWatchlist().stream().anyMatch(item -> normalized.equalsIgnoreCase(item.symbol()));
    }

    @Override
    public List<WatchlistItemWithQuote> getWatchlistWithQuotes() {
        return watchlistQuotes.fetch(WATCHLIST_QUOTES_KEY, () -> getWatchlist().stream()
                .map(item -> new WatchlistItemWithQuote(item,
                        optional(() -> getStock(item.symbol()), item.symbol()),
                        optional(() -> getQuote(item.symbol()), item.symbol())))
                .sorted(Comparator.comparing((WatchlistItemWithQuote w) -> w.item().dateAdded(),
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList());
    }

    // ==================== Cache control ====================

    @Override
    public void invalidateCache() {
        stocks.invalidateAll();
        quotes.invalidateAll();
        marketStatus.invalidateAll();
        watchlist.invalidateAll();
        watchlistQuotes.invalidateAll();
    }

    @Override
    public void invalidateCache(String symbol) {
        String normalized = normalizeSymbol(symbol);
        stocks.invalidate(stockKey(normalized));
        quotes.invalidate(quoteKey(normalized));
        watchlistQuotes.invalidateAll();
    }

    // ==================== Internals ====================

    private <T> T optional(Supplier<T> lookup, String symbol) {
        try {
            return lookup.get();
        } catch (ApiException e) {
            log.warn("Watchlist entry {} shown without {}: {}", symbol, e.getErrorCode(), e.getMessage());
            return null;
        }
    }

    private <T> T mutation(String operation, String symbol, Supplier<T> call) {
        return LogContext.forOperation(DOMAIN, operation).and(LogContext.RESOURCE_ID, symbol).supply(call);
    }
}
