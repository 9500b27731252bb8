package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 12:41 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.model.DcaSchedule;
import com.growfolio.common.model.Family;
import com.growfolio.common.model.FamilyInvite;
import com.growfolio.common.model.FundingBalance;
import com.growfolio.common.model.Goal;
import com.growfolio.common.model.Holding;
import com.growfolio.common.model.PortfolioInsights;
import com.growfolio.common.model.Portfolio;
import com.growfolio.common.model.ReceivedInvite;
import com.growfolio.common.model.Transfer;
import com.growfolio.common.model.User;
import com.growfolio.common.model.WatchlistItem;
import com.growfolio.common.model.WatchlistItemWithQuote;
import com.growfolio.synccore.cache.CacheKey;
import com.growfolio.synccore.invalidation.CacheTarget;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Names of the stores that take part in invalidation, and the keys used inside them.
 * Stores that no mutation touches (quotes, stock reference data, FX rate, tips, explanations) are not listed.
 */
public final class CacheTargets {

    private CacheTargets() {}

    public static final CacheTarget<List<Portfolio>> PORTFOLIOS = CacheTarget.named("portfolios");
    public static final CacheTarget<Portfolio> PORTFOLIO = CacheTarget.named("portfolio");
    public static final CacheTarget<List<Holding>> HOLDINGS = CacheTarget.named("holdings");
    public static final CacheTarget<Holding> HOLDING = CacheTarget.named("holding");

    public static final CacheTarget<List<Goal>> GOALS = CacheTarget.named("goals");
    public static final CacheTarget<Goal> GOAL = CacheTarget.named("goal");

    public static final CacheTarget<List<DcaSchedule>> DCA_SCHEDULES = CacheTarget.named("dca-schedules");
    public static final CacheTarget<DcaSchedule> DCA_SCHEDULE = CacheTarget.named("dca-schedule");

    public static final CacheTarget<Optional<Family>> FAMILY = CacheTarget.named("family");
    public static final CacheTarget<List<FamilyInvite>> PENDING_INVITES = CacheTarget.named("pending-invites");
    public static final CacheTarget<List<ReceivedInvite>> RECEIVED_INVITES = CacheTarget.named("received-invites");

    public static final CacheTarget<FundingBalance> FUNDING_BALANCE = CacheTarget.named("funding-balance");
    public static final CacheTarget<List<Transfer>> TRANSFERS = CacheTarget.named("transfers");
    public static final CacheTarget<Transfer> TRANSFER = CacheTarget.named("transfer");

    public static final CacheTarget<List<WatchlistItem>> WATCHLIST = CacheTarget.named("watchlist");
    public static final CacheTarget<List<WatchlistItemWithQuote>> WATCHLIST_QUOTES = CacheTarget.named("watchlist-quotes");

    public static final CacheTarget<User> USER = CacheTarget.named("user");

    public static final CacheTarget<PortfolioInsights> GOAL_INSIGHTS = CacheTarget.named("goal-insights");

    // ==================== Keys ====================

    public static final CacheKey PORTFOLIOS_KEY = CacheKey.singleton("portfolios");
    public static final CacheKey GOALS_KEY = CacheKey.singleton("goals");
    public static final CacheKey DCA_SCHEDULES_KEY = CacheKey.singleton("dca-schedules");
    public static final CacheKey FAMILY_KEY = CacheKey.singleton("family");
    public static final CacheKey PENDING_INVITES_KEY = CacheKey.singleton("pending-invites");
    public static final CacheKey RECEIVED_INVITES_KEY = CacheKey.singleton("received-invites");
    public static final CacheKey FUNDING_BALANCE_KEY = CacheKey.singleton("funding-balance");
    public static final CacheKey FX_RATE_KEY = CacheKey.singleton("fx-rate");
    public static final CacheKey TRANSFERS_KEY = CacheKey.singleton("transfers");
    public static final CacheKey MARKET_STATUS_KEY = CacheKey.singleton("market-status");
    public static final CacheKey WATCHLIST_KEY = CacheKey.singleton("watchlist");
    public static final CacheKey WATCHLIST_QUOTES_KEY = CacheKey.singleton("watchlist-quotes");
    public static final CacheKey USER_KEY = CacheKey.singleton("user");
    public static final CacheKey TIPS_KEY = CacheKey.singleton("investing-tips");

    public static CacheKey portfolioKey(String portfolioId) {
        return CacheKey.of("portfolio", portfolioId);
    }

    public static CacheKey holdingsKey(String portfolioId) {
        return CacheKey.of("holdings", portfolioId);
    }

    /** Scope of all single-holding entries of one portfolio. */
    public static CacheKey holdingScope(String portfolioId) {
        return CacheKey.of("holding", portfolioId);
    }

    public static CacheKey holdingKey(String portfolioId, String holdingId) {
        return CacheKey.of("holding", portfolioId, holdingId);
    }

    public static CacheKey goalKey(String goalId) {
        return CacheKey.of("goal", goalId);
    }

    public static CacheKey scheduleKey(String scheduleId) {
        return CacheKey.of("dca-schedule", scheduleId);
    }

    public static CacheKey transferKey(String transferId) {
        return CacheKey.of("transfer", transferId);
    }

    public static CacheKey stockKey(String symbol) {
        return CacheKey.of("stock", normalizeSymbol(symbol));
    }

    public static CacheKey quoteKey(String symbol) {
        return CacheKey.of("quote", normalizeSymbol(symbol));
    }

    public static CacheKey insightsKey(boolean includeGoals) {
        return CacheKey.of("ai-insights", Boolean.toString(includeGoals));
    }

    public static CacheKey goalInsightsKey(String goalId) {
        return CacheKey.of("goal-insights", goalId);
    }

    public static CacheKey explanationKey(String symbol) {
        return CacheKey.of("stock-explanation", normalizeSymbol(symbol));
    }

    /**
     * Ticker symbols are case-insensitive; every key and request uses the upper-case form.
     */
    public static String normalizeSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
