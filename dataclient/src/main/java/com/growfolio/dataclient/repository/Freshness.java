package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 2:12 PM
 * @author Growfolio Engineering
 */

import com.growfolio.synccore.cache.FreshnessPolicy;

import java.time.Duration;

/**
 * Freshness window of every cache store. Fixed per store; callers cannot override them.
 */
public final class Freshness {

    private Freshness() {}

    private static final Duration FIVE_SECONDS = Duration.ofSeconds(5);
    private static final Duration THIRTY_SECONDS = Duration.ofSeconds(30);
    private static final Duration ONE_MINUTE = Duration.ofMinutes(1);
    private static final Duration TWO_MINUTES = Duration.ofMinutes(2);
    private static final Duration FIVE_MINUTES = Duration.ofMinutes(5);
    private static final Duration ONE_HOUR = Duration.ofHours(1);

    // ==================== Portfolio ====================
    public static final FreshnessPolicy PORTFOLIOS = FreshnessPolicy.of("portfolios", ONE_MINUTE);
    public static final FreshnessPolicy PORTFOLIO = FreshnessPolicy.of("portfolio", ONE_MINUTE);
    public static final FreshnessPolicy HOLDINGS = FreshnessPolicy.of("holdings", ONE_MINUTE);
    public static final FreshnessPolicy HOLDING = FreshnessPolicy.of("holding", ONE_MINUTE);

    // ==================== Goal ====================
    public static final FreshnessPolicy GOALS = FreshnessPolicy.of("goals", ONE_MINUTE);
    public static final FreshnessPolicy GOAL = FreshnessPolicy.of("goal", ONE_MINUTE);

    // ==================== DCA ====================
    public static final FreshnessPolicy DCA_SCHEDULES = FreshnessPolicy.of("dca-schedules", ONE_MINUTE);
    public static final FreshnessPolicy DCA_SCHEDULE = FreshnessPolicy.of("dca-schedule", ONE_MINUTE);

    // ==================== Family ====================
    public static final FreshnessPolicy FAMILY = FreshnessPolicy.of("family", TWO_MINUTES);
    public static final FreshnessPolicy PENDING_INVITES = FreshnessPolicy.of("pending-invites", TWO_MINUTES);
    public static final FreshnessPolicy RECEIVED_INVITES = FreshnessPolicy.of("received-invites", TWO_MINUTES);

    // ==================== Funding ====================
    public static final FreshnessPolicy FUNDING_BALANCE = FreshnessPolicy.of("funding-balance", THIRTY_SECONDS);
    /** Default only: each rate is fresh until its own expiry. */
    public static final FreshnessPolicy FX_RATE = FreshnessPolicy.of("fx-rate", THIRTY_SECONDS);
    public static final FreshnessPolicy TRANSFERS = FreshnessPolicy.of("transfers", ONE_MINUTE);
    public static final FreshnessPolicy TRANSFER = FreshnessPolicy.of("transfer", ONE_MINUTE);

    // ==================== Stocks ====================
    public static final FreshnessPolicy STOCK = FreshnessPolicy.of("stock", FIVE_MINUTES);
    public static final FreshnessPolicy QUOTE = FreshnessPolicy.of("quote", FIVE_SECONDS);
    public static final FreshnessPolicy MARKET_STATUS = FreshnessPolicy.of("market-status", ONE_MINUTE);
    public static final FreshnessPolicy WATCHLIST = FreshnessPolicy.of("watchlist", ONE_MINUTE);
    public static final FreshnessPolicy WATCHLIST_QUOTES = FreshnessPolicy.of("watchlist-quotes", ONE_MINUTE);

    // ==================== User ====================
    public static final FreshnessPolicy USER = FreshnessPolicy.of("user", FIVE_MINUTES);

    // ==================== AI ====================
    public static final FreshnessPolicy INSIGHTS = FreshnessPolicy.of("ai-insights", FIVE_MINUTES);
    public static final FreshnessPolicy GOAL_INSIGHTS = FreshnessPolicy.of("goal-insights", FIVE_MINUTES);
    public static final FreshnessPolicy EXPLANATIONS = FreshnessPolicy.of("stock-explanations", FIVE_MINUTES);
    public static final FreshnessPolicy TIPS = FreshnessPolicy.of("investing-tips", ONE_HOUR);
}
