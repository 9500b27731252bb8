package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 2:36 PM
 * @author Growfolio Engineering
 */

import com.growfolio.synccore.cache.CacheKey;
import com.growfolio.synccore.invalidation.InvalidationContext;
import com.growfolio.synccore.invalidation.InvalidationEdge;
import com.growfolio.synccore.invalidation.InvalidationRules;
import com.growfolio.synccore.metrics.SyncMetrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static com.growfolio.dataclient.repository.CacheTargets.*;
import static com.growfolio.dataclient.repository.DataMutation.*;
import static com.growfolio.synccore.invalidation.InvalidationEdge.clearCollection;
import static com.growfolio.synccore.invalidation.InvalidationEdge.clearSingleton;
import static com.growfolio.synccore.invalidation.InvalidationEdge.removeKey;

/**
 * The invalidation edges of every {@link DataMutation}.
 * <p>
 * Write merges are not declared here: each repository passes its merge in the {@link InvalidationContext}
 * of the mutation. Edges read the mutated resource's id from {@link InvalidationContext#ID}, the owning
 * portfolio from {@link InvalidationContext#PARENT_ID} and, for cash transfers, the receiving portfolio from
 * {@link InvalidationContext#TARGET_PARENT_ID}.
 */
public final class InvalidationTable {

    private InvalidationTable() {}

    public static InvalidationRules rules(SyncMetrics metrics) {
        InvalidationRules.Builder builder = InvalidationRules.builder().metrics(metrics);

        // ==================== Portfolio ====================
        builder.on(CREATE_PORTFOLIO)
                .on(UPDATE_PORTFOLIO,
                        removeKey(UPDATE_PORTFOLIO, PORTFOLIO, byId(CacheTargets::portfolioKey)))
                .on(SET_DEFAULT_PORTFOLIO,
                        clearSingleton(SET_DEFAULT_PORTFOLIO, PORTFOLIOS, PORTFOLIOS_KEY),
                        clearCollection(SET_DEFAULT_PORTFOLIO, PORTFOLIO))
                .on(DELETE_PORTFOLIO,
                        removeKey(DELETE_PORTFOLIO, PORTFOLIO, byId(CacheTargets::portfolioKey)),
                        removeKey(DELETE_PORTFOLIO, HOLDINGS, byId(CacheTargets::holdingsKey)),
                        removeKey(DELETE_PORTFOLIO, HOLDING, byId(CacheTargets::holdingScope)));
        for (DataMutation kind : List.of(ADD_HOLDING, UPDATE_HOLDING, REMOVE_HOLDING, ADD_LEDGER_ENTRY,
                UPDATE_LEDGER_ENTRY, DELETE_LEDGER_ENTRY, DEPOSIT_CASH, WITHDRAW_CASH)) {
            builder.on(kind, portfolioScoped(kind, InvalidationContext.PARENT_ID).toArray(InvalidationEdge[]::new));
        }
        List<InvalidationEdge<?>> transfer = new ArrayList<>(portfolioScoped(TRANSFER_CASH, InvalidationContext.PARENT_ID));
        transfer.addAll(portfolioScoped(TRANSFER_CASH, InvalidationContext.TARGET_PARENT_ID));
        // both portfolios clear the same list; keep one edge for it
        transfer.removeIf(edge -> edge.target().equals(PORTFOLIOS));
        transfer.add(clearSingleton(TRANSFER_CASH, PORTFOLIOS, PORTFOLIOS_KEY));
        builder.on(TRANSFER_CASH, transfer.toArray(InvalidationEdge[]::new));

        // ==================== Goal ====================
        builder.on(CREATE_GOAL);
        for (DataMutation kind : List.of(UPDATE_GOAL, ARCHIVE_GOAL, UNARCHIVE_GOAL, LINK_GOAL, UNLINK_GOAL)) {
            builder.on(kind, removeKey(kind, GOAL, byId(CacheTargets::goalKey)));
        }
        builder.on(UPDATE_GOAL_PROGRESS,
                        removeKey(UPDATE_GOAL_PROGRESS, GOAL, byId(CacheTargets::goalKey)),
                        removeKey(UPDATE_GOAL_PROGRESS, GOAL_INSIGHTS, byId(CacheTargets::goalInsightsKey)))
                .on(DELETE_GOAL,
                        removeKey(DELETE_GOAL, GOAL, byId(CacheTargets::goalKey)),
                        removeKey(DELETE_GOAL, GOAL_INSIGHTS, byId(CacheTargets::goalInsightsKey)));

        // ==================== DCA ====================
        // the list also feeds the by-symbol and by-portfolio views, so it is dropped rather than merged
        for (DataMutation kind : List.of(CREATE_SCHEDULE, UPDATE_SCHEDULE, PAUSE_SCHEDULE, RESUME_SCHEDULE,
                CANCEL_SCHEDULE, DELETE_SCHEDULE)) {
            builder.on(kind,
                    clearSingleton(kind, DCA_SCHEDULES, DCA_SCHEDULES_KEY),
                    removeKey(kind, DCA_SCHEDULE, byId(CacheTargets::scheduleKey)));
        }

        // ==================== Family ====================
        builder.on(CREATE_FAMILY, clearSingleton(CREATE_FAMILY, USER, USER_KEY))
                .on(UPDATE_FAMILY)
                .on(DELETE_FAMILY,
                        clearSingleton(DELETE_FAMILY, FAMILY, FAMILY_KEY),
                        clearSingleton(DELETE_FAMILY, USER, USER_KEY))
                .on(LEAVE_FAMILY,
                        clearSingleton(LEAVE_FAMILY, FAMILY, FAMILY_KEY),
                        clearSingleton(LEAVE_FAMILY, USER, USER_KEY))
                .on(ACCEPT_INVITE,
                        clearSingleton(ACCEPT_INVITE, FAMILY, FAMILY_KEY),
                        clearSingleton(ACCEPT_INVITE, RECEIVED_INVITES, RECEIVED_INVITES_KEY),
                        clearSingleton(ACCEPT_INVITE, USER, USER_KEY))
                .on(DECLINE_INVITE,
                        clearSingleton(DECLINE_INVITE, FAMILY, FAMILY_KEY),
                        clearSingleton(DECLINE_INVITE, RECEIVED_INVITES, RECEIVED_INVITES_KEY));
        for (DataMutation kind : List.of(INVITE_MEMBER, RESEND_INVITE, CANCEL_INVITE)) {
            builder.on(kind,
                    clearSingleton(kind, FAMILY, FAMILY_KEY),
                    clearSingleton(kind, PENDING_INVITES, PENDING_INVITES_KEY));
        }
        for (DataMutation kind : List.of(UPDATE_MEMBER_ROLE, UPDATE_MEMBER_PRIVACY, REMOVE_MEMBER)) {
            builder.on(kind, clearSingleton(kind, FAMILY, FAMILY_KEY));
        }

        // ==================== Funding ====================
        for (DataMutation kind : List.of(INITIATE_DEPOSIT, INITIATE_WITHDRAWAL)) {
            builder.on(kind, clearSingleton(kind, FUNDING_BALANCE, FUNDING_BALANCE_KEY));
        }
        for (DataMutation kind : List.of(CONFIRM_DEPOSIT, CONFIRM_WITHDRAWAL, CANCEL_TRANSFER)) {
            builder.on(kind,
                    clearSingleton(kind, FUNDING_BALANCE, FUNDING_BALANCE_KEY),
                    removeKey(kind, TRANSFER, byId(CacheTargets::transferKey)));
        }

        // ==================== Stocks ====================
        // which holdings an order touches is not known locally
        builder.on(SUBMIT_BUY_ORDER,
                        clearCollection(SUBMIT_BUY_ORDER, HOLDINGS),
                        clearCollection(SUBMIT_BUY_ORDER, HOLDING),
                        clearCollection(SUBMIT_BUY_ORDER, PORTFOLIO),
                        clearSingleton(SUBMIT_BUY_ORDER, PORTFOLIOS, PORTFOLIOS_KEY),
                        clearSingleton(SUBMIT_BUY_ORDER, FUNDING_BALANCE, FUNDING_BALANCE_KEY))
                .on(ADD_TO_WATCHLIST, clearSingleton(ADD_TO_WATCHLIST, WATCHLIST_QUOTES, WATCHLIST_QUOTES_KEY))
                .on(REMOVE_FROM_WATCHLIST,
                        clearSingleton(REMOVE_FROM_WATCHLIST, WATCHLIST_QUOTES, WATCHLIST_QUOTES_KEY));

        // ==================== User ====================
        for (DataMutation kind : List.of(UPDATE_PROFILE, UPDATE_PREFERENCES, DELETE_ACCOUNT)) {
            builder.on(kind, clearSingleton(kind, USER, USER_KEY));
        }

        return builder.build();
    }

    /**
     * Holdings, single holdings and aggregates of the portfolio named by {@code attribute}.
     */
    private static List<InvalidationEdge<?>> portfolioScoped(DataMutation kind, String attribute) {
        return List.of(
                removeKey(kind, HOLDINGS, by(attribute, CacheTargets::holdingsKey)),
                removeKey(kind, HOLDING, by(attribute, CacheTargets::holdingScope)),
                removeKey(kind, PORTFOLIO, by(attribute, CacheTargets::portfolioKey)),
                clearSingleton(kind, PORTFOLIOS, PORTFOLIOS_KEY));
    }

    private static Function<InvalidationContext, Optional<CacheKey>> byId(Function<String, CacheKey> key) {
        return by(InvalidationContext.ID, key);
    }

    private static Function<InvalidationContext, Optional<CacheKey>> by(String attribute, Function<String, CacheKey> key) {
        return context -> context.get(attribute).map(key);
    }
}
