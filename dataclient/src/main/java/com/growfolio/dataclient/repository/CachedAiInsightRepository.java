package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 12:51 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.model.InvestingTip;
import com.growfolio.common.model.PortfolioInsights;
import com.growfolio.common.model.StockExplanation;
import com.growfolio.dataclient.remote.AiRemoteDataSource;
import com.growfolio.synccore.cache.CacheStoreFactory;
import com.growfolio.synccore.invalidation.InvalidationRules;
import com.growfolio.synccore.resource.CachedResource;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

import static com.growfolio.dataclient.repository.CacheTargets.GOAL_INSIGHTS;
import static com.growfolio.dataclient.repository.CacheTargets.TIPS_KEY;
import static com.growfolio.dataclient.repository.CacheTargets.explanationKey;
import static com.growfolio.dataclient.repository.CacheTargets.goalInsightsKey;
import static com.growfolio.dataclient.repository.CacheTargets.insightsKey;
import static com.growfolio.dataclient.repository.CacheTargets.normalizeSymbol;

@Slf4j
public class CachedAiInsightRepository implements AiInsightRepository {

    private final AiRemoteDataSource remote;

    private final CachedResource<PortfolioInsights> insights;
    private final CachedResource<PortfolioInsights> goalInsights;
    private final CachedResource<StockExplanation> explanations;
    private final CachedResource<List<InvestingTip>> tips;

    public CachedAiInsightRepository(AiRemoteDataSource remote, CacheStoreFactory stores, InvalidationRules rules) {
        this.remote = remote;
        this.insights = stores.newResource(Freshness.INSIGHTS);
        this.goalInsights = stores.newResource(Freshness.GOAL_INSIGHTS);
        this.explanations = stores.newResource(Freshness.EXPLANATIONS);
        this.tips = stores.newResource(Freshness.TIPS);
        rules.register(GOAL_INSIGHTS, goalInsights);
    }

    @Override
    public PortfolioInsights fetchInsights(boolean includeGoals) {
        return insights.fetch(insightsKey(includeGoals), () -> remote.getInsights(includeGoals));
    }

    @Override
    public PortfolioInsights fetchGoalInsights(String goalId) {
        return goalInsights.fetch(goalInsightsKey(goalId), () -> remote.getGoalInsights(goalId));
    }

    @Override
    public StockExplanation fetchStockExplanation(String symbol) {
        String normalized = normalizeSymbol(symbol);
        return explanations.fetch(explanationKey(normalized), () -> remote.explainStock(normalized));
    }

    @Override
    public List<InvestingTip> fetchInvestingTips() {
        return tips.fetch(TIPS_KEY, remote::getInvestingTips);
    }

    @Override
    public void clearCache() {
        clearInsightsCache();
        explanations.invalidateAll();
        tips.invalidateAll();
    }

    @Override
    public void clearInsightsCache() {
        insights.invalidateAll();
        goalInsights.invalidateAll();
        log.debug("Cleared AI insight caches");
    }
}
