package com.growfolio.dataclient.remote;

/*
 * 09/24/2026 - 10:09 AM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.core.type.TypeReference;
import com.growfolio.common.model.InvestingTip;
import com.growfolio.common.model.PortfolioInsights;
import com.growfolio.common.model.StockExplanation;

import java.util.List;
import java.util.Map;

public class RestAiRemoteDataSource implements AiRemoteDataSource {

    private static final TypeReference<PortfolioInsights> INSIGHTS = new TypeReference<>() {};
    private static final TypeReference<StockExplanation> EXPLANATION = new TypeReference<>() {};
    private static final TypeReference<List<InvestingTip>> TIPS = new TypeReference<>() {};

    private final ApiClient api;

    public RestAiRemoteDataSource(ApiClient api) {
        this.api = api;
    }

    @Override
    public PortfolioInsights getInsights(boolean includeGoals) {
        return api.get(INSIGHTS, Map.of("include_goals", includeGoals), "/ai/insights");
    }

    @Override
    public PortfolioInsights getGoalInsights(String goalId) {
        return api.get(INSIGHTS, "/goals/{id}/insights", goalId);
    }

    @Override
    public StockExplanation explainStock(String symbol) {
        return api.get(EXPLANATION, "/ai/explain/{symbol}", symbol);
    }

    @Override
    public List<InvestingTip> getInvestingTips() {
        return api.get(TIPS, "/ai/tips");
    }
}
