package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 12:33 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.model.InvestingTip;
import com.growfolio.common.model.PortfolioInsights;
import com.growfolio.common.model.StockExplanation;

import java.util.List;

/**
 * Read-only access to generated insights. Goal insights are dropped whenever the goal's progress changes
 * or the goal is deleted.
 */
public interface AiInsightRepository {

    PortfolioInsights fetchInsights(boolean includeGoals);

    PortfolioInsights fetchGoalInsights(String goalId);

    StockExplanation fetchStockExplanation(String symbol);

    List<InvestingTip> fetchInvestingTips();

    /** Drops every AI store, tips included. */
    void clearCache();

    /** Drops portfolio and goal insights only. */
    void clearInsightsCache();
}
