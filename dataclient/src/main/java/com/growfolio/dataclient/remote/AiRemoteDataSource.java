package com.growfolio.dataclient.remote;

/*
 * 09/24/2026 - 9:16 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.model.InvestingTip;
import com.growfolio.common.model.PortfolioInsights;
import com.growfolio.common.model.StockExplanation;

import java.util.List;

/**
 * Generated insights and explanations. Read only.
 */
public interface AiRemoteDataSource {

    PortfolioInsights getInsights(boolean includeGoals);

    PortfolioInsights getGoalInsights(String goalId);

    StockExplanation explainStock(String symbol);

    List<InvestingTip> getInvestingTips();
}
