package com.growfolio.common.model;

/*
 * 09/18/2026 - 10:53 AM
 * @author Growfolio Engineering
 */

import java.time.Instant;
import java.util.List;

/**
 * AI generated insights for the user's portfolios, or for a single goal.
 */
public record PortfolioInsights(List<AiInsight> insights, Instant generatedAt, Integer healthScore, String summary) {

    public PortfolioInsights {
        insights = insights != null ? List.copyOf(insights) : List.of();
    }
}
