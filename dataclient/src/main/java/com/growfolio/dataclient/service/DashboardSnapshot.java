package com.growfolio.dataclient.service;

/*
 * 09/28/2026 - 9:58 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.model.DcaSchedule;
import com.growfolio.common.model.Goal;
import com.growfolio.common.model.Portfolio;
import com.growfolio.common.model.Summaries.DcaSummary;
import com.growfolio.common.model.Summaries.GoalsSummary;
import com.growfolio.common.model.Summaries.PortfoliosSummary;
import com.growfolio.common.model.Summaries.UpcomingExecution;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Home screen data. A section that failed to load is empty (its summary {@code null}) and its error
 * message is listed in {@link #failures()} under the section name.
 */
@Builder
public record DashboardSnapshot(
        List<Portfolio> portfolios,
        PortfoliosSummary portfoliosSummary,
        List<Goal> goals,
        GoalsSummary goalsSummary,
        List<DcaSchedule> schedules,
        DcaSummary dcaSummary,
        List<UpcomingExecution> upcomingExecutions,
        Map<String, String> failures,
        Instant loadedAt) {

    public DashboardSnapshot {
        portfolios = portfolios != null ? List.copyOf(portfolios) : List.of();
        goals = goals != null ? List.copyOf(goals) : List.of();
        schedules = schedules != null ? List.copyOf(schedules) : List.of();
        upcomingExecutions = upcomingExecutions != null ? List.copyOf(upcomingExecutions) : List.of();
        failures = failures != null ? Map.copyOf(failures) : Map.of();
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
