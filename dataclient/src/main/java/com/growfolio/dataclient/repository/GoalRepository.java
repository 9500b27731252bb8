package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 2:26 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.dto.Requests.GoalRequest;
import com.growfolio.common.enums.GoalCategory;
import com.growfolio.common.model.Goal;
import com.growfolio.common.model.Page;
import com.growfolio.common.model.Summaries.GoalsSummary;

import java.math.BigDecimal;
import java.util.List;

/**
 * Savings goals. Writes are merged into the cached goal list; the list holds archived goals too and
 * {@code includeArchived} filters it.
 */
public interface GoalRepository {

    List<Goal> fetchGoals(boolean includeArchived);

    /**
     * One page straight from the API, not cached.
     */
    Page<Goal> fetchGoalsPage(int page, int limit, boolean includeArchived);

    Goal fetchGoal(String goalId);

    Goal createGoal(GoalRequest request);

    Goal updateGoal(String goalId, GoalRequest request);

    Goal updateGoalProgress(String goalId, BigDecimal currentAmount);

    Goal archiveGoal(String goalId);

    Goal unarchiveGoal(String goalId);

    Goal linkGoalToPortfolio(String goalId, String portfolioId);

    Goal unlinkGoalFromPortfolio(String goalId);

    void deleteGoal(String goalId);

    /**
     * Deletes one by one; stops at the first failure, leaving the goals deleted so far removed from cache.
     */
    void deleteGoals(List<String> goalIds);

    // ==================== Derived ====================

    List<Goal> goalsByCategory(GoalCategory category);

    List<Goal> goalsLinkedToPortfolio(String portfolioId);

    GoalsSummary summary();

    void invalidateCache();

    void invalidateCache(String goalId);
}
