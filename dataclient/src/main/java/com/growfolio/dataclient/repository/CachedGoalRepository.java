package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 1:16 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.dto.Requests.GoalRequest;
import com.growfolio.common.enums.GoalCategory;
import com.growfolio.common.logging.LogContext;
import com.growfolio.common.model.Goal;
import com.growfolio.common.model.Page;
import com.growfolio.common.model.Summaries.GoalsSummary;
import com.growfolio.dataclient.remote.GoalRemoteDataSource;
import com.growfolio.synccore.cache.CacheStoreFactory;
import com.growfolio.synccore.invalidation.InvalidationContext;
import com.growfolio.synccore.invalidation.InvalidationRules;
import com.growfolio.synccore.resource.CachedResource;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

import static com.growfolio.dataclient.repository.CacheTargets.GOAL;
import static com.growfolio.dataclient.repository.CacheTargets.GOALS;
import static com.growfolio.dataclient.repository.CacheTargets.GOALS_KEY;
import static com.growfolio.dataclient.repository.CacheTargets.goalKey;

@Slf4j
public class CachedGoalRepository implements GoalRepository {

    private static final String DOMAIN = "goal";

    private final GoalRemoteDataSource remote;
    private final InvalidationRules rules;
    private final int maxPageSize;

    private final CachedResource<List<Goal>> goals;
    private final CachedResource<Goal> goal;

    public CachedGoalRepository(GoalRemoteDataSource remote, CacheStoreFactory stores, InvalidationRules rules,
                                int maxPageSize) {
        this.remote = remote;
        this.rules = rules;
        this.maxPageSize = maxPageSize;
        this.goals = stores.newResource(Freshness.GOALS);
        this.goal = stores.newResource(Freshness.GOAL);
        rules.register(GOALS, goals);
        rules.register(GOAL, goal);
    }

    @Override
    public List<Goal> fetchGoals(boolean includeArchived) {
        List<Goal> all = goals.fetch(GOALS_KEY, () -> remote.listGoals(1, maxPageSize, true).data());
        return includeArchived ? all : all.stream().filter(g -> !g.isArchived()).toList();
    }

    @Override
    public Page<Goal> fetchGoalsPage(int page, int limit, boolean includeArchived) {
        return remote.listGoals(Math.max(1, page), Math.max(1, Math.min(limit, maxPageSize)), includeArchived);
    }

    @Override
    public Goal fetchGoal(String goalId) {
        return goals.peek(GOALS_KEY)
                .flatMap(list -> list.stream().filter(g -> Objects.equals(g.id(), goalId)).findFirst())
                .orElseGet(() -> goal.fetch(goalKey(goalId), () -> remote.getGoal(goalId)));
    }

    @Override
    public Goal createGoal(GoalRequest request) {
        return LogContext.forOperation(DOMAIN, "createGoal").supply(() -> {
            Goal created = remote.createGoal(request);
            rules.apply(DataMutation.CREATE_GOAL, InvalidationContext.builder()
                    .with(InvalidationContext.ID, created.id())
                    .merge(GOALS, r -> r.merge(GOALS_KEY, list -> ListMerges.appended(list, created)))
                    .build());
            log.info("Created goal {} ({})", created.id(), created.name());
            return created;
        });
    }

    @Override
    public Goal updateGoal(String goalId, GoalRequest request) {
        return update(DataMutation.UPDATE_GOAL, goalId, request);
    }

    @Override
    public Goal updateGoalProgress(String goalId, BigDecimal currentAmount) {
        return update(DataMutation.UPDATE_GOAL_PROGRESS, goalId,
                GoalRequest.builder().currentAmount(currentAmount).build());
    }

    @Override
    public Goal archiveGoal(String goalId) {
        return update(DataMutation.ARCHIVE_GOAL, goalId, GoalRequest.builder().isArchived(true).build());
    }

    @Override
    public Goal unarchiveGoal(String goalId) {
        return update(DataMutation.UNARCHIVE_GOAL, goalId, GoalRequest.builder().isArchived(false).build());
    }

    @Override
    public Goal linkGoalToPortfolio(String goalId, String portfolioId) {
        return update(DataMutation.LINK_GOAL, goalId, GoalRequest.builder().linkedPortfolioId(portfolioId).build());
    }

    @Override
    public Goal unlinkGoalFromPortfolio(String goalId) {
        // an empty id clears the link; a null field would be left out of the request
        return update(DataMutation.UNLINK_GOAL, goalId, GoalRequest.builder().linkedPortfolioId("").build());
    }

    @Override
    public void deleteGoal(String goalId) {
        LogContext.forOperation(DOMAIN, "deleteGoal").and(LogContext.RESOURCE_ID, goalId).run(() -> {
            remote.deleteGoal(goalId);
            rules.apply(DataMutation.DELETE_GOAL, InvalidationContext.builder()
                    .with(InvalidationContext.ID, goalId)
                    .merge(GOALS, r -> r.merge(GOALS_KEY, list -> ListMerges.removed(list, g -> goalId.equals(g.id()))))
                    .build());
            log.info("Deleted goal {}", goalId);
        });
    }

    @Override
    public void deleteGoals(List<String> goalIds) {
        goalIds.forEach(this::deleteGoal);
    }

    // ==================== Derived ====================

    @Override
    public List<Goal> goalsByCategory(GoalCategory category) {
        return active().stream().filter(g -> g.category() == category).toList();
    }

    @Override
    public List<Goal> goalsLinkedToPortfolio(String portfolioId) {
        return active().stream().filter(g -> Objects.equals(g.linkedPortfolioId(), portfolioId)).toList();
    }

    @Override
    public GoalsSummary summary() {
        List<Goal> active = active();
        int achieved = (int) active.stream().filter(Goal::isAchieved).count();
        BigDecimal target = active.stream().map(Goal::targetAmount).filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal current = active.stream().map(Goal::currentAmount).filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new GoalsSummary(active.size(), achieved, active.size() - achieved, target, current);
    }

    @Override
    public void invalidateCache() {
        goals.invalidateAll();
        goal.invalidateAll();
    }

    @Override
    public void invalidateCache(String goalId) {
        goal.invalidate(goalKey(goalId));
    }

    // ==================== Internals ====================

    private Goal update(DataMutation kind, String goalId, GoalRequest request) {
        return LogContext.forOperation(DOMAIN, kind.name()).and(LogContext.RESOURCE_ID, goalId).supply(() -> {
            Goal updated = remote.updateGoal(goalId, request);
            rules.apply(kind, InvalidationContext.builder()
                    .with(InvalidationContext.ID, goalId)
                    .merge(GOALS, r -> r.merge(GOALS_KEY, list -> ListMerges.upserted(list, updated, Goal::id)))
                    .build());
            log.info("{} applied to goal {}", kind, goalId);
            return updated;
        });
    }

    private List<Goal> active() {
        return goals.current(GOALS_KEY).orElse(List.of()).stream().filter(g -> !g.isArchived()).toList();
    }
}
