package com.growfolio.dataclient.remote;

/*
 * 09/24/2026 - 10:34 AM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.core.type.TypeReference;
import com.growfolio.common.dto.Requests.GoalRequest;
import com.growfolio.common.model.Goal;
import com.growfolio.common.model.Page;

import java.util.Map;

public class RestGoalRemoteDataSource implements GoalRemoteDataSource {

    private static final TypeReference<Page<Goal>> GOAL_PAGE = new TypeReference<>() {};
    private static final TypeReference<Goal> GOAL = new TypeReference<>() {};

    private final ApiClient api;

    public RestGoalRemoteDataSource(ApiClient api) {
        this.api = api;
    }

    @Override
    public Page<Goal> listGoals(int page, int limit, boolean includeArchived) {
        return api.get(GOAL_PAGE, Map.of("page", page, "limit", limit, "include_archived", includeArchived), "/goals");
    }

    @Override
    public Goal getGoal(String goalId) {
        return api.get(GOAL, "/goals/{id}", goalId);
    }

    @Override
    public Goal createGoal(GoalRequest request) {
        return api.post(GOAL, request, "/goals");
    }

    @Override
    public Goal updateGoal(String goalId, GoalRequest request) {
        return api.patch(GOAL, request, "/goals/{id}", goalId);
    }

    @Override
    public void deleteGoal(String goalId) {
        api.delete("/goals/{id}", goalId);
    }
}
