package com.growfolio.dataclient.remote;

/*
 * 09/24/2026 - 9:51 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.dto.Requests.GoalRequest;
import com.growfolio.common.model.Goal;
import com.growfolio.common.model.Page;

public interface GoalRemoteDataSource {

    Page<Goal> listGoals(int page, int limit, boolean includeArchived);

    Goal getGoal(String goalId);

    Goal createGoal(GoalRequest request);

    Goal updateGoal(String goalId, GoalRequest request);

    void deleteGoal(String goalId);
}
