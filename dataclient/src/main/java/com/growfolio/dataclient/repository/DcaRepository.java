package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 1:51 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.dto.Requests.DcaScheduleRequest;
import com.growfolio.common.model.DcaSchedule;
import com.growfolio.common.model.Summaries.DcaSummary;
import com.growfolio.common.model.Summaries.UpcomingExecution;

import java.math.BigDecimal;
import java.util.List;

/**
 * Recurring investment schedules.
 * <p>
 * Every schedule mutation drops the cached schedule list, so the next {@link #fetchSchedules()} returns the
 * server's state after the change.
 */
public interface DcaRepository {

    List<DcaSchedule> fetchSchedules();

    DcaSchedule fetchSchedule(String scheduleId);

    DcaSchedule createSchedule(DcaScheduleRequest request);

    DcaSchedule updateSchedule(String scheduleId, DcaScheduleRequest request);

    DcaSchedule updateScheduleAmount(String scheduleId, BigDecimal amount);

    DcaSchedule pauseSchedule(String scheduleId);

    DcaSchedule resumeSchedule(String scheduleId);

    /**
     * Deactivate the schedule; it stays listed as completed.
     */
    DcaSchedule cancelSchedule(String scheduleId);

    void deleteSchedule(String scheduleId);

    // ==================== Derived ====================

    List<DcaSchedule> activeSchedules();

    List<DcaSchedule> schedulesForSymbol(String symbol);

    List<DcaSchedule> schedulesForPortfolio(String portfolioId);

    List<UpcomingExecution> upcomingExecutions(int days);

    DcaSummary summary();

    void invalidateCache();
}
