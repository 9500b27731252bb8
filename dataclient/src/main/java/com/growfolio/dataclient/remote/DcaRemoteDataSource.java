package com.growfolio.dataclient.remote;

/*
 * 09/24/2026 - 9:34 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.dto.Requests.DcaScheduleRequest;
import com.growfolio.common.model.DcaSchedule;

import java.util.List;

/**
 * Recurring investment schedules on the Growfolio API.
 */
public interface DcaRemoteDataSource {

    List<DcaSchedule> listSchedules();

    DcaSchedule getSchedule(String scheduleId);

    DcaSchedule createSchedule(DcaScheduleRequest request);

    DcaSchedule updateSchedule(String scheduleId, DcaScheduleRequest request);

    DcaSchedule pauseSchedule(String scheduleId);

    DcaSchedule resumeSchedule(String scheduleId);

    void deleteSchedule(String scheduleId);
}
