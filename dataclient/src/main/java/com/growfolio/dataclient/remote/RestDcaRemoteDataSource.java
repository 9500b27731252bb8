package com.growfolio.dataclient.remote;

/*
 * 09/24/2026 - 10:16 AM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.core.type.TypeReference;
import com.growfolio.common.dto.Requests.DcaScheduleRequest;
import com.growfolio.common.model.DcaSchedule;

import java.util.List;
import java.util.Map;

public class RestDcaRemoteDataSource implements DcaRemoteDataSource {

    private static final TypeReference<List<DcaSchedule>> SCHEDULES = new TypeReference<>() {};
    private static final TypeReference<DcaSchedule> SCHEDULE = new TypeReference<>() {};

    private final ApiClient api;

    public RestDcaRemoteDataSource(ApiClient api) {
        this.api = api;
    }

    @Override
    public List<DcaSchedule> listSchedules() {
        return api.get(SCHEDULES, "/dca/schedules");
    }

    @Override
    public DcaSchedule getSchedule(String scheduleId) {
        return api.get(SCHEDULE, "/dca/schedules/{id}", scheduleId);
    }

    @Override
    public DcaSchedule createSchedule(DcaScheduleRequest request) {
        return api.post(SCHEDULE, request, "/dca/schedules");
    }

    @Override
    public DcaSchedule updateSchedule(String scheduleId, DcaScheduleRequest request) {
        return api.patch(SCHEDULE, request, "/dca/schedules/{id}", scheduleId);
    }

    @Override
    public DcaSchedule pauseSchedule(String scheduleId) {
        return api.post(SCHEDULE, Map.of(), "/dca/schedules/{id}/pause", scheduleId);
    }

    @Override
    public DcaSchedule resumeSchedule(String scheduleId) {
        return api.post(SCHEDULE, Map.of(), "/dca/schedules/{id}/resume", scheduleId);
    }

    @Override
    public void deleteSchedule(String scheduleId) {
        api.delete("/dca/schedules/{id}", scheduleId);
    }
}
