package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 12:58 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.dto.Requests.DcaScheduleRequest;
import com.growfolio.common.enums.DcaScheduleStatus;
import com.growfolio.common.logging.LogContext;
import com.growfolio.common.model.DcaSchedule;
import com.growfolio.common.model.Summaries.DcaSummary;
import com.growfolio.common.model.Summaries.UpcomingExecution;
import com.growfolio.dataclient.remote.DcaRemoteDataSource;
import com.growfolio.synccore.cache.CacheStoreFactory;
import com.growfolio.synccore.invalidation.InvalidationContext;
import com.growfolio.synccore.invalidation.InvalidationRules;
import com.growfolio.synccore.resource.CachedResource;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import static com.growfolio.dataclient.repository.CacheTargets.DCA_SCHEDULE;
import static com.growfolio.dataclient.repository.CacheTargets.DCA_SCHEDULES;
import static com.growfolio.dataclient.repository.CacheTargets.DCA_SCHEDULES_KEY;
import static com.growfolio.dataclient.repository.CacheTargets.scheduleKey;

@Slf4j
public class CachedDcaRepository implements DcaRepository {

    private static final String DOMAIN = "dca";

    private final DcaRemoteDataSource remote;
    private final InvalidationRules rules;
    private final Clock clock;

    private final CachedResource<List<DcaSchedule>> schedules;
    private final CachedResource<DcaSchedule> schedule;

    public CachedDcaRepository(DcaRemoteDataSource remote, CacheStoreFactory stores, InvalidationRules rules) {
        this.remote = remote;
        this.rules = rules;
        this.clock = stores.clock();
        this.schedules = stores.newResource(Freshness.DCA_SCHEDULES);
        this.schedule = stores.newResource(Freshness.DCA_SCHEDULE);
        rules.register(DCA_SCHEDULES, schedules);
        rules.register(DCA_SCHEDULE, schedule);
    }

    @Override
    public List<DcaSchedule> fetchSchedules() {
        return schedules.fetch(DCA_SCHEDULES_KEY, remote::listSchedules);
    }

    @Override
    public DcaSchedule fetchSchedule(String scheduleId) {
        return schedules.peek(DCA_SCHEDULES_KEY)
                .flatMap(list -> list.stream().filter(s -> Objects.equals(s.id(), scheduleId)).findFirst())
                .orElseGet(() -> schedule.fetch(scheduleKey(scheduleId), () -> remote.getSchedule(scheduleId)));
    }

    @Override
    public DcaSchedule createSchedule(DcaScheduleRequest request) {
        DomainRules.requirePositive(request.amount());
        return mutate(DataMutation.CREATE_SCHEDULE, null, () -> remote.createSchedule(request));
    }

    @Override
    public DcaSchedule updateSchedule(String scheduleId, DcaScheduleRequest request) {
        return mutate(DataMutation.UPDATE_SCHEDULE, scheduleId, () -> remote.updateSchedule(scheduleId, request));
    }

    @Override
    public DcaSchedule updateScheduleAmount(String scheduleId, BigDecimal amount) {
        DcaScheduleRequest request = DcaScheduleRequest.builder().amount(DomainRules.requirePositive(amount)).build();
        return mutate(DataMutation.UPDATE_SCHEDULE, scheduleId, () -> remote.updateSchedule(scheduleId, request));
    }

    @Override
    public DcaSchedule pauseSchedule(String scheduleId) {
        return mutate(DataMutation.PAUSE_SCHEDULE, scheduleId, () -> remote.pauseSchedule(scheduleId));
    }

    @Override
    public DcaSchedule resumeSchedule(String scheduleId) {
        return mutate(DataMutation.RESUME_SCHEDULE, scheduleId, () -> remote.resumeSchedule(scheduleId));
    }

    @Override
    public DcaSchedule cancelSchedule(String scheduleId) {
        DcaScheduleRequest request = DcaScheduleRequest.builder().isActive(false).build();
        return mutate(DataMutation.CANCEL_SCHEDULE, scheduleId, () -> remote.updateSchedule(scheduleId, request));
    }

    @Override
    public void deleteSchedule(String scheduleId) {
        mutate(DataMutation.DELETE_SCHEDULE, scheduleId, () -> {
            remote.deleteSchedule(scheduleId);
            return null;
        });
    }

    // ==================== Derived ====================

    @Override
    public List<DcaSchedule> activeSchedules() {
        Instant now = clock.instant();
        return cached().stream().filter(s -> s.status(now) == DcaScheduleStatus.ACTIVE).toList();
    }

    @Override
    public List<DcaSchedule> schedulesForSymbol(String symbol) {
        return cached().stream().filter(s -> s.stockSymbol() != null && s.stockSymbol().equalsIgnoreCase(symbol)).toList();
    }

    @Override
    public List<DcaSchedule> schedulesForPortfolio(String portfolioId) {
        return cached().stream().filter(s -> Objects.equals(s.portfolioId(), portfolioId)).toList();
    }

    @Override
    public List<UpcomingExecution> upcomingExecutions(int days) {
        Instant now = clock.instant();
        Instant horizon = now.plus(Duration.ofDays(days));
        return activeSchedules().stream()
                .filter(s -> s.nextExecutionDate() != null)
                .filter(s -> !s.nextExecutionDate().isBefore(now) && !s.nextExecutionDate().isAfter(horizon))
                .map(s -> new UpcomingExecution(s.id(), s.stockSymbol(), s.stockName(), s.amount(),
                        s.nextExecutionDate(), s.portfolioId()))
                .sorted(Comparator.comparing(UpcomingExecution::executionDate))
                .toList();
    }

    @Override
    public DcaSummary summary() {
        List<DcaSchedule> all = cached();
        List<DcaSchedule> active = activeSchedules();
        BigDecimal monthly = active.stream().map(DcaSchedule::annualAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(12), 2, RoundingMode.HALF_UP);
        BigDecimal invested = all.stream().map(DcaSchedule::totalInvested).filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        int executions = all.stream().mapToInt(DcaSchedule::executionCount).sum();
        return new DcaSummary(active.size(), monthly, invested, executions);
    }

    @Override
    public void invalidateCache() {
        schedules.invalidateAll();
        schedule.invalidateAll();
    }

    // ==================== Internals ====================

    private <T> T mutate(DataMutation kind, String scheduleId, Supplier<T> call) {
        return LogContext.forOperation(DOMAIN, kind.name()).and(LogContext.RESOURCE_ID, scheduleId).supply(() -> {
            T result = call.get();
            String id = scheduleId != null ? scheduleId : result instanceof DcaSchedule s ? s.id() : null;
            rules.apply(kind, InvalidationContext.of(InvalidationContext.ID, id));
            log.info("{} succeeded for schedule {}", kind, id);
            return result;
        });
    }

    private List<DcaSchedule> cached() {
        return schedules.current(DCA_SCHEDULES_KEY).orElse(List.of());
    }
}
