package com.growfolio.dataclient.repository;

import com.growfolio.common.dto.Requests.DcaScheduleRequest;
import com.growfolio.common.enums.DcaFrequency;
import com.growfolio.common.exception.ApiExceptions.DomainRuleViolationException;
import com.growfolio.common.model.DcaSchedule;
import com.growfolio.common.model.Summaries.DcaSummary;
import com.growfolio.common.model.Summaries.UpcomingExecution;
import com.growfolio.dataclient.remote.DcaRemoteDataSource;
import com.growfolio.dataclient.support.SyncFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CachedDcaRepositoryTest {

    @Mock
    private DcaRemoteDataSource remote;

    private SyncFixture fixture;
    private CachedDcaRepository repository;

    @BeforeEach
    void setUp() {
        fixture = new SyncFixture();
        repository = new CachedDcaRepository(remote, fixture.stores(), fixture.rules());
    }

    private DcaSchedule schedule(String id, String symbol, boolean paused, Instant next) {
        return DcaSchedule.builder().id(id).stockSymbol(symbol).amount(new BigDecimal("100"))
                .frequency(DcaFrequency.MONTHLY).isActive(true).isPaused(paused).nextExecutionDate(next)
                .totalInvested(new BigDecimal("300")).executionCount(3).portfolioId("p1").build();
    }

    @Test
    @DisplayName("Pausing drops the schedule list so the next read shows the paused state")
    void pauseInvalidatesList() {
        Instant next = fixture.now().plus(Duration.ofDays(3));
        when(remote.listSchedules()).thenReturn(
                List.of(schedule("s1", "AAPL", false, next)),
                List.of(schedule("s1", "AAPL", true, next)));
        when(remote.pauseSchedule("s1")).thenReturn(schedule("s1", "AAPL", true, next));
        assertThat(repository.activeSchedules()).isEmpty();
        repository.fetchSchedules();
        assertThat(repository.activeSchedules()).hasSize(1);

        repository.pauseSchedule("s1");

        assertThat(repository.activeSchedules()).isEmpty();
        assertThat(repository.fetchSchedules()).singleElement().extracting(DcaSchedule::isPaused).isEqualTo(true);
        verify(remote, times(2)).listSchedules();
    }

    @Test
    @DisplayName("Cancel is sent as an update that deactivates the schedule")
    void cancelDeactivates() {
        when(remote.updateSchedule(eq("s1"), any())).thenReturn(schedule("s1", "AAPL", false, null));

        repository.cancelSchedule("s1");

        ArgumentCaptor<DcaScheduleRequest> request = ArgumentCaptor.forClass(DcaScheduleRequest.class);
        verify(remote).updateSchedule(eq("s1"), request.capture());
        assertThat(request.getValue().isActive()).isFalse();
    }

    @Test
    @DisplayName("Zero amount is rejected before any request")
    void zeroAmountRejected() {
        assertThatThrownBy(() -> repository.updateScheduleAmount("s1", BigDecimal.ZERO))
                .isInstanceOf(DomainRuleViolationException.class);
        verify(remote, never()).updateSchedule(any(), any());
    }

    @Test
    @DisplayName("Upcoming executions are limited to the horizon and sorted by date")
    void upcomingWithinHorizon() {
        Instant now = fixture.now();
        when(remote.listSchedules()).thenReturn(List.of(
                schedule("late", "MSFT", false, now.plus(Duration.ofDays(20))),
                schedule("soon", "AAPL", false, now.plus(Duration.ofDays(2))),
                schedule("sooner", "TSLA", false, now.plus(Duration.ofDays(1))),
                schedule("paused", "NVDA", true, now.plus(Duration.ofDays(1)))));
        repository.fetchSchedules();

        List<UpcomingExecution> upcoming = repository.upcomingExecutions(7);

        assertThat(upcoming).extracting(UpcomingExecution::scheduleId).containsExactly("sooner", "soon");
    }

    @Test
    @DisplayName("Summary converts active schedules to a monthly amount")
    void summary() {
        Instant next = fixture.now().plus(Duration.ofDays(5));
        when(remote.listSchedules()).thenReturn(List.of(
                schedule("s1", "AAPL", false, next),
                schedule("s2", "MSFT", true, next)));
        repository.fetchSchedules();

        DcaSummary summary = repository.summary();

        assertThat(summary.activeSchedules()).isEqualTo(1);
        assertThat(summary.totalMonthlyInvestment()).isEqualByComparingTo("100.00");
        assertThat(summary.totalInvested()).isEqualByComparingTo("600");
        assertThat(summary.totalExecutions()).isEqualTo(6);
    }

    @Test
    @DisplayName("Symbol lookup ignores case")
    void symbolIgnoresCase() {
        when(remote.listSchedules()).thenReturn(List.of(schedule("s1", "AAPL", false, null)));
        repository.fetchSchedules();

        assertThat(repository.schedulesForSymbol("aapl")).hasSize(1);
    }
}
