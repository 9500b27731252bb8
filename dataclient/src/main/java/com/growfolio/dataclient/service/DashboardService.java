package com.growfolio.dataclient.service;

/*
 * 09/28/2026 - 9:50 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.exception.ApiExceptions.ApiException;
import com.growfolio.common.logging.LogContext;
import com.growfolio.common.model.DcaSchedule;
import com.growfolio.common.model.Goal;
import com.growfolio.common.model.Portfolio;
import com.growfolio.common.model.Summaries.DcaSummary;
import com.growfolio.common.model.Summaries.GoalsSummary;
import com.growfolio.common.model.Summaries.PortfoliosSummary;
import com.growfolio.common.model.Summaries.UpcomingExecution;
import com.growfolio.dataclient.repository.DcaRepository;
import com.growfolio.dataclient.repository.GoalRepository;
import com.growfolio.dataclient.repository.PortfolioRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Loads the portfolio, goal and DCA sections of the dashboard in parallel.
 * <p>
 * Each section goes through its repository, so concurrent dashboard loads share in-flight requests and
 * fresh cache entries with every other caller. A failing section does not fail the dashboard.
 */
@Slf4j
public class DashboardService {

    static final String PORTFOLIOS = "portfolios";
    static final String GOALS = "goals";
    static final String DCA = "dca";

    private static final int UPCOMING_DAYS = 7;

    private final PortfolioRepository portfolios;
    private final GoalRepository goals;
    private final DcaRepository dca;
    private final Executor executor;
    private final Clock clock;
    private final Duration timeout;

    public DashboardService(PortfolioRepository portfolios, GoalRepository goals, DcaRepository dca,
                            Executor executor, Clock clock, Duration timeout) {
        this.portfolios = portfolios;
        this.goals = goals;
        this.dca = dca;
        this.executor = executor;
        this.clock = clock;
        this.timeout = timeout;
    }

    public DashboardSnapshot load() {
        return LogContext.forOperation("dashboard", "load").supply(this::loadSections);
    }

    private DashboardSnapshot loadSections() {
        Map<String, String> failures = new ConcurrentHashMap<>();

        CompletableFuture<PortfolioSection> portfolioSection = section(PORTFOLIOS, failures,
                () -> new PortfolioSection(portfolios.fetchPortfolios(), portfolios.portfoliosSummary()));
        CompletableFuture<GoalSection> goalSection = section(GOALS, failures,
                () -> new GoalSection(goals.fetchGoals(false), goals.summary()));
        CompletableFuture<DcaSection> dcaSection = section(DCA, failures,
                () -> new DcaSection(dca.fetchSchedules(), dca.summary(), dca.upcomingExecutions(UPCOMING_DAYS)));

        CompletableFuture.allOf(portfolioSection, goalSection, dcaSection)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    log.warn("Dashboard load did not finish within {}", timeout);
                    return null;
                })
                .join();

        PortfolioSection p = result(PORTFOLIOS, portfolioSection, failures);
        GoalSection g = result(GOALS, goalSection, failures);
        DcaSection d = result(DCA, dcaSection, failures);

        DashboardSnapshot snapshot = DashboardSnapshot.builder()
                .portfolios(p != null ? p.portfolios() : null)
                .portfoliosSummary(p != null ? p.summary() : null)
                .goals(g != null ? g.goals() : null)
                .goalsSummary(g != null ? g.summary() : null)
                .schedules(d != null ? d.schedules() : null)
                .dcaSummary(d != null ? d.summary() : null)
                .upcomingExecutions(d != null ? d.upcoming() : null)
                .failures(failures)
                .loadedAt(clock.instant())
                .build();
        log.info("Dashboard loaded: {} portfolios, {} goals, {} schedules, {} failed sections",
                snapshot.portfolios().size(), snapshot.goals().size(), snapshot.schedules().size(), failures.size());
        return snapshot;
    }

    private <T> CompletableFuture<T> section(String name, Map<String, String> failures, Supplier<T> load) {
        LogContext.Snapshot context = LogContext.capture();
        return CompletableFuture.supplyAsync(() -> LogContext.restore(context).supply(load), executor)
                .exceptionally(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    if (cause instanceof ApiException) {
                        log.warn("Dashboard section {} failed: {}", name, cause.getMessage());
                    } else {
                        log.error("Dashboard section {} failed", name, cause);
                    }
                    failures.put(name, String.valueOf(cause.getMessage()));
                    return null;
                });
    }

    private static <T> T result(String name, CompletableFuture<T> section, Map<String, String> failures) {
        if (!section.isDone()) {
            failures.putIfAbsent(name, "timed out");
            return null;
        }
        return section.join();
    }

    private record PortfolioSection(List<Portfolio> portfolios, PortfoliosSummary summary) {}

    private record GoalSection(List<Goal> goals, GoalsSummary summary) {}

    private record DcaSection(List<DcaSchedule> schedules, DcaSummary summary, List<UpcomingExecution> upcoming) {}
}
