package com.growfolio.dataclient.config;

/*
 * 09/22/2026 - 9:42 AM
 * @author Growfolio Engineering
 */

import com.growfolio.dataclient.market.MarketHoursCalculator;
import com.growfolio.dataclient.remote.AiRemoteDataSource;
import com.growfolio.dataclient.remote.ApiClient;
import com.growfolio.dataclient.remote.DcaRemoteDataSource;
import com.growfolio.dataclient.remote.FamilyRemoteDataSource;
import com.growfolio.dataclient.remote.FundingRemoteDataSource;
import com.growfolio.dataclient.remote.GoalRemoteDataSource;
import com.growfolio.dataclient.remote.PortfolioRemoteDataSource;
import com.growfolio.dataclient.remote.RestAiRemoteDataSource;
import com.growfolio.dataclient.remote.RestDcaRemoteDataSource;
import com.growfolio.dataclient.remote.RestFamilyRemoteDataSource;
import com.growfolio.dataclient.remote.RestFundingRemoteDataSource;
import com.growfolio.dataclient.remote.RestGoalRemoteDataSource;
import com.growfolio.dataclient.remote.RestPortfolioRemoteDataSource;
import com.growfolio.dataclient.remote.RestStocksRemoteDataSource;
import com.growfolio.dataclient.remote.RestUserRemoteDataSource;
import com.growfolio.dataclient.remote.StocksRemoteDataSource;
import com.growfolio.dataclient.remote.UserRemoteDataSource;
import com.growfolio.dataclient.repository.AiInsightRepository;
import com.growfolio.dataclient.repository.CachedAiInsightRepository;
import com.growfolio.dataclient.repository.CachedDcaRepository;
import com.growfolio.dataclient.repository.CachedFamilyRepository;
import com.growfolio.dataclient.repository.CachedFundingRepository;
import com.growfolio.dataclient.repository.CachedGoalRepository;
import com.growfolio.dataclient.repository.CachedPortfolioRepository;
import com.growfolio.dataclient.repository.CachedStocksRepository;
import com.growfolio.dataclient.repository.CachedUserRepository;
import com.growfolio.dataclient.repository.DcaRepository;
import com.growfolio.dataclient.repository.FamilyRepository;
import com.growfolio.dataclient.repository.FundingRepository;
import com.growfolio.dataclient.repository.GoalRepository;
import com.growfolio.dataclient.repository.InvalidationTable;
import com.growfolio.dataclient.repository.PortfolioRepository;
import com.growfolio.dataclient.repository.StocksRepository;
import com.growfolio.dataclient.repository.UserRepository;
import com.growfolio.dataclient.service.DashboardService;
import com.growfolio.synccore.cache.CacheStoreFactory;
import com.growfolio.synccore.invalidation.InvalidationRules;
import com.growfolio.synccore.metrics.SyncMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the data client: one cache store factory and one invalidation table shared by all repositories,
 * so a mutation in one domain can drop entries owned by another.
 */
@Configuration
@EnableConfigurationProperties(GrowfolioProperties.class)
public class DataClientConfig {

    private final GrowfolioProperties properties;

    public DataClientConfig(GrowfolioProperties properties) {
        this.properties = properties;
    }

    // ==================== Sync core ====================

    @Bean
    public Clock growfolioClock() {
        return Clock.systemUTC();
    }

    @Bean
    public SyncMetrics syncMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new SyncMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    public CacheStoreFactory cacheStoreFactory(Clock growfolioClock, SyncMetrics syncMetrics) {
        return new CacheStoreFactory(growfolioClock, properties.cache().maxEntriesPerStore(), syncMetrics);
    }

    @Bean
    public InvalidationRules invalidationRules(SyncMetrics syncMetrics) {
        return InvalidationTable.rules(syncMetrics);
    }

    // ==================== Remote ====================

    @Bean
    public ApiClient apiClient(RestClient growfolioRestClient, CircuitBreakerRegistry circuitBreakerRegistry,
                               RetryRegistry retryRegistry) {
        return new ApiClient(growfolioRestClient, properties.api().version(),
                ResilienceConfig.apiCircuitBreaker(circuitBreakerRegistry),
                ResilienceConfig.apiRetry(retryRegistry));
    }

    @Bean
    public PortfolioRemoteDataSource portfolioRemoteDataSource(ApiClient apiClient) {
        return new RestPortfolioRemoteDataSource(apiClient);
    }

    @Bean
    public GoalRemoteDataSource goalRemoteDataSource(ApiClient apiClient) {
        return new RestGoalRemoteDataSource(apiClient);
    }

    @Bean
    public DcaRemoteDataSource dcaRemoteDataSource(ApiClient apiClient) {
        return new RestDcaRemoteDataSource(apiClient);
    }

    @Bean
    public FamilyRemoteDataSource familyRemoteDataSource(ApiClient apiClient) {
        return new RestFamilyRemoteDataSource(apiClient);
    }

    @Bean
    public FundingRemoteDataSource fundingRemoteDataSource(ApiClient apiClient) {
        return new RestFundingRemoteDataSource(apiClient);
    }

    @Bean
    public StocksRemoteDataSource stocksRemoteDataSource(ApiClient apiClient) {
        return new RestStocksRemoteDataSource(apiClient);
    }

    @Bean
    public UserRemoteDataSource userRemoteDataSource(ApiClient apiClient) {
        return new RestUserRemoteDataSource(apiClient);
    }

    @Bean
    public AiRemoteDataSource aiRemoteDataSource(ApiClient apiClient) {
        return new RestAiRemoteDataSource(apiClient);
    }

    // ==================== Repositories ====================

    @Bean
    public PortfolioRepository portfolioRepository(PortfolioRemoteDataSource remote, CacheStoreFactory stores,
                                                   InvalidationRules rules) {
        return new CachedPortfolioRepository(remote, stores, rules, properties.api().maxPageSize());
    }

    @Bean
    public GoalRepository goalRepository(GoalRemoteDataSource remote, CacheStoreFactory stores,
                                         InvalidationRules rules) {
        return new CachedGoalRepository(remote, stores, rules, properties.api().maxPageSize());
    }

    @Bean
    public DcaRepository dcaRepository(DcaRemoteDataSource remote, CacheStoreFactory stores,
                                       InvalidationRules rules) {
        return new CachedDcaRepository(remote, stores, rules);
    }

    @Bean
    public FamilyRepository familyRepository(FamilyRemoteDataSource remote, CacheStoreFactory stores,
                                             InvalidationRules rules) {
        return new CachedFamilyRepository(remote, stores, rules);
    }

    @Bean
    public FundingRepository fundingRepository(FundingRemoteDataSource remote, CacheStoreFactory stores,
                                               InvalidationRules rules) {
        return new CachedFundingRepository(remote, stores, rules, properties.funding().currency(),
                properties.api().maxPageSize());
    }

    @Bean
    public MarketHoursCalculator marketHoursCalculator() {
        return new MarketHoursCalculator();
    }

    @Bean
    public StocksRepository stocksRepository(StocksRemoteDataSource remote, CacheStoreFactory stores,
                                             InvalidationRules rules, MarketHoursCalculator marketHoursCalculator) {
        return new CachedStocksRepository(remote, stores, rules, marketHoursCalculator);
    }

    @Bean
    public UserRepository userRepository(UserRemoteDataSource remote, CacheStoreFactory stores,
                                         InvalidationRules rules) {
        return new CachedUserRepository(remote, stores, rules);
    }

    @Bean
    public AiInsightRepository aiInsightRepository(AiRemoteDataSource remote, CacheStoreFactory stores,
                                                   InvalidationRules rules) {
        return new CachedAiInsightRepository(remote, stores, rules);
    }

    // ==================== Services ====================

    @Bean(destroyMethod = "shutdown")
    public ExecutorService dashboardExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.dashboard().threads(), task -> {
            Thread thread = new Thread(task, "dashboard-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public DashboardService dashboardService(PortfolioRepository portfolioRepository, GoalRepository goalRepository,
                                             DcaRepository dcaRepository, ExecutorService dashboardExecutor,
                                             Clock growfolioClock) {
        return new DashboardService(portfolioRepository, goalRepository, dcaRepository, dashboardExecutor,
                growfolioClock, properties.dashboard().timeout());
    }
}
