package com.growfolio.dataclient.config;

import com.growfolio.dataclient.repository.CacheTargets;
import com.growfolio.dataclient.repository.FundingRepository;
import com.growfolio.dataclient.repository.PortfolioRepository;
import com.growfolio.dataclient.repository.StocksRepository;
import com.growfolio.dataclient.service.DashboardService;
import com.growfolio.synccore.invalidation.InvalidationRules;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class DataClientConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(DataClientConfig.class, RestClientConfig.class, ResilienceConfig.class);

    @Test
    @DisplayName("Defaults apply when nothing is configured")
    void defaults() {
        runner.run(context -> {
            GrowfolioProperties properties = context.getBean(GrowfolioProperties.class);

            assertThat(properties.api().baseUrl()).isEqualTo("http://localhost:3000");
            assertThat(properties.api().version()).isEqualTo("v1");
            assertThat(properties.funding().currency()).isEqualTo("GBP");
            assertThat(properties.dashboard().threads()).isEqualTo(3);
            assertThat(context.getBean(RetryRegistry.class).retry(ResilienceConfig.GROWFOLIO_API)
                    .getRetryConfig().getMaxAttempts()).isEqualTo(3);
        });
    }

    @Test
    @DisplayName("Properties bind from the growfolio prefix")
    void binding() {
        runner.withPropertyValues(
                        "growfolio.api.base-url=https://api.growfolio.test",
                        "growfolio.api.max-retry-attempts=5",
                        "growfolio.funding.currency=USD",
                        "growfolio.dashboard.timeout=5s")
                .run(context -> {
                    GrowfolioProperties properties = context.getBean(GrowfolioProperties.class);

                    assertThat(properties.api().baseUrl()).isEqualTo("https://api.growfolio.test");
                    assertThat(properties.api().maxRetryAttempts()).isEqualTo(5);
                    assertThat(properties.funding().currency()).isEqualTo("USD");
                    assertThat(properties.dashboard().timeout()).isEqualTo(Duration.ofSeconds(5));
                });
    }

    @Test
    @DisplayName("Retry backoff grows linearly with the configured delay")
    void linearRetryBackoff() {
        runner.withPropertyValues("growfolio.api.retry-delay=200ms")
                .run(context -> {
                    RetryConfig config = context.getBean(RetryRegistry.class)
                            .retry(ResilienceConfig.GROWFOLIO_API).getRetryConfig();

                    assertThat(config.getIntervalBiFunction().apply(1, null)).isEqualTo(200L);
                    assertThat(config.getIntervalBiFunction().apply(2, null)).isEqualTo(400L);
                    assertThat(config.getIntervalBiFunction().apply(3, null)).isEqualTo(600L);
                });
    }

    @Test
    @DisplayName("Every repository registers its stores with the shared invalidation table")
    void repositoriesShareRules() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(PortfolioRepository.class)
                    .hasSingleBean(FundingRepository.class)
                    .hasSingleBean(StocksRepository.class)
                    .hasSingleBean(DashboardService.class);

            InvalidationRules rules = context.getBean(InvalidationRules.class);
            assertThat(rules.registeredTargets()).contains(
                    CacheTargets.PORTFOLIOS, CacheTargets.HOLDINGS, CacheTargets.GOAL_INSIGHTS,
                    CacheTargets.FAMILY, CacheTargets.FUNDING_BALANCE, CacheTargets.WATCHLIST_QUOTES,
                    CacheTargets.USER, CacheTargets.DCA_SCHEDULES)
                    .hasSize(18);
        });
    }
}
