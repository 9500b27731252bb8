package com.growfolio.dataclient.repository;

import com.growfolio.common.model.PortfolioInsights;
import com.growfolio.common.model.StockExplanation;
import com.growfolio.dataclient.remote.AiRemoteDataSource;
import com.growfolio.dataclient.support.SyncFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CachedAiInsightRepositoryTest {

    @Mock
    private AiRemoteDataSource remote;

    private SyncFixture fixture;
    private CachedAiInsightRepository repository;

    @BeforeEach
    void setUp() {
        fixture = new SyncFixture();
        repository = new CachedAiInsightRepository(remote, fixture.stores(), fixture.rules());
    }

    @Test
    @DisplayName("Explanations for \"aapl\" and \"AAPL\" share one request")
    void explanationCaseInsensitive() {
        when(remote.explainStock("AAPL")).thenReturn(new StockExplanation("AAPL", "Makes phones", fixture.now()));

        repository.fetchStockExplanation("aapl");
        StockExplanation second = repository.fetchStockExplanation("AAPL");

        assertThat(second.explanation()).isEqualTo("Makes phones");
        verify(remote, times(1)).explainStock("AAPL");
    }

    @Test
    @DisplayName("Insights are cached separately per goal flag")
    void insightsKeyedByFlag() {
        when(remote.getInsights(true)).thenReturn(new PortfolioInsights(List.of(), fixture.now(), 70, "with goals"));
        when(remote.getInsights(false)).thenReturn(new PortfolioInsights(List.of(), fixture.now(), 70, "without"));

        assertThat(repository.fetchInsights(true).summary()).isEqualTo("with goals");
        assertThat(repository.fetchInsights(false).summary()).isEqualTo("without");
        repository.fetchInsights(true);

        verify(remote, times(1)).getInsights(true);
    }

    @Test
    @DisplayName("Tips are kept for an hour; clearing insights leaves them")
    void tipsWindow() {
        when(remote.getInvestingTips()).thenReturn(List.of());
        when(remote.getInsights(false)).thenReturn(new PortfolioInsights(List.of(), fixture.now(), null, null));
        repository.fetchInvestingTips();
        repository.fetchInsights(false);

        fixture.advance(Duration.ofMinutes(59));
        repository.clearInsightsCache();
        repository.fetchInvestingTips();
        repository.fetchInsights(false);

        verify(remote, times(1)).getInvestingTips();
        verify(remote, times(2)).getInsights(false);

        repository.clearCache();
        repository.fetchInvestingTips();
        verify(remote, times(2)).getInvestingTips();
    }
}
