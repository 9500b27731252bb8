package com.growfolio.common.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class LogContextTest {

    @AfterEach
    void clear() {
        MDC.clear();
    }

    @Test
    @DisplayName("Values are present inside the block and removed after it")
    void scoped() {
        String inside = LogContext.forOperation("funding", "initiateDeposit")
                .and(LogContext.RESOURCE_ID, "p1")
                .supply(() -> MDC.get(LogContext.DOMAIN) + "." + MDC.get(LogContext.OPERATION) + "/"
                        + MDC.get(LogContext.RESOURCE_ID));

        assertThat(inside).isEqualTo("funding.initiateDeposit/p1");
        assertThat(MDC.get(LogContext.DOMAIN)).isNull();
        assertThat(MDC.get(LogContext.CORRELATION_ID)).isNull();
    }

    @Test
    @DisplayName("Nested blocks restore the outer values")
    void nested() {
        LogContext.with(LogContext.OPERATION, "outer").run(() -> {
            LogContext.with(LogContext.OPERATION, "inner").run(() ->
                    assertThat(MDC.get(LogContext.OPERATION)).isEqualTo("inner"));
            assertThat(MDC.get(LogContext.OPERATION)).isEqualTo("outer");
        });
    }

    @Test
    @DisplayName("Null values are skipped")
    void nullValues() {
        LogContext.with(LogContext.CACHE_KEY, null).run(() -> assertThat(MDC.get(LogContext.CACHE_KEY)).isNull());
    }

    @Test
    @DisplayName("A captured snapshot carries the context to a worker thread")
    void propagates() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            String seen = LogContext.forOperation("dashboard", "load").supply(() -> {
                LogContext.Snapshot snapshot = LogContext.capture();
                return CompletableFuture.supplyAsync(
                        () -> LogContext.restore(snapshot).supply(() -> MDC.get(LogContext.DOMAIN)), executor).join();
            });

            assertThat(seen).isEqualTo("dashboard");
            String leftOver = CompletableFuture.supplyAsync(() -> MDC.get(LogContext.DOMAIN), executor).get();
            assertThat(leftOver).isNull();
        } finally {
            executor.shutdownNow();
        }
    }
}
