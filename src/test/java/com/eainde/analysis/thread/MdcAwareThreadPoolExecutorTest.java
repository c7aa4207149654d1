package com.eainde.analysis.thread;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MdcAwareThreadPoolExecutorTest {

    private final MdcAwareThreadPoolExecutor executor =
            new MdcAwareThreadPoolExecutor("test-pool", 1, 1, 0L, new LinkedBlockingQueue<>());

    @AfterEach
    void tearDown() {
        MDC.clear();
        executor.shutdownNow();
    }

    @Test
    void execute_shouldCarryCallerMdcToWorker() throws Exception {
        // Arrange
        MDC.put("runId", "run-42");

        // Act
        String seen = executor.submit(() -> MDC.get("runId")).get(5, TimeUnit.SECONDS);

        // Assert
        assertThat(seen).isEqualTo("run-42");
    }

    @Test
    void execute_shouldClearMdcBetweenTasks() throws Exception {
        // Arrange
        MDC.put("runId", "run-42");
        executor.submit(() -> MDC.get("runId")).get(5, TimeUnit.SECONDS);
        MDC.clear();

        // Act
        String seen = executor.submit(() -> MDC.get("runId")).get(5, TimeUnit.SECONDS);

        // Assert
        assertThat(seen).isNull();
    }

    @Test
    void threads_shouldBeNamedAfterPrefix() throws Exception {
        String name = executor.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);

        assertThat(name).startsWith("test-pool-");
    }
}
