package com.agentrelay.orchestrator.resilience;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeoutExecutorTest {

    private final ExecutorService workers = Executors.newCachedThreadPool();
    private final TimeoutExecutor timeouts = new TimeoutExecutor(workers);

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        MDC.clear();
    }

    @Test
    void withTimeout_fastOperation_returnsValue() {
        assertThat(timeouts.withTimeout(Duration.ofSeconds(1), "fast", () -> 42)).isEqualTo(42);
    }

    @Test
    void withTimeout_overrun_throwsWithLabelAndInterruptsTask() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThatThrownBy(() -> timeouts.withTimeout(Duration.ofMillis(50), "slow-agent", () -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return "late";
        }))
                .isInstanceOf(ServiceTimeoutException.class)
                .hasMessageContaining("slow-agent");

        assertThat(interrupted.await(1, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void withTimeout_operationFailure_isRethrownUnwrapped() {
        assertThatThrownBy(() -> timeouts.withTimeout(Duration.ofSeconds(1), "bad", () -> {
            throw new IllegalArgumentException("bad input");
        }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("bad input");
    }

    @Test
    void withTimeout_carriesCallerMdcToWorker() {
        MDC.put("runId", "run-7");
        String seen = timeouts.withTimeout(Duration.ofSeconds(1), "mdc", () -> MDC.get("runId"));
        assertThat(seen).isEqualTo("run-7");
    }
}
