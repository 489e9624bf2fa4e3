package com.agentrelay.orchestrator.resilience;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private static final Duration RECOVERY = Duration.ofMillis(50);

    private static void fail(CircuitBreaker breaker) {
        assertThatThrownBy(() -> breaker.execute(() -> { throw new IllegalStateException("boom"); }))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void opensAfterThresholdFailures_andRejectsWithoutInvoking() {
        CircuitBreaker breaker = new CircuitBreaker("data", 3, RECOVERY);
        fail(breaker);
        fail(breaker);
        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        fail(breaker);
        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);

        AtomicInteger invoked = new AtomicInteger();
        assertThatThrownBy(() -> breaker.execute(invoked::incrementAndGet))
                .isInstanceOf(CircuitBreakerOpenException.class)
                .hasMessageContaining("Circuit breaker open");
        assertThat(invoked).hasValue(0);
    }

    @Test
    void successResetsFailureCount() {
        CircuitBreaker breaker = new CircuitBreaker("data", 2, RECOVERY);
        fail(breaker);
        assertThat(breaker.execute(() -> "ok")).isEqualTo("ok");
        fail(breaker);
        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.failureCount()).isEqualTo(1);
    }

    @Test
    void afterRecoveryTimeout_successfulTrialCloses() throws Exception {
        CircuitBreaker breaker = new CircuitBreaker("data", 1, RECOVERY);
        fail(breaker);
        Thread.sleep(RECOVERY.toMillis() + 20);

        assertThat(breaker.execute(() -> "trial")).isEqualTo("trial");
        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void afterRecoveryTimeout_failedTrialReopens() throws Exception {
        CircuitBreaker breaker = new CircuitBreaker("data", 1, RECOVERY);
        fail(breaker);
        Thread.sleep(RECOVERY.toMillis() + 20);

        fail(breaker);
        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
        assertThatThrownBy(() -> breaker.execute(() -> "x")).isInstanceOf(CircuitBreakerOpenException.class);
    }

    @Test
    void halfOpen_admitsExactlyOneTrial() throws Exception {
        CircuitBreaker breaker = new CircuitBreaker("data", 1, RECOVERY);
        fail(breaker);
        Thread.sleep(RECOVERY.toMillis() + 20);

        CountDownLatch trialRunning = new CountDownLatch(1);
        CountDownLatch releaseTrial = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<String> trial = pool.submit(() -> breaker.execute(() -> {
                trialRunning.countDown();
                await(releaseTrial);
                return "trial";
            }));
            assertThat(trialRunning.await(1, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> breaker.execute(() -> "second"))
                    .isInstanceOf(CircuitBreakerOpenException.class);

            releaseTrial.countDown();
            assertThat(trial.get(1, TimeUnit.SECONDS)).isEqualTo("trial");
            assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void registry_returnsOneBreakerPerName() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(3, RECOVERY);
        assertThat(registry.forName("data")).isSameAs(registry.forName("data"));
        assertThat(registry.forName("data")).isNotSameAs(registry.forName("triage"));
        assertThat(registry.states()).containsOnlyKeys("data", "triage");
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
