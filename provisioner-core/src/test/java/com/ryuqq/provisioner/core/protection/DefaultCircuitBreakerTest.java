package com.ryuqq.provisioner.core.protection;

import com.ryuqq.provisioner.core.error.CallTimeoutException;
import com.ryuqq.provisioner.core.error.CircuitBreakerOpenException;
import com.ryuqq.provisioner.core.error.ExternalServiceException;
import com.ryuqq.provisioner.core.result.CallResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DefaultCircuitBreaker 테스트.
 *
 * <p>시간은 {@link ManualClock} 으로 제어하며 실제로 대기하지 않습니다 (타임아웃 테스트 제외).</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
class DefaultCircuitBreakerTest {

    private static final Duration RESET_TIMEOUT = Duration.ofSeconds(60);

    private ManualClock clock;
    private ExecutorService executor;
    private RecordingListener listener;
    private DefaultCircuitBreaker breaker;
    private AtomicInteger invocations;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(Instant.parse("2024-01-01T00:00:00Z"));
        executor = Executors.newCachedThreadPool();
        listener = new RecordingListener();
        invocations = new AtomicInteger();
        breaker = new DefaultCircuitBreaker(
            new CircuitBreakerConfig("workflow-engine", 3, RESET_TIMEOUT, Duration.ofSeconds(5)),
            clock,
            executor,
            listener
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // ============================================================
    // CLOSED
    // ============================================================

    @Test
    void 연속_실패가_임계값에_도달하면_OPEN으로_전이() {
        // given / when
        failTimes(3);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(listener.transitions).containsExactly("CLOSED->OPEN");
    }

    @Test
    void 임계값_미만의_실패는_CLOSED_유지() {
        // when
        failTimes(2);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getMetrics().consecutiveFailures()).isEqualTo(2);
    }

    @Test
    void 성공하면_연속_실패_수가_초기화됨() {
        // given
        failTimes(2);

        // when
        succeedOnce();
        failTimes(2);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getMetrics().consecutiveFailures()).isEqualTo(2);
    }

    // ============================================================
    // OPEN
    // ============================================================

    @Test
    void OPEN_상태에서는_작업을_호출하지_않고_거부() {
        // given
        failTimes(3);
        int before = invocations.get();
        clock.advance(Duration.ofSeconds(20));

        // when / then
        assertThatThrownBy(this::succeedOnce)
            .isInstanceOf(CircuitBreakerOpenException.class)
            .satisfies(e -> {
                CircuitBreakerOpenException open = (CircuitBreakerOpenException) e;
                assertThat(open.getDependency()).isEqualTo("workflow-engine");
                assertThat(open.getRemainingWait()).isEqualTo(Duration.ofSeconds(40));
            });
        assertThat(invocations.get()).isEqualTo(before);
        assertThat(breaker.getMetrics().rejectedCount()).isEqualTo(1);
        assertThat(listener.outcomes).contains(CallOutcome.REJECTED);
    }

    @Test
    void resetTimeout_경과_후_첫_호출은_HALF_OPEN으로_통과() {
        // given
        failTimes(3);
        clock.advance(RESET_TIMEOUT);

        // when
        succeedOnce();

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(listener.transitions).containsExactly("CLOSED->OPEN", "OPEN->HALF_OPEN");
    }

    // ============================================================
    // HALF_OPEN
    // ============================================================

    @Test
    void HALF_OPEN에서_실패하면_새_resetTimeout으로_다시_OPEN() {
        // given
        failTimes(3);
        clock.advance(RESET_TIMEOUT);

        // when
        failTimes(1);
        clock.advance(Duration.ofSeconds(59));

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThatThrownBy(this::succeedOnce).isInstanceOf(CircuitBreakerOpenException.class);

        clock.advance(Duration.ofSeconds(1));
        succeedOnce();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
    }

    @Test
    void HALF_OPEN에서_ceil_임계값_절반만큼_성공하면_CLOSED() {
        // given: threshold 3 → 2 successes
        failTimes(3);
        clock.advance(RESET_TIMEOUT);

        // when
        succeedOnce();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        succeedOnce();

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getMetrics().consecutiveFailures()).isZero();
        assertThat(listener.transitions).endsWith("HALF_OPEN->CLOSED");
    }

    @Test
    void HALF_OPEN에서는_동시에_하나의_탐색_호출만_허용() throws Exception {
        // given
        failTimes(3);
        clock.advance(RESET_TIMEOUT);
        CountDownLatch trialStarted = new CountDownLatch(1);
        CountDownLatch releaseTrial = new CountDownLatch(1);

        CompletableFuture<String> trial = CompletableFuture.supplyAsync(() -> breaker.execute(() -> {
            trialStarted.countDown();
            releaseTrial.await(5, TimeUnit.SECONDS);
            return "trial";
        }));
        assertThat(trialStarted.await(5, TimeUnit.SECONDS)).isTrue();

        // when / then
        assertThatThrownBy(this::succeedOnce).isInstanceOf(CircuitBreakerOpenException.class);

        releaseTrial.countDown();
        assertThat(trial.get(5, TimeUnit.SECONDS)).isEqualTo("trial");
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
    }

    @Test
    void CLOSED_시점에_허가된_호출이_HALF_OPEN_중에_성공해도_탐색_성공으로_집계하지_않음() throws Exception {
        // given: threshold 2 → HALF_OPEN 에서 1회 성공이면 CLOSED
        DefaultCircuitBreaker slow = new DefaultCircuitBreaker(
            new CircuitBreakerConfig("workflow-engine", 2, RESET_TIMEOUT, Duration.ofSeconds(30)),
            clock,
            executor,
            listener
        );
        CountDownLatch staleStarted = new CountDownLatch(1);
        CountDownLatch releaseStale = new CountDownLatch(1);
        CompletableFuture<String> stale = CompletableFuture.supplyAsync(() -> slow.execute(() -> {
            staleStarted.countDown();
            releaseStale.await(5, TimeUnit.SECONDS);
            return "stale";
        }));
        assertThat(staleStarted.await(5, TimeUnit.SECONDS)).isTrue();

        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> slow.execute(() -> {
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class);
        }
        assertThat(slow.getState()).isEqualTo(CircuitBreakerState.OPEN);

        clock.advance(RESET_TIMEOUT.plusSeconds(1));
        CountDownLatch trialStarted = new CountDownLatch(1);
        CountDownLatch releaseTrial = new CountDownLatch(1);
        CompletableFuture<String> trial = CompletableFuture.supplyAsync(() -> slow.execute(() -> {
            trialStarted.countDown();
            releaseTrial.await(5, TimeUnit.SECONDS);
            return "trial";
        }));
        assertThat(trialStarted.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        releaseStale.countDown();
        assertThat(stale.get(5, TimeUnit.SECONDS)).isEqualTo("stale");

        // then
        assertThat(slow.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThatThrownBy(() -> slow.execute(() -> "second")).isInstanceOf(CircuitBreakerOpenException.class);

        releaseTrial.countDown();
        assertThat(trial.get(5, TimeUnit.SECONDS)).isEqualTo("trial");
        assertThat(slow.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void CLOSED_시점에_허가된_호출이_HALF_OPEN_중에_실패해도_다시_OPEN되지_않음() throws Exception {
        // given
        CountDownLatch staleStarted = new CountDownLatch(1);
        CountDownLatch releaseStale = new CountDownLatch(1);
        CompletableFuture<Void> stale = CompletableFuture.runAsync(() -> assertThatThrownBy(() -> breaker.execute(() -> {
            staleStarted.countDown();
            releaseStale.await(5, TimeUnit.SECONDS);
            throw new IllegalStateException("stale");
        })).isInstanceOf(IllegalStateException.class));
        assertThat(staleStarted.await(5, TimeUnit.SECONDS)).isTrue();

        failTimes(3);
        clock.advance(RESET_TIMEOUT);
        succeedOnce();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);

        // when
        releaseStale.countDown();
        stale.get(5, TimeUnit.SECONDS);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        succeedOnce();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    // ============================================================
    // 실패 분류
    // ============================================================

    @Test
    void callTimeout을_넘기면_타임아웃_예외와_함께_실패로_집계() {
        // given
        DefaultCircuitBreaker fast = new DefaultCircuitBreaker(
            new CircuitBreakerConfig("identity-directory", 1, RESET_TIMEOUT, Duration.ofMillis(100)),
            clock,
            executor,
            listener
        );

        // when / then
        assertThatThrownBy(() -> fast.execute(() -> {
            Thread.sleep(2_000);
            return "late";
        }))
            .isInstanceOf(CallTimeoutException.class)
            .hasMessageContaining("identity-directory");
        assertThat(fast.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(listener.outcomes).contains(CallOutcome.TIMEOUT);
    }

    @Test
    void checked_예외는_ExternalServiceException으로_감싸서_전달() {
        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new IOException("connection refused");
        }))
            .isInstanceOf(ExternalServiceException.class)
            .hasCauseInstanceOf(IOException.class)
            .hasMessageContaining("connection refused");
        assertThat(breaker.getMetrics().failureCount()).isEqualTo(1);
    }

    @Test
    void 결과_판정이_실패면_예외_없이_결과를_반환하고_실패로_집계() {
        // when
        CallResult<String> result = breaker.execute(
            () -> CallResult.<String>serviceError("HTTP 503"),
            CallResult::countsAsFailure
        );

        // then
        assertThat(result.countsAsFailure()).isTrue();
        assertThat(breaker.getMetrics().consecutiveFailures()).isEqualTo(1);
    }

    @Test
    void NotFound_결과는_실패로_집계하지_않음() {
        // given
        failTimes(2);

        // when
        breaker.execute(() -> CallResult.<String>notFound("no such workflow"), CallResult::countsAsFailure);

        // then
        assertThat(breaker.getMetrics().consecutiveFailures()).isZero();
    }

    // ============================================================
    // 운영자 조치와 메트릭
    // ============================================================

    @Test
    void forceOpen은_24시간_동안_거부하고_reset은_즉시_CLOSED() {
        // when
        breaker.forceOpen();
        clock.advance(Duration.ofHours(23));

        // then
        assertThatThrownBy(this::succeedOnce).isInstanceOf(CircuitBreakerOpenException.class);
        assertThat(breaker.getMetrics().nextAttemptInSeconds()).isEqualTo(3600);

        breaker.reset();
        succeedOnce();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void 메트릭은_성공률과_마지막_실패_시각을_보고() {
        // given
        succeedOnce();
        succeedOnce();
        succeedOnce();
        failTimes(1);

        // when
        CircuitBreakerMetrics metrics = breaker.getMetrics();

        // then
        assertThat(metrics.requestCount()).isEqualTo(4);
        assertThat(metrics.failureCount()).isEqualTo(1);
        assertThat(metrics.successRate()).isEqualTo(75.0);
        assertThat(metrics.healthy()).isTrue();
        assertThat(metrics.lastFailureTime()).isEqualTo(clock.instant());
        assertThat(metrics.nextAttemptIn()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("halfOpenSuccessThreshold 는 failureThreshold 의 절반을 올림")
    void halfOpenSuccessThreshold() {
        CircuitBreakerConfig config = CircuitBreakerConfig.forIdentityDirectory();

        assertThat(config.halfOpenSuccessThreshold()).isEqualTo(3);
        assertThat(config.withFailureThreshold(4).halfOpenSuccessThreshold()).isEqualTo(2);
        assertThat(config.withFailureThreshold(1).halfOpenSuccessThreshold()).isEqualTo(1);
    }

    private void failTimes(int times) {
        for (int i = 0; i < times; i++) {
            assertThatThrownBy(() -> breaker.execute(() -> {
                invocations.incrementAndGet();
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class);
        }
    }

    private void succeedOnce() {
        breaker.execute(() -> {
            invocations.incrementAndGet();
            return "ok";
        });
    }

    private static final class RecordingListener implements CircuitBreakerListener {

        private final List<String> transitions = new ArrayList<>();
        private final List<CallOutcome> outcomes = new ArrayList<>();

        @Override
        public synchronized void onStateTransition(String name, CircuitBreakerState from, CircuitBreakerState to) {
            transitions.add(from + "->" + to);
        }

        @Override
        public synchronized void onCall(String name, CallOutcome outcome) {
            outcomes.add(outcome);
        }
    }
}
