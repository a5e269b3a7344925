package com.phillippitts.apiguard.service.breaker;

import com.phillippitts.apiguard.exception.CircuitOpenException;
import com.phillippitts.apiguard.service.alert.Alert;
import com.phillippitts.apiguard.service.alert.AlertLevel;
import com.phillippitts.apiguard.service.metrics.GovernanceMetricsPublisher;
import com.phillippitts.apiguard.testutil.MutableClock;
import com.phillippitts.apiguard.testutil.RecordingAlertSink;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private static final Duration RECOVERY = Duration.ofSeconds(30);

    private MutableClock clock;
    private RecordingAlertSink alerts;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-06-01T12:00:00Z");
        alerts = new RecordingAlertSink();
    }

    private CircuitBreaker breaker(CircuitBreakerConfig config) {
        return new CircuitBreaker("openai", config, clock, FailureClassifier.DEFAULT, alerts,
                GovernanceMetricsPublisher.NOOP);
    }

    private static CircuitBreakerConfig.Builder config() {
        return CircuitBreakerConfig.builder()
                .failureThreshold(3)
                .successThreshold(2)
                .recoveryTimeout(RECOVERY)
                .halfOpenMaxConcurrent(1)
                .minCallsForRate(100);
    }

    private static void fail(CircuitBreaker breaker, int times) {
        for (int i = 0; i < times; i++) {
            breaker.recordFailure(FailureKind.TRANSIENT, "timeout " + i);
        }
    }

    @Test
    void shouldStartClosedAndAdmitCalls() {
        CircuitBreaker breaker = breaker(config().build());

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.canExecute()).isTrue();
        assertThat(breaker.getTimeRemaining()).isEqualTo(Duration.ZERO);
    }

    @Test
    void repeatedSuccessesKeepClosedBreakerSteady() {
        CircuitBreaker breaker = breaker(config().build());
        fail(breaker, 2);

        for (int i = 0; i < 1_000; i++) {
            breaker.recordSuccess();

            CircuitBreakerStats stats = breaker.getStats();
            assertThat(stats.state()).isEqualTo(CircuitState.CLOSED);
            assertThat(stats.consecutiveFailures()).isZero();
            assertThat(stats.consecutiveSuccesses()).isNotNegative();
        }
        assertThat(breaker.getStats().successfulCalls()).isEqualTo(1_000);
        assertThat(alerts.alerts()).isEmpty();
    }

    @Test
    void concurrentTrialCallsNeverExceedHalfOpenLimit() throws Exception {
        CircuitBreaker breaker = breaker(config().halfOpenMaxConcurrent(3).build());
        breaker.forceOpen();
        clock.advance(RECOVERY.plusSeconds(1));
        int callers = 200;
        ExecutorService pool = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        int admitted = 0;
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                Callable<Boolean> task = () -> {
                    start.await();
                    return breaker.canExecute();
                };
                futures.add(pool.submit(task));
            }
            start.countDown();

            for (Future<Boolean> future : futures) {
                if (future.get(5, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(admitted).isEqualTo(3);
        assertThat(breaker.getStats().halfOpenInFlight()).isEqualTo(3);
        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
    }

    @Test
    void shouldRejectBlankName() {
        assertThatThrownBy(() -> new CircuitBreaker(" ", CircuitBreakerConfig.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldStayClosedBelowFailureThreshold() {
        CircuitBreaker breaker = breaker(config().build());

        fail(breaker, 2);

        assertThat(breaker.isClosed()).isTrue();
        assertThat(breaker.getStats().consecutiveFailures()).isEqualTo(2);
    }

    @Test
    void shouldOpenAtFailureThreshold() {
        CircuitBreaker breaker = breaker(config().build());

        fail(breaker, 3);

        assertThat(breaker.isOpen()).isTrue();
        assertThat(breaker.canExecute()).isFalse();
        assertThat(breaker.getTimeRemaining()).isEqualTo(RECOVERY);
        assertThat(breaker.getStats().lastFailureReason()).isEqualTo("timeout 2");
    }

    @Test
    void successResetsConsecutiveFailures() {
        CircuitBreaker breaker = breaker(config().build());

        fail(breaker, 2);
        breaker.recordSuccess();
        fail(breaker, 2);

        assertThat(breaker.isClosed()).isTrue();
        assertThat(breaker.getStats().consecutiveFailures()).isEqualTo(2);
    }

    @Test
    void shouldStayOpenJustBeforeRecoveryTimeout() {
        CircuitBreaker breaker = breaker(config().build());
        fail(breaker, 3);

        clock.advance(RECOVERY.minusMillis(1));

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.getTimeRemaining()).isEqualTo(Duration.ofMillis(1));
    }

    @Test
    void shouldMoveToHalfOpenOnReadAfterRecoveryTimeout() {
        CircuitBreaker breaker = breaker(config().build());
        fail(breaker, 3);

        clock.advance(RECOVERY.plusMillis(1));

        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(breaker.getTimeRemaining()).isEqualTo(Duration.ZERO);
    }

    @Test
    void halfOpenLimitsConcurrentTrialCalls() {
        CircuitBreaker breaker = breaker(config().halfOpenMaxConcurrent(2).build());
        fail(breaker, 3);
        clock.advance(RECOVERY);

        assertThat(breaker.canExecute()).isTrue();
        assertThat(breaker.canExecute()).isTrue();
        assertThat(breaker.canExecute()).isFalse();
        assertThat(breaker.getStats().halfOpenInFlight()).isEqualTo(2);

        breaker.recordSuccess();

        assertThat(breaker.canExecute()).isTrue();
    }

    @Test
    void halfOpenClosesAfterSuccessThreshold() {
        CircuitBreaker breaker = breaker(config().build());
        fail(breaker, 3);
        clock.advance(RECOVERY);

        assertThat(breaker.canExecute()).isTrue();
        breaker.recordSuccess();
        assertThat(breaker.isHalfOpen()).isTrue();

        assertThat(breaker.canExecute()).isTrue();
        breaker.recordSuccess();

        assertThat(breaker.isClosed()).isTrue();
        CircuitBreakerStats stats = breaker.getStats();
        assertThat(stats.consecutiveFailures()).isZero();
        assertThat(stats.halfOpenInFlight()).isZero();
    }

    @Test
    void halfOpenReopensOnSingleFailure() {
        CircuitBreaker breaker = breaker(config().build());
        fail(breaker, 3);
        clock.advance(RECOVERY);
        assertThat(breaker.canExecute()).isTrue();

        breaker.recordFailure(FailureKind.FATAL, "still broken");

        assertThat(breaker.isOpen()).isTrue();
        assertThat(breaker.getTimeRemaining()).isEqualTo(RECOVERY);
        assertThat(breaker.getStats().lastFailureReason()).isEqualTo("still broken");
    }

    @Test
    void shouldOpenOnFailureRateOnceMinimumCallsReached() {
        CircuitBreaker breaker = breaker(config()
                .failureThreshold(100)
                .failureRateThreshold(0.5)
                .minCallsForRate(4)
                .build());

        breaker.recordSuccess();
        breaker.recordFailure(FailureKind.TRANSIENT, "a");
        breaker.recordSuccess();
        assertThat(breaker.isClosed()).isTrue();

        breaker.recordFailure(FailureKind.TRANSIENT, "b");

        assertThat(breaker.isOpen()).isTrue();
    }

    @Test
    void failureRateIgnoredBelowMinimumCalls() {
        CircuitBreaker breaker = breaker(config()
                .failureThreshold(100)
                .failureRateThreshold(0.1)
                .minCallsForRate(10)
                .build());

        fail(breaker, 5);

        assertThat(breaker.isClosed()).isTrue();
    }

    @Test
    void excludedFailureKindsAreNotCounted() {
        CircuitBreaker breaker = breaker(config().exclude(FailureKind.VALIDATION).build());

        for (int i = 0; i < 10; i++) {
            breaker.recordFailure(FailureKind.VALIDATION, "bad input");
        }

        CircuitBreakerStats stats = breaker.getStats();
        assertThat(breaker.isClosed()).isTrue();
        assertThat(stats.totalCalls()).isZero();
        assertThat(stats.failedCalls()).isZero();
        assertThat(stats.lastFailureReason()).isNull();
    }

    @Test
    void excludedFailureReleasesHalfOpenSlot() {
        CircuitBreaker breaker = breaker(config().exclude(FailureKind.VALIDATION).build());
        fail(breaker, 3);
        clock.advance(RECOVERY);
        assertThat(breaker.canExecute()).isTrue();
        assertThat(breaker.canExecute()).isFalse();

        breaker.recordFailure(FailureKind.VALIDATION, "bad input");

        assertThat(breaker.isHalfOpen()).isTrue();
        assertThat(breaker.canExecute()).isTrue();
    }

    @Test
    void classifiesThrowablesBeforeCounting() {
        CircuitBreaker breaker = breaker(config().failureThreshold(1).exclude(FailureKind.VALIDATION).build());

        breaker.recordFailure(new IllegalArgumentException("prompt too long"));
        assertThat(breaker.isClosed()).isTrue();

        breaker.recordFailure(new IOException("connection reset"));
        assertThat(breaker.isOpen()).isTrue();
        assertThat(breaker.getStats().lastFailureReason()).contains("connection reset");
    }

    @Test
    void blankReasonIsStoredAsUnknown() {
        CircuitBreaker breaker = breaker(config().build());

        breaker.recordFailure(FailureKind.FATAL, "  ");

        assertThat(breaker.getStats().lastFailureReason()).isEqualTo("Unknown");
    }

    @Test
    void longReasonIsTruncated() {
        CircuitBreaker breaker = breaker(config().build());

        breaker.recordFailure(FailureKind.FATAL, "x".repeat(1000));

        assertThat(breaker.getStats().lastFailureReason()).hasSize(200);
    }

    @Test
    void rejectionsAreCountedSeparately() {
        CircuitBreaker breaker = breaker(config().build());
        fail(breaker, 3);

        breaker.recordRejection();
        breaker.recordRejection();

        CircuitBreakerStats stats = breaker.getStats();
        assertThat(stats.rejectedCalls()).isEqualTo(2);
        assertThat(stats.totalCalls()).isEqualTo(3);
    }

    @Test
    void threeTimeoutsThenRecoveryScenario() {
        CircuitBreaker breaker = breaker(config().build());
        Instant start = clock.instant();

        fail(breaker, 3);
        assertThat(breaker.canExecute()).isFalse();
        breaker.recordRejection();

        clock.set(start.plusSeconds(31));
        assertThat(breaker.canExecute()).isTrue();
        breaker.recordSuccess();
        assertThat(breaker.canExecute()).isTrue();
        breaker.recordSuccess();

        CircuitBreakerStats stats = breaker.getStats();
        assertThat(stats.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(stats.totalCalls()).isEqualTo(5);
        assertThat(stats.successfulCalls()).isEqualTo(2);
        assertThat(stats.failedCalls()).isEqualTo(3);
        assertThat(stats.rejectedCalls()).isEqualTo(1);
    }

    @Test
    void executeReturnsResultAndRecordsSuccess() throws Exception {
        CircuitBreaker breaker = breaker(config().build());

        String result = breaker.execute(() -> "ok");

        assertThat(result).isEqualTo("ok");
        assertThat(breaker.getStats().successfulCalls()).isEqualTo(1);
    }

    @Test
    void executeRecordsFailureAndRethrows() {
        CircuitBreaker breaker = breaker(config().failureThreshold(1).build());

        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new IOException("boom");
        })).isInstanceOf(IOException.class).hasMessage("boom");

        assertThat(breaker.isOpen()).isTrue();
    }

    @Test
    void executeRejectsWhileOpenWithoutRunningOperation() {
        CircuitBreaker breaker = breaker(config().build());
        fail(breaker, 3);
        clock.advance(Duration.ofSeconds(10));
        AtomicInteger invocations = new AtomicInteger();

        assertThatThrownBy(() -> breaker.executeSupplier(invocations::incrementAndGet))
                .isInstanceOfSatisfying(CircuitOpenException.class, ex -> {
                    assertThat(ex.getBreakerName()).isEqualTo("openai");
                    assertThat(ex.getTimeRemaining()).isEqualTo(Duration.ofSeconds(20));
                    assertThat(ex.getLastFailureReason()).isEqualTo("timeout 2");
                });

        assertThat(invocations).hasValue(0);
        assertThat(breaker.getStats().rejectedCalls()).isEqualTo(1);
    }

    @Test
    void abandonedPermitCountsAsFailure() {
        CircuitBreaker breaker = breaker(config().build());

        try (CircuitBreakerPermit permit = breaker.acquirePermit()) {
            assertThat(permit.isCompleted()).isFalse();
        }

        CircuitBreakerStats stats = breaker.getStats();
        assertThat(stats.failedCalls()).isEqualTo(1);
        assertThat(stats.lastFailureReason()).isEqualTo(CircuitBreakerPermit.ABANDONED_REASON);
    }

    @Test
    void permitRecordsOnlyFirstOutcome() {
        CircuitBreaker breaker = breaker(config().build());

        try (CircuitBreakerPermit permit = breaker.acquirePermit()) {
            permit.success();
            permit.failure(new IOException("late"));
        }

        CircuitBreakerStats stats = breaker.getStats();
        assertThat(stats.successfulCalls()).isEqualTo(1);
        assertThat(stats.failedCalls()).isZero();
    }

    @Test
    void resetReturnsToClosedWithZeroedCounters() {
        CircuitBreaker breaker = breaker(config().build());
        fail(breaker, 3);
        breaker.recordRejection();
        alerts.clear();

        breaker.reset();

        CircuitBreakerStats stats = breaker.getStats();
        assertThat(stats.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(stats.totalCalls()).isZero();
        assertThat(stats.rejectedCalls()).isZero();
        assertThat(stats.lastFailureAt()).isNull();
        assertThat(alerts.alerts()).isEmpty();
    }

    @Test
    void forceOpenRestartsRecoveryTimer() {
        CircuitBreaker breaker = breaker(config().build());

        breaker.forceOpen();

        assertThat(breaker.isOpen()).isTrue();
        assertThat(breaker.getTimeRemaining()).isEqualTo(RECOVERY);
    }

    @Test
    void listenersReceiveTransitionsInOrder() {
        CircuitBreaker breaker = breaker(config().successThreshold(1).build());
        List<CircuitStateTransition> transitions = new ArrayList<>();
        breaker.addStateListener(transitions::add);

        fail(breaker, 3);
        clock.advance(RECOVERY);
        breaker.canExecute();
        breaker.recordSuccess();

        assertThat(transitions).extracting(CircuitStateTransition::to)
                .containsExactly(CircuitState.OPEN, CircuitState.HALF_OPEN, CircuitState.CLOSED);
        assertThat(transitions.get(0).consecutiveFailures()).isEqualTo(3);
    }

    @Test
    void failingListenerDoesNotBreakBreaker() {
        CircuitBreaker breaker = breaker(config().build());
        breaker.addStateListener(t -> {
            throw new IllegalStateException("listener bug");
        });

        fail(breaker, 3);

        assertThat(breaker.isOpen()).isTrue();
    }

    @Test
    void raisesErrorAlertOnOpenAndInfoOnRecovery() {
        CircuitBreaker breaker = breaker(config().successThreshold(1).build());

        fail(breaker, 3);

        assertThat(alerts.alerts()).hasSize(1);
        Alert opened = alerts.alerts().get(0);
        assertThat(opened.level()).isEqualTo(AlertLevel.ERROR);
        assertThat(opened.source()).isEqualTo(Alert.SOURCE_CIRCUIT_BREAKER);
        assertThat(opened.message()).isEqualTo("Circuit breaker 'openai' OPENED after 3 consecutive failures");
        assertThat(opened.metadata()).containsEntry("service", "openai")
                .containsEntry("consecutive_failures", 3)
                .containsEntry("last_error", "timeout 2");

        clock.advance(RECOVERY);
        breaker.canExecute();
        breaker.recordSuccess();

        assertThat(alerts.alertsAt(AlertLevel.INFO)).singleElement()
                .extracting(Alert::message)
                .isEqualTo("Circuit breaker 'openai' recovered (CLOSED)");
    }

    @Test
    void toMapUsesSnakeCaseKeys() {
        CircuitBreaker breaker = breaker(config().exclude(FailureKind.VALIDATION).build());
        fail(breaker, 3);

        Map<String, Object> map = breaker.toMap();

        assertThat(map).containsEntry("name", "openai")
                .containsEntry("state", "open")
                .containsEntry("time_remaining_seconds", 30.0);
        assertThat(map).extractingByKey("config", InstanceOfAssertFactories.MAP)
                .containsEntry("failure_threshold", 3)
                .containsEntry("recovery_timeout", 30.0)
                .containsEntry("excluded_failure_kinds", List.of("VALIDATION"));
        assertThat(map).extractingByKey("stats", InstanceOfAssertFactories.MAP)
                .containsEntry("failed_calls", 3L)
                .containsEntry("last_failure_reason", "timeout 2")
                .containsKeys("last_failure_at", "time_in_current_state_seconds");
    }
}
