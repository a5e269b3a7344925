package com.phillippitts.apiguard.service.breaker;

import com.phillippitts.apiguard.exception.CircuitOpenException;
import com.phillippitts.apiguard.service.alert.Alert;
import com.phillippitts.apiguard.service.alert.AlertLevel;
import com.phillippitts.apiguard.service.alert.AlertSink;
import com.phillippitts.apiguard.service.metrics.GovernanceMetricsPublisher;
import com.phillippitts.apiguard.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-service failure detector that stops calling a service it believes is unhealthy.
 *
 * <p>State machine:
 * <ul>
 *   <li>CLOSED → OPEN: {@code failureThreshold} consecutive failures, or a lifetime failure rate at or
 *       above {@code failureRateThreshold} once {@code minCallsForRate} calls have been recorded</li>
 *   <li>OPEN → HALF_OPEN: evaluated lazily on the next state read once {@code recoveryTimeout} has
 *       elapsed since the last failure (no timer thread)</li>
 *   <li>HALF_OPEN → CLOSED: {@code successThreshold} consecutive successes</li>
 *   <li>HALF_OPEN → OPEN: any single counted failure</li>
 * </ul>
 * Only {@link #reset()} and {@link #forceOpen()} override the machine from outside.
 *
 * <p>The breaker never retries. It only decides admission; retries belong to the caller.
 *
 * <p><b>Thread Safety:</b> all mutable state is guarded by one {@link ReentrantLock}. Alerts, metrics
 * and {@link CircuitStateListener}s are notified after the lock is released.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * if (breaker.canExecute()) {
 *     try {
 *         Response r = client.call();
 *         breaker.recordSuccess();
 *     } catch (IOException e) {
 *         breaker.recordFailure(e);
 *         throw e;
 *     }
 * } else {
 *     breaker.recordRejection();
 * }
 * }</pre>
 */
public class CircuitBreaker {

    private static final Logger LOG = LogManager.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final FailureClassifier classifier;
    private final AlertSink alertSink;
    private final GovernanceMetricsPublisher metrics;
    private final List<CircuitStateListener> listeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock lock = new ReentrantLock();
    // Transitions made under the lock, delivered once it is released
    private final Deque<CircuitStateTransition> pendingTransitions = new ArrayDeque<>();

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private long totalCalls;
    private long successfulCalls;
    private long failedCalls;
    private long rejectedCalls;
    private int halfOpenInFlight;
    private Instant lastFailureAt;
    private String lastFailureReason;
    private Instant lastSuccessAt;
    private Instant lastStateChangeAt;

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC(), FailureClassifier.DEFAULT, AlertSink.NOOP,
                GovernanceMetricsPublisher.NOOP);
    }

    public CircuitBreaker(String name,
                          CircuitBreakerConfig config,
                          Clock clock,
                          FailureClassifier classifier,
                          AlertSink alertSink,
                          GovernanceMetricsPublisher metrics) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.name = name;
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.alertSink = Objects.requireNonNull(alertSink, "alertSink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.lastStateChangeAt = clock.instant();
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    /**
     * Registers a callback for state changes.
     */
    public void addStateListener(CircuitStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Current state. Reading it may move an OPEN circuit to HALF_OPEN once the recovery timeout
     * has elapsed.
     */
    public CircuitState getState() {
        CircuitState current;
        lock.lock();
        try {
            current = currentState();
        } finally {
            lock.unlock();
        }
        deliverTransitions();
        return current;
    }

    public boolean isClosed() {
        return getState() == CircuitState.CLOSED;
    }

    public boolean isOpen() {
        return getState() == CircuitState.OPEN;
    }

    public boolean isHalfOpen() {
        return getState() == CircuitState.HALF_OPEN;
    }

    /**
     * Decides whether a call may proceed. While HALF_OPEN a {@code true} answer reserves one trial slot,
     * which stays taken until the call reports {@link #recordSuccess()} or a failure.
     *
     * @return true if the call should proceed, false if it must be rejected
     */
    public boolean canExecute() {
        boolean allowed;
        lock.lock();
        try {
            allowed = switch (currentState()) {
                case CLOSED -> true;
                case OPEN -> false;
                case HALF_OPEN -> reserveTrialSlot();
            };
        } finally {
            lock.unlock();
        }
        deliverTransitions();
        return allowed;
    }

    /**
     * Records a successful call.
     */
    public void recordSuccess() {
        lock.lock();
        try {
            totalCalls++;
            successfulCalls++;
            lastSuccessAt = clock.instant();
            consecutiveFailures = 0;

            if (state == CircuitState.HALF_OPEN) {
                consecutiveSuccesses++;
                releaseTrialSlot();
                if (consecutiveSuccesses >= config.successThreshold()) {
                    LOG.info("Circuit '{}' recovered after {} successful calls", name, consecutiveSuccesses);
                    transitionTo(CircuitState.CLOSED);
                }
            }
        } finally {
            lock.unlock();
        }
        metrics.callSucceeded(name);
        deliverTransitions();
    }

    /**
     * Records a failed call, classifying the throwable to decide whether it counts.
     *
     * @param failure failure raised by the protected call (nullable)
     */
    public void recordFailure(Throwable failure) {
        recordFailure(classifier.classify(failure), LogSanitizer.describe(failure));
    }

    /**
     * Records a failed call of the given kind. Kinds listed in {@code excludedFailureKinds} are not
     * counted; they only give back the HALF_OPEN trial slot the call held.
     *
     * @param kind   failure kind (null counts as {@link FailureKind#FATAL})
     * @param reason short description kept as {@code lastFailureReason}
     */
    public void recordFailure(FailureKind kind, String reason) {
        FailureKind effectiveKind = kind == null ? FailureKind.FATAL : kind;
        if (config.excludedFailureKinds().contains(effectiveKind)) {
            lock.lock();
            try {
                if (state == CircuitState.HALF_OPEN) {
                    releaseTrialSlot();
                }
            } finally {
                lock.unlock();
            }
            LOG.debug("Circuit '{}' ignoring excluded {} failure: {}", name, effectiveKind, reason);
            metrics.callFailed(name, true);
            return;
        }

        lock.lock();
        try {
            totalCalls++;
            failedCalls++;
            consecutiveFailures++;
            consecutiveSuccesses = 0;
            lastFailureAt = clock.instant();
            lastFailureReason = reason == null || reason.isBlank()
                    ? "Unknown"
                    : LogSanitizer.truncate(reason, LogSanitizer.MAX_REASON_LENGTH);

            if (state == CircuitState.HALF_OPEN) {
                LOG.warn("Circuit '{}' reopened due to failure: {}", name, lastFailureReason);
                transitionTo(CircuitState.OPEN);
            } else if (state == CircuitState.CLOSED && shouldOpen()) {
                transitionTo(CircuitState.OPEN);
            }
        } finally {
            lock.unlock();
        }
        metrics.callFailed(name, false);
        deliverTransitions();
    }

    /**
     * Records a call rejected because {@link #canExecute()} returned false.
     */
    public void recordRejection() {
        lock.lock();
        try {
            rejectedCalls++;
        } finally {
            lock.unlock();
        }
        LOG.debug("Circuit '{}' rejected a call", name);
        metrics.callRejected(name);
    }

    /**
     * Time left before an OPEN circuit starts admitting trial calls; zero in any other state.
     */
    public Duration getTimeRemaining() {
        lock.lock();
        try {
            return timeRemaining(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Admits a call or throws, returning a scoped permit that must report the call's outcome.
     *
     * @return permit to close once the call finishes
     * @throws CircuitOpenException when the call is rejected (the rejection is recorded)
     */
    public CircuitBreakerPermit acquirePermit() {
        if (!canExecute()) {
            recordRejection();
            throw openException();
        }
        return new CircuitBreakerPermit(this);
    }

    /**
     * Runs the operation behind this breaker: admission, execution, outcome recording.
     *
     * @param operation protected call
     * @return the operation's result
     * @throws CircuitOpenException when the call is rejected
     * @throws Exception whatever the operation throws, after it has been recorded
     */
    public <T> T execute(Callable<T> operation) throws Exception {
        Objects.requireNonNull(operation, "operation");
        try (CircuitBreakerPermit permit = acquirePermit()) {
            try {
                T result = operation.call();
                permit.success();
                return result;
            } catch (Throwable t) {
                permit.failure(t);
                throw t;
            }
        }
    }

    /**
     * Unchecked variant of {@link #execute(Callable)}.
     */
    public <T> T executeSupplier(Supplier<T> operation) {
        Objects.requireNonNull(operation, "operation");
        try (CircuitBreakerPermit permit = acquirePermit()) {
            try {
                T result = operation.get();
                permit.success();
                return result;
            } catch (RuntimeException | Error e) {
                permit.failure(e);
                throw e;
            }
        }
    }

    /**
     * Copy of the current counters.
     */
    public CircuitBreakerStats getStats() {
        CircuitBreakerStats stats;
        lock.lock();
        try {
            currentState();
            stats = statsLocked(clock.instant());
        } finally {
            lock.unlock();
        }
        deliverTransitions();
        return stats;
    }

    /**
     * Config, counters and time remaining read together.
     */
    public CircuitBreakerSnapshot snapshot() {
        CircuitBreakerSnapshot snapshot;
        lock.lock();
        try {
            currentState();
            Instant now = clock.instant();
            snapshot = new CircuitBreakerSnapshot(name, config, statsLocked(now), timeRemaining(now));
        } finally {
            lock.unlock();
        }
        deliverTransitions();
        return snapshot;
    }

    /**
     * Export view of this breaker.
     */
    public Map<String, Object> toMap() {
        return snapshot().toMap();
    }

    /**
     * Returns the breaker to CLOSED with every counter zeroed.
     */
    public void reset() {
        CircuitState previous;
        lock.lock();
        try {
            previous = state;
            state = CircuitState.CLOSED;
            consecutiveFailures = 0;
            consecutiveSuccesses = 0;
            totalCalls = 0;
            successfulCalls = 0;
            failedCalls = 0;
            rejectedCalls = 0;
            halfOpenInFlight = 0;
            lastFailureAt = null;
            lastFailureReason = null;
            lastSuccessAt = null;
            lastStateChangeAt = clock.instant();
            pendingTransitions.clear();
        } finally {
            lock.unlock();
        }
        if (previous != CircuitState.CLOSED) {
            LOG.info("Circuit '{}' manually reset to CLOSED", name);
        }
    }

    /**
     * Operational override: opens the circuit now and restarts the recovery timer.
     */
    public void forceOpen() {
        lock.lock();
        try {
            lastFailureAt = clock.instant();
            transitionTo(CircuitState.OPEN);
        } finally {
            lock.unlock();
        }
        LOG.info("Circuit '{}' manually forced to OPEN", name);
        deliverTransitions();
    }

    CircuitOpenException openException() {
        String reason;
        Duration remaining;
        lock.lock();
        try {
            reason = lastFailureReason;
            remaining = timeRemaining(clock.instant());
        } finally {
            lock.unlock();
        }
        return new CircuitOpenException(name, remaining, reason);
    }

    // ---- lock-held helpers ----

    private CircuitState currentState() {
        if (state == CircuitState.OPEN && recoveryTimeoutElapsed(clock.instant())) {
            transitionTo(CircuitState.HALF_OPEN);
        }
        return state;
    }

    private boolean recoveryTimeoutElapsed(Instant now) {
        if (lastFailureAt == null) {
            return true;
        }
        return !now.isBefore(lastFailureAt.plus(config.recoveryTimeout()));
    }

    private Duration timeRemaining(Instant now) {
        if (state != CircuitState.OPEN || lastFailureAt == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(now, lastFailureAt.plus(config.recoveryTimeout()));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private boolean reserveTrialSlot() {
        if (halfOpenInFlight < config.halfOpenMaxConcurrent()) {
            halfOpenInFlight++;
            return true;
        }
        return false;
    }

    private void releaseTrialSlot() {
        halfOpenInFlight = Math.max(0, halfOpenInFlight - 1);
    }

    private boolean shouldOpen() {
        if (consecutiveFailures >= config.failureThreshold()) {
            LOG.warn("Circuit '{}' opening: {} consecutive failures", name, consecutiveFailures);
            return true;
        }
        if (totalCalls >= config.minCallsForRate()) {
            double failureRate = (double) failedCalls / totalCalls;
            if (failureRate >= config.failureRateThreshold()) {
                LOG.warn("Circuit '{}' opening: failure rate {} >= {}",
                        name, String.format("%.1f%%", failureRate * 100),
                        String.format("%.1f%%", config.failureRateThreshold() * 100));
                return true;
            }
        }
        return false;
    }

    private void transitionTo(CircuitState newState) {
        CircuitState oldState = state;
        if (oldState == newState) {
            return;
        }
        state = newState;
        lastStateChangeAt = clock.instant();

        switch (newState) {
            case CLOSED -> {
                consecutiveFailures = 0;
                halfOpenInFlight = 0;
            }
            case HALF_OPEN -> {
                consecutiveSuccesses = 0;
                halfOpenInFlight = 0;
            }
            case OPEN -> halfOpenInFlight = 0;
        }

        LOG.info("Circuit '{}' state changed: {} -> {}", name, oldState.value(), newState.value());
        pendingTransitions.addLast(new CircuitStateTransition(
                name, oldState, newState, lastStateChangeAt, consecutiveFailures, lastFailureReason));
    }

    private CircuitBreakerStats statsLocked(Instant now) {
        Duration inState = lastStateChangeAt == null || now.isBefore(lastStateChangeAt)
                ? Duration.ZERO
                : Duration.between(lastStateChangeAt, now);
        return new CircuitBreakerStats(state, totalCalls, successfulCalls, failedCalls, rejectedCalls,
                consecutiveFailures, consecutiveSuccesses, halfOpenInFlight, lastFailureAt,
                lastFailureReason, lastSuccessAt, lastStateChangeAt, inState);
    }

    // ---- notification (lock not held) ----

    private void deliverTransitions() {
        List<CircuitStateTransition> drained;
        lock.lock();
        try {
            if (pendingTransitions.isEmpty()) {
                return;
            }
            drained = new ArrayList<>(pendingTransitions);
            pendingTransitions.clear();
        } finally {
            lock.unlock();
        }
        for (CircuitStateTransition transition : drained) {
            metrics.stateChanged(name, transition.to().value());
            raiseAlert(transition);
            for (CircuitStateListener listener : listeners) {
                try {
                    listener.onStateChange(transition);
                } catch (RuntimeException ex) {
                    LOG.error("State change callback failed for circuit '{}'", name, ex);
                }
            }
        }
    }

    private void raiseAlert(CircuitStateTransition transition) {
        if (transition.to() == CircuitState.OPEN) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("service", name);
            metadata.put("consecutive_failures", transition.consecutiveFailures());
            metadata.put("last_error", transition.lastFailureReason() == null
                    ? "Unknown" : transition.lastFailureReason());
            alertSink.deliver(new Alert(AlertLevel.ERROR, Alert.SOURCE_CIRCUIT_BREAKER,
                    "Circuit breaker '" + name + "' OPENED after "
                            + transition.consecutiveFailures() + " consecutive failures",
                    metadata, transition.at()));
        } else if (transition.to() == CircuitState.CLOSED) {
            alertSink.deliver(new Alert(AlertLevel.INFO, Alert.SOURCE_CIRCUIT_BREAKER,
                    "Circuit breaker '" + name + "' recovered (CLOSED)",
                    Map.of("service", name), transition.at()));
        }
    }
}
