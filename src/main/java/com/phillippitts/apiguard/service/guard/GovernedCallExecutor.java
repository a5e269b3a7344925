package com.phillippitts.apiguard.service.guard;

import com.phillippitts.apiguard.exception.ApiGuardException;
import com.phillippitts.apiguard.exception.BudgetExceededException;
import com.phillippitts.apiguard.exception.CircuitOpenException;
import com.phillippitts.apiguard.exception.RateLimitExceededException;
import com.phillippitts.apiguard.exception.RateLimitExceededException.LimitType;
import com.phillippitts.apiguard.service.breaker.CircuitBreaker;
import com.phillippitts.apiguard.service.breaker.CircuitBreakerRegistry;
import com.phillippitts.apiguard.service.budget.CostTrackerRegistry;
import com.phillippitts.apiguard.service.ratelimit.RateLimiter;
import com.phillippitts.apiguard.service.ratelimit.RateLimiterSnapshot;
import com.phillippitts.apiguard.service.ratelimit.RateLimiterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Runs an outbound call through rate limiting, the circuit breaker and cost tracking, in that order.
 *
 * <p>The sequence is not atomic across components: a snapshot taken mid-call may show the limiter
 * admission without the breaker outcome.
 */
public class GovernedCallExecutor {

    private static final Logger LOG = LogManager.getLogger(GovernedCallExecutor.class);

    private final CircuitBreakerRegistry breakers;
    private final RateLimiterRegistry limiters;
    private final CostTrackerRegistry trackers;

    public GovernedCallExecutor(CircuitBreakerRegistry breakers,
                                RateLimiterRegistry limiters,
                                CostTrackerRegistry trackers) {
        this.breakers = Objects.requireNonNull(breakers, "breakers");
        this.limiters = Objects.requireNonNull(limiters, "limiters");
        this.trackers = Objects.requireNonNull(trackers, "trackers");
    }

    /**
     * Runs an unmetered call.
     *
     * @throws RateLimitExceededException when the limiter does not admit the call
     * @throws ApiGuardException          when the thread is interrupted while waiting for admission;
     *                                    the interrupt flag stays set
     * @throws CircuitOpenException       when the breaker rejects the call
     * @throws Exception                  whatever the operation throws, after the breaker recorded it
     */
    public <T> T call(GovernedCall call, Callable<T> operation) throws Exception {
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(operation, "operation");
        admit(call);
        return breakers.getOrCreate(call.service()).execute(operation);
    }

    /**
     * Runs a metered call and records the usage it reports against {@link GovernedCall#tracker()}.
     *
     * @throws BudgetExceededException when tracking pushes an enforced budget over its ceiling; the
     *                                 usage is recorded and the call's value is discarded
     */
    public <T> T callMetered(GovernedCall call, Callable<MeteredResult<T>> operation) throws Exception {
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(operation, "operation");
        admit(call);
        CircuitBreaker breaker = breakers.getOrCreate(call.service());
        MeteredResult<T> result = breaker.execute(operation);
        if (result == null) {
            return null;
        }
        UsageReport usage = result.usage();
        if (usage != null && call.tracker() != null) {
            String provider = call.provider() == null ? call.service() : call.provider();
            trackers.getOrCreate(call.tracker()).trackUsage(provider, usage.model(), usage.inputUnits(),
                    usage.outputUnits(), call.layerTag(), call.runTag(), call.scopeTag());
        }
        return result.value();
    }

    private void admit(GovernedCall call) {
        if (call.provider() == null) {
            return;
        }
        RateLimiter limiter = limiters.getOrCreate(call.provider());
        if (limiter.acquire()) {
            return;
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new ApiGuardException("Call to '" + call.service()
                    + "' interrupted while waiting for rate limit admission of provider '" + call.provider() + "'");
        }
        RateLimiterSnapshot snapshot = limiter.snapshot();
        Integer remaining = snapshot.remainingDaily();
        RateLimitExceededException denied = remaining != null && remaining == 0
                ? new RateLimitExceededException(call.provider(), LimitType.DAILY,
                        snapshot.stats().requestsToday(), snapshot.config().dailyLimit())
                : new RateLimitExceededException(call.provider(), LimitType.PER_MINUTE,
                        snapshot.stats().requestsThisMinute(), snapshot.config().requestsPerMinute());
        LOG.warn("Call to '{}' not admitted: {}", call.service(), denied.getMessage());
        throw denied;
    }
}
