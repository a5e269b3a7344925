package com.phillippitts.apiguard.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;

/**
 * Null-safe facade the governance components report to.
 *
 * <p>Breakers, limiters and trackers are plain objects built by their registries; they receive
 * this publisher instead of a {@link GovernanceMetrics} so they can run without Micrometer in
 * unit tests.
 *
 * @see GovernanceMetrics
 */
public final class GovernanceMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(GovernanceMetricsPublisher.class);

    /**
     * Singleton no-op instance for tests and registries built without metrics.
     */
    public static final GovernanceMetricsPublisher NOOP = new GovernanceMetricsPublisher(null);

    private final GovernanceMetrics metrics;

    /**
     * @param metrics Micrometer instrumentation (nullable for test mode)
     */
    public GovernanceMetricsPublisher(GovernanceMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("GovernanceMetricsPublisher created without metrics (test mode)");
        }
    }

    public void callSucceeded(String service) {
        if (metrics != null) {
            metrics.incrementCallOutcome(service, "success");
        }
    }

    public void callFailed(String service, boolean excluded) {
        if (metrics != null) {
            metrics.incrementCallOutcome(service, excluded ? "excluded" : "failure");
        }
    }

    public void callRejected(String service) {
        if (metrics != null) {
            metrics.incrementRejection(service);
        }
    }

    public void stateChanged(String service, String to) {
        if (metrics != null) {
            metrics.incrementTransition(service, to);
        }
    }

    public void waited(String provider, Duration waited) {
        if (metrics != null) {
            metrics.recordWait(provider, waited);
        }
    }

    public void denied(String provider, String limitType) {
        if (metrics != null) {
            metrics.incrementDenied(provider, limitType);
        }
    }

    public void costTracked(String scope, String provider, double costUsd) {
        if (metrics != null) {
            metrics.addCost(scope, provider, costUsd);
        }
    }

    /**
     * @return true if metrics are available, false if running in test mode
     */
    public boolean isEnabled() {
        return metrics != null;
    }
}
