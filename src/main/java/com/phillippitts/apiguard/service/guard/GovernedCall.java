package com.phillippitts.apiguard.service.guard;

/**
 * Names the governance components a call goes through.
 *
 * @param service  circuit breaker name
 * @param provider rate limiter name, or null to skip rate limiting
 * @param tracker  cost tracker name, or null to skip cost tracking
 * @param layerTag pipeline stage recorded with the usage (nullable)
 * @param runTag   run recorded with the usage (nullable)
 * @param scopeTag scope recorded with the usage (nullable)
 */
public record GovernedCall(
        String service,
        String provider,
        String tracker,
        String layerTag,
        String runTag,
        String scopeTag
) {

    public GovernedCall {
        if (service == null || service.isBlank()) {
            throw new IllegalArgumentException("service must not be blank");
        }
    }

    /**
     * Call to {@code service}, rate limited under the same name and not cost tracked.
     */
    public static GovernedCall of(String service) {
        return new GovernedCall(service, service, null, null, null, null);
    }

    public GovernedCall withProvider(String provider) {
        return new GovernedCall(service, provider, tracker, layerTag, runTag, scopeTag);
    }

    public GovernedCall trackedBy(String tracker) {
        return new GovernedCall(service, provider, tracker, layerTag, runTag, scopeTag);
    }

    public GovernedCall tagged(String layerTag, String runTag, String scopeTag) {
        return new GovernedCall(service, provider, tracker, layerTag, runTag, scopeTag);
    }
}
