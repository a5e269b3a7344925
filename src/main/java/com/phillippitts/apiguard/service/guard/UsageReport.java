package com.phillippitts.apiguard.service.guard;

/**
 * Units a call consumed, as reported by the provider's response.
 */
public record UsageReport(String model, long inputUnits, long outputUnits) {

    public UsageReport {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model must not be blank");
        }
        if (inputUnits < 0 || outputUnits < 0) {
            throw new IllegalArgumentException("Units must not be negative, got: " + inputUnits + "/" + outputUnits);
        }
    }
}
