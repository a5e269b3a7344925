package com.phillippitts.apiguard.service.budget;

/**
 * Immutable cost tracker configuration.
 *
 * @param budgetCeiling  maximum spend in USD, or null for unlimited
 * @param enforceBudget  throw once cumulative cost goes strictly above the ceiling
 * @param scopeId        job or run this tracker covers (nullable)
 * @param warningPercent budget usage, in percent, at which a warning alert is raised
 */
public record CostTrackerConfig(
        Double budgetCeiling,
        boolean enforceBudget,
        String scopeId,
        double warningPercent
) {

    public static final double DEFAULT_WARNING_PERCENT = 80.0;

    public CostTrackerConfig {
        if (budgetCeiling != null && (budgetCeiling < 0 || budgetCeiling.isNaN())) {
            throw new IllegalArgumentException("budgetCeiling must be >= 0 when set, got: " + budgetCeiling);
        }
        if (warningPercent <= 0 || warningPercent > 100) {
            throw new IllegalArgumentException("warningPercent must be in (0, 100], got: " + warningPercent);
        }
    }

    /** No ceiling, nothing enforced. */
    public static CostTrackerConfig unlimited() {
        return new CostTrackerConfig(null, false, null, DEFAULT_WARNING_PERCENT);
    }

    /** Enforced ceiling. */
    public static CostTrackerConfig withBudget(double budgetCeiling) {
        return new CostTrackerConfig(budgetCeiling, true, null, DEFAULT_WARNING_PERCENT);
    }

    public CostTrackerConfig withScopeId(String scopeId) {
        return new CostTrackerConfig(budgetCeiling, enforceBudget, scopeId, warningPercent);
    }

    public CostTrackerConfig withEnforceBudget(boolean enforceBudget) {
        return new CostTrackerConfig(budgetCeiling, enforceBudget, scopeId, warningPercent);
    }

    public boolean hasBudget() {
        return budgetCeiling != null;
    }
}
