package com.phillippitts.apiguard.service.metrics;

import java.util.Locale;

/**
 * Budget usage band of one tracker.
 */
public enum BudgetLevel {
    /** Below 80%, or no ceiling. */
    OK,
    /** 80% or more. */
    WARNING,
    /** 90% or more. */
    CRITICAL,
    /** Strictly above the ceiling. */
    EXCEEDED;

    static final double WARNING_PERCENT = 80.0;
    static final double CRITICAL_PERCENT = 90.0;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    static BudgetLevel of(boolean hasBudget, boolean exceeded, double usedPercent) {
        if (!hasBudget) {
            return OK;
        }
        if (exceeded) {
            return EXCEEDED;
        }
        if (usedPercent >= CRITICAL_PERCENT) {
            return CRITICAL;
        }
        if (usedPercent >= WARNING_PERCENT) {
            return WARNING;
        }
        return OK;
    }
}
