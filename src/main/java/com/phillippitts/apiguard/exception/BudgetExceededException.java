package com.phillippitts.apiguard.exception;

import com.phillippitts.apiguard.service.budget.UsageSummary;

import java.util.Locale;
import java.util.Objects;

/**
 * Thrown when a cost tracker enforces its budget and cumulative cost goes strictly above
 * the ceiling. This is a hard stop for the scope that triggered it: callers should abort
 * further paid calls for that job or run.
 *
 * <p>The usage record that crossed the ceiling has already been stored when this is thrown.
 */
public class BudgetExceededException extends ApiGuardException {

    private final UsageSummary summary;
    private final double budgetCeiling;

    public BudgetExceededException(UsageSummary summary, double budgetCeiling) {
        super(String.format(Locale.ROOT,
                "Token budget exceeded: $%.4f / $%.2f (%,d tokens across %d calls)",
                Objects.requireNonNull(summary, "summary").totalCostUsd(),
                budgetCeiling,
                summary.totalUnits(),
                summary.callsCount()));
        this.summary = summary;
        this.budgetCeiling = budgetCeiling;
    }

    public UsageSummary getSummary() {
        return summary;
    }

    public double getBudgetCeiling() {
        return budgetCeiling;
    }
}
