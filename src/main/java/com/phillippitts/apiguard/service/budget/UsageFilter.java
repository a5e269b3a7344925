package com.phillippitts.apiguard.service.budget;

import java.util.Objects;

/**
 * Selects usage records by run and/or scope. A null field matches everything.
 */
public record UsageFilter(String runTag, String scopeTag) {

    public static final UsageFilter ALL = new UsageFilter(null, null);

    public static UsageFilter byRun(String runTag) {
        return new UsageFilter(runTag, null);
    }

    public static UsageFilter byScope(String scopeTag) {
        return new UsageFilter(null, scopeTag);
    }

    public boolean matches(UsageRecord record) {
        return (runTag == null || Objects.equals(runTag, record.runTag()))
                && (scopeTag == null || Objects.equals(scopeTag, record.scopeTag()));
    }
}
