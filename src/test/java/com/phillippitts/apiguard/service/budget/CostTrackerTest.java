package com.phillippitts.apiguard.service.budget;

import com.phillippitts.apiguard.exception.BudgetExceededException;
import com.phillippitts.apiguard.service.alert.Alert;
import com.phillippitts.apiguard.service.alert.AlertLevel;
import com.phillippitts.apiguard.service.metrics.GovernanceMetricsPublisher;
import com.phillippitts.apiguard.testutil.MutableClock;
import com.phillippitts.apiguard.testutil.RecordingAlertSink;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CostTrackerTest {

    private static final double EPS = 1e-9;

    private MutableClock clock;
    private RecordingAlertSink alerts;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-06-01T12:30:00Z");
        alerts = new RecordingAlertSink();
    }

    private CostTracker tracker(CostTrackerConfig config) {
        return new CostTracker("job-42", config, ModelPricing.defaults(), clock, alerts,
                GovernanceMetricsPublisher.NOOP);
    }

    @Test
    void estimateCostUsesModelPrice() {
        CostTracker tracker = tracker(CostTrackerConfig.unlimited());

        assertThat(tracker.estimateCost("gpt-4o", 1_000_000, 1_000_000)).isCloseTo(12.50, within(EPS));
        assertThat(tracker.estimateCost("gpt-4o-mini", 2_000_000, 0)).isCloseTo(0.30, within(EPS));
    }

    @Test
    void trackUsageAppendsPricedRecord() {
        CostTracker tracker = tracker(CostTrackerConfig.unlimited().withScopeId("job-42"));

        UsageRecord record = tracker.trackUsage("openai", "gpt-4o", 1000, 500, "extract", "run-1", null);

        assertThat(record.estimatedCost()).isCloseTo(0.0025 + 0.005, within(EPS));
        assertThat(record.scopeTag()).isEqualTo("job-42");
        assertThat(record.timestamp()).isEqualTo(clock.instant());
        assertThat(tracker.getUsages()).containsExactly(record);
    }

    @Test
    void totalsAreMonotonicAndMatchRecords() {
        CostTracker tracker = tracker(CostTrackerConfig.unlimited());
        double previous = 0.0;

        for (int i = 0; i < 20; i++) {
            tracker.trackUsage("openai", "gpt-4o-mini", 1000L * i, 100L * i);
            double total = tracker.getSummary().totalCostUsd();
            assertThat(total).isGreaterThanOrEqualTo(previous);
            previous = total;
        }

        double sum = tracker.getUsages().stream().mapToDouble(UsageRecord::estimatedCost).sum();
        assertThat(tracker.getSummary().totalCostUsd()).isCloseTo(sum, within(EPS));
        assertThat(tracker.getSummary().callsCount()).isEqualTo(20);
    }

    @Test
    void summaryBreaksDownByProviderAndLayer() {
        CostTracker tracker = tracker(CostTrackerConfig.unlimited());
        tracker.trackUsage("openai", "gpt-4o", 100, 10, "extract", null, null);
        tracker.trackUsage("openai", "gpt-4o", 200, 20, "summarize", null, null);
        tracker.trackUsage("anthropic", "claude-3-5-haiku-20241022", 300, 30);

        UsageSummary summary = tracker.getSummary();

        assertThat(summary.totalInputUnits()).isEqualTo(600);
        assertThat(summary.totalOutputUnits()).isEqualTo(60);
        assertThat(summary.byProvider().keySet()).containsExactly("anthropic", "openai");
        assertThat(summary.byProvider().get("openai").calls()).isEqualTo(2);
        assertThat(summary.byLayer().keySet()).containsExactly("extract", "summarize", UsageSummary.UNKNOWN_LAYER);
    }

    @Test
    void summaryFiltersByRunAndScope() {
        CostTracker tracker = tracker(CostTrackerConfig.unlimited());
        tracker.trackUsage("openai", "gpt-4o", 100, 0, null, "run-1", "job-a");
        tracker.trackUsage("openai", "gpt-4o", 100, 0, null, "run-2", "job-a");
        tracker.trackUsage("openai", "gpt-4o", 100, 0, null, "run-1", "job-b");

        assertThat(tracker.getSummary(UsageFilter.byRun("run-1")).callsCount()).isEqualTo(2);
        assertThat(tracker.getSummary(UsageFilter.byScope("job-a")).callsCount()).isEqualTo(2);
        assertThat(tracker.getSummary(new UsageFilter("run-1", "job-b")).callsCount()).isEqualTo(1);
        assertThat(tracker.getSummary(UsageFilter.byRun("missing"))).isEqualTo(UsageSummary.EMPTY);
    }

    @Test
    void enforcedBudgetThrowsAfterStoringRecord() {
        CostTracker tracker = tracker(CostTrackerConfig.withBudget(1.00));

        assertThatThrownBy(() -> tracker.trackUsage("openrouter", "mystery-model", 600_000, 0))
                .isInstanceOfSatisfying(BudgetExceededException.class, ex -> {
                    assertThat(ex.getSummary().totalCostUsd()).isCloseTo(1.20, within(EPS));
                    assertThat(ex.getBudgetCeiling()).isEqualTo(1.00);
                });

        assertThat(tracker.getUsages()).hasSize(1);
        assertThat(tracker.isBudgetExceeded()).isTrue();
        assertThat(tracker.getRemainingBudget()).hasValue(0.0);
    }

    @Test
    void costExactlyAtCeilingIsNotExceeded() {
        CostTracker tracker = tracker(CostTrackerConfig.withBudget(2.00));

        tracker.trackUsage("openai", "unknown-model", 1_000_000, 0);

        assertThat(tracker.isBudgetExceeded()).isFalse();
        assertThat(tracker.getBudgetUsedPercent()).isCloseTo(100.0, within(EPS));
        assertThat(tracker.getRemainingBudget().getAsDouble()).isCloseTo(0.0, within(EPS));
    }

    @Test
    void unenforcedBudgetOnlyAlerts() {
        CostTracker tracker = tracker(CostTrackerConfig.withBudget(1.00).withEnforceBudget(false));

        tracker.trackUsage("openai", "unknown-model", 600_000, 0);

        assertThat(tracker.isBudgetExceeded()).isTrue();
        assertThat(alerts.alertsAt(AlertLevel.CRITICAL)).singleElement()
                .satisfies(alert -> {
                    assertThat(alert.source()).isEqualTo(Alert.SOURCE_BUDGET_TRACKER);
                    assertThat(alert.message()).isEqualTo("BUDGET EXCEEDED: 'job-42' at $1.20 (limit: $1.00)");
                });
    }

    @Test
    void warningAlertFiresOnceAtEightyPercent() {
        CostTracker tracker = tracker(CostTrackerConfig.withBudget(10.00));

        tracker.trackUsage("openai", "unknown-model", 3_000_000, 0);
        assertThat(alerts.alerts()).isEmpty();

        tracker.trackUsage("openai", "unknown-model", 1_000_000, 0);
        tracker.trackUsage("openai", "unknown-model", 500_000, 0);

        assertThat(alerts.alertsAt(AlertLevel.WARNING)).singleElement()
                .extracting(Alert::message)
                .isEqualTo("Budget warning: 'job-42' at 80.0% ($8.00/$10.00)");
    }

    @Test
    void unlimitedTrackerReportsNoBudget() {
        CostTracker tracker = tracker(CostTrackerConfig.unlimited());
        tracker.trackUsage("openai", "gpt-4-turbo", 10_000_000, 10_000_000);

        assertThat(tracker.getRemainingBudget()).isEmpty();
        assertThat(tracker.isBudgetExceeded()).isFalse();
        assertThat(tracker.getBudgetUsedPercent()).isZero();
        assertThat(alerts.alerts()).isEmpty();
    }

    @Test
    void hourlyCostsAreDenseAndZeroFilled() {
        CostTracker tracker = tracker(CostTrackerConfig.unlimited());
        clock.set(Instant.parse("2024-06-01T09:15:00Z"));
        tracker.trackUsage("openai", "unknown-model", 1_000_000, 0);
        clock.set(Instant.parse("2024-06-01T12:05:00Z"));
        tracker.trackUsage("openai", "unknown-model", 500_000, 0);
        tracker.trackUsage("openai", "unknown-model", 500_000, 0);
        clock.set(Instant.parse("2024-06-01T12:30:00Z"));

        List<CostBucket> buckets = tracker.getHourlyCosts(4);

        assertThat(buckets).extracting(CostBucket::start).containsExactly(
                Instant.parse("2024-06-01T09:00:00Z"),
                Instant.parse("2024-06-01T10:00:00Z"),
                Instant.parse("2024-06-01T11:00:00Z"),
                Instant.parse("2024-06-01T12:00:00Z"));
        assertThat(buckets).extracting(CostBucket::calls).containsExactly(1, 0, 0, 2);
        assertThat(buckets.get(0).costUsd()).isCloseTo(2.0, within(EPS));
        assertThat(buckets.get(3).costUsd()).isCloseTo(2.0, within(EPS));
    }

    @Test
    void dailyCostsExcludeUsageOutsideWindow() {
        CostTracker tracker = tracker(CostTrackerConfig.unlimited());
        clock.set(Instant.parse("2024-05-20T10:00:00Z"));
        tracker.trackUsage("openai", "unknown-model", 1_000_000, 0);
        clock.set(Instant.parse("2024-05-31T23:59:59Z"));
        tracker.trackUsage("openai", "unknown-model", 1_000_000, 0);
        clock.set(Instant.parse("2024-06-01T12:00:00Z"));

        List<CostBucket> buckets = tracker.getDailyCosts(7);

        assertThat(buckets).hasSize(7);
        assertThat(buckets.get(6).start()).isEqualTo(Instant.parse("2024-06-01T00:00:00Z"));
        assertThat(buckets.get(5).calls()).isEqualTo(1);
        assertThat(buckets.stream().mapToInt(CostBucket::calls).sum()).isEqualTo(1);
    }

    @Test
    void costHistoryRejectsNonPositiveCount() {
        CostTracker tracker = tracker(CostTrackerConfig.unlimited());

        assertThatThrownBy(() -> tracker.getHourlyCosts(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resetClearsRecordsAndRearmsWarning() {
        CostTracker tracker = tracker(CostTrackerConfig.withBudget(1.00).withEnforceBudget(false));
        tracker.trackUsage("openai", "unknown-model", 450_000, 0);
        assertThat(alerts.alertsAt(AlertLevel.WARNING)).hasSize(1);

        tracker.reset();
        tracker.trackUsage("openai", "unknown-model", 450_000, 0);

        assertThat(tracker.getUsages()).hasSize(1);
        assertThat(alerts.alertsAt(AlertLevel.WARNING)).hasSize(2);
    }

    @Test
    void rejectsNegativeUnits() {
        CostTracker tracker = tracker(CostTrackerConfig.unlimited());

        assertThatThrownBy(() -> tracker.trackUsage("openai", "gpt-4o", -1, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(tracker.getUsages()).isEmpty();
    }

    @Test
    void toMapRoundsOnlyOnExport() {
        CostTracker tracker = tracker(CostTrackerConfig.withBudget(5.00).withScopeId("job-42"));
        tracker.trackUsage("openai", "gpt-4o-mini", 1234, 567, "extract", "run-1", null);

        Map<String, Object> map = tracker.toMap();

        assertThat(map).containsEntry("name", "job-42")
                .containsEntry("job_id", "job-42")
                .containsEntry("budget_usd", 5.00)
                .containsEntry("calls_count", 1)
                .containsEntry("total_cost_usd", 0.0005)
                .containsEntry("budget_exceeded", false)
                .containsKeys("by_provider", "by_layer", "budget_remaining_usd", "budget_used_percent");
        assertThat(map).extractingByKey("usages", InstanceOfAssertFactories.LIST)
                .singleElement(InstanceOfAssertFactories.MAP)
                .containsEntry("input_tokens", 1234L)
                .containsEntry("layer", "extract")
                .containsEntry("run_id", "run-1")
                .containsEntry("scope", "job-42")
                .containsEntry("cost_usd", 0.000525);
        assertThat(tracker.getSummary().totalCostUsd()).isCloseTo(0.00018510 + 0.0003402, within(EPS));
    }

    @Test
    void clockMovesDoNotAffectStoredTimestamps() {
        CostTracker tracker = tracker(CostTrackerConfig.unlimited());
        Instant first = clock.instant();
        tracker.trackUsage("openai", "gpt-4o", 1, 1);

        clock.advance(Duration.ofHours(3));

        assertThat(tracker.getUsages().get(0).timestamp()).isEqualTo(first);
    }
}
