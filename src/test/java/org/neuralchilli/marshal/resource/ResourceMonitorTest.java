package org.neuralchilli.marshal.resource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.marshal.domain.Priority;
import org.neuralchilli.marshal.util.MutableClock;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class ResourceMonitorTest {

    private MutableClock clock;
    private ResourceMonitor monitor;

    @BeforeEach
    void setup() {
        clock = MutableClock.startingNow();
        monitor = new ResourceMonitor(
                new ResourceSettings(1000, 0.8, 1.5, Duration.ofDays(30), Duration.ofSeconds(30), null),
                clock);
    }

    @Test
    void shouldDoubleBaseBudgetWhenIdle() {
        TokenBudget budget = monitor.calculate(request("synthesize", 500, 500, Priority.NORMAL, null));

        assertThat(budget.loadMultiplier()).isEqualTo(2.0);
        assertThat(budget.behaviorMultiplier()).isEqualTo(1.0);
        assertThat(budget.healthMultiplier()).isEqualTo(1.0);
        assertThat(budget.limit()).isEqualTo(1000);
    }

    @Test
    void shouldCapCeilingAtThreeTimesBase() {
        TokenBudget budget = monitor.calculate(request("synthesize", 100, 100, Priority.CRITICAL, null));

        assertThat(budget.limit()).isEqualTo(300);
    }

    @Test
    void shouldFloorCeilingAtThirtyPercentOfBase() {
        // pushes load to twice capacity
        assertThat(monitor.admit(request("bulk", 2000, 1000, Priority.NORMAL, null)).approved()).isTrue();
        monitor.recordAttempt(false, Duration.ofMinutes(1));
        monitor.recordFailure("analyze");

        TokenBudget budget = monitor.calculate(request("analyze", 100, 1000, Priority.LOW, null));

        assertThat(budget.loadMultiplier()).isEqualTo(0.5);
        assertThat(budget.behaviorMultiplier()).isEqualTo(0.8);
        assertThat(budget.healthMultiplier()).isEqualTo(0.7);
        assertThat(budget.limit()).isEqualTo(300);
    }

    @Test
    void shouldShrinkCeilingAsLoadRises() {
        long idle = monitor.calculate(request("analyze", 100, 400, Priority.NORMAL, null)).limit();

        monitor.admit(request("ingest", 800, 400, Priority.NORMAL, null));
        TokenBudget loaded = monitor.calculate(request("analyze", 100, 400, Priority.NORMAL, null));

        assertThat(monitor.currentLoad()).isEqualTo(0.8);
        assertThat(loaded.loadMultiplier()).isEqualTo(1.0);
        assertThat(loaded.limit()).isLessThan(idle);
    }

    @Test
    void shouldGrantExactlyWhatWasRequested() {
        AdmissionDecision decision = monitor.admit(request("ingest", 300, 500, Priority.NORMAL, null));

        assertThat(decision.approved()).isTrue();
        assertThat(decision.granted()).isEqualTo(300);
        assertThat(monitor.snapshot().inFlightTokens()).isEqualTo(300);

        monitor.release("ingest", 300);

        assertThat(monitor.snapshot().inFlightTokens()).isZero();
        assertThat(monitor.snapshot().steps().get("ingest").admissions()).isEqualTo(1);
    }

    @Test
    void shouldDenyWithMaximumAndSuggestion() {
        AdmissionDecision decision = monitor.admit(request("analyze", 5000, 500, Priority.NORMAL, null));

        assertThat(decision.approved()).isFalse();
        assertThat(decision.granted()).isZero();
        assertThat(decision.maximumAllowed()).isEqualTo(1000);
        assertThat(decision.reductionSuggestion()).isEqualTo(800);
        assertThat(decision.toPayload())
                .containsEntry("decision", "DENY")
                .containsEntry("maximum_allowed", 1000L);
        assertThat(monitor.snapshot().denials()).isEqualTo(1);
        assertThat(monitor.currentLoad()).isZero();

        ResourceDeniedException exception = decision.toException();
        assertThat(exception.maximumAllowed()).isEqualTo(1000);
    }

    @Test
    void shouldApplyRunLevelCap() {
        TokenBudget budget = monitor.calculate(request("analyze", 100, 500, Priority.HIGH, 250L));

        assertThat(budget.limit()).isEqualTo(250);
    }

    @Test
    void shouldApplyGlobalCapWhenRunHasNone() {
        ResourceMonitor capped = new ResourceMonitor(
                new ResourceSettings(1000, 0.8, 1.5, Duration.ofDays(30), Duration.ofSeconds(30), 400L),
                clock);

        assertThat(capped.calculate(request("analyze", 100, 500, Priority.NORMAL, null)).limit()).isEqualTo(400);
        assertThat(capped.calculate(request("analyze", 100, 500, Priority.NORMAL, 200L)).limit()).isEqualTo(200);
    }

    @Test
    void shouldThrottleOverConsumption() {
        ConsumptionVerdict verdict = monitor.recordConsumption("analyze", 1000, 1600);

        assertThat(verdict.throttled()).isTrue();
        assertThat(verdict.newGranted()).isEqualTo(500);
        assertThat(verdict.toPayload()).containsEntry("manual_review", true);
        assertThat(monitor.snapshot().throttles()).isEqualTo(1);
    }

    @Test
    void shouldHalveNextGrantOfThrottledStepUntilItComplies() {
        monitor.recordConsumption("analyze", 1000, 1600);
        assertThat(monitor.throttledGrant("analyze")).hasValue(500);

        AdmissionDecision reduced = monitor.admit(request("analyze", 1000, 1000, Priority.NORMAL, null));

        assertThat(reduced.approved()).isTrue();
        assertThat(reduced.requested()).isEqualTo(1000);
        assertThat(reduced.granted()).isEqualTo(500);
        assertThat(monitor.snapshot().inFlightTokens()).isEqualTo(500);

        monitor.release("analyze", 500);
        monitor.recordConsumption("analyze", 500, 400);

        assertThat(monitor.throttledGrant("analyze")).isEmpty();
        assertThat(monitor.admit(request("analyze", 1000, 1000, Priority.NORMAL, null)).granted()).isEqualTo(1000);
    }

    @Test
    void shouldNotThrottleOtherSteps() {
        monitor.recordConsumption("analyze", 1000, 1600);

        assertThat(monitor.throttledGrant("report")).isEmpty();
        assertThat(monitor.admit(request("report", 400, 400, Priority.NORMAL, null)).granted()).isEqualTo(400);
    }

    @Test
    void shouldOnlyAlertBelowThrottleRatio() {
        ConsumptionVerdict verdict = monitor.recordConsumption("analyze", 1000, 1400);

        assertThat(verdict.throttled()).isFalse();
        assertThat(verdict.alert()).isTrue();
        assertThat(verdict.newGranted()).isEqualTo(1000);
    }

    @Test
    void shouldForgetBehaviorOutsideWindow() {
        monitor.recordFailure("analyze");
        assertThat(monitor.behavior().multiplier("analyze")).isEqualTo(0.8);

        clock.advance(Duration.ofDays(31));

        assertThat(monitor.behavior().multiplier("analyze")).isEqualTo(1.0);
    }

    private static AdmissionRequest request(String step, long requested, long base, Priority priority, Long cap) {
        return new AdmissionRequest("run-1", step, requested, base, priority, cap);
    }
}
