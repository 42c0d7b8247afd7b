package org.neuralchilli.marshal.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Computes per-step token ceilings and admits or denies steps before they run.
 *
 * <p>Ceiling = {@code base * load * priority * behavior * health}, where
 * <ul>
 *   <li>load = {@code clamp(1 / (current / 0.8), 0.5, 2.0)}, current being in-flight grants over capacity</li>
 *   <li>priority = 0.7 / 1.0 / 1.3 / 1.5 for low / normal / high / critical</li>
 *   <li>behavior = {@code clamp(0.6 * success + 0.4 * compliance, 0.8, 1.2)} over the trailing window</li>
 *   <li>health = {@code clamp(0.4 * uptime + 0.4 * (1 - errorRate) + 0.2 * (1 - latency/target), 0.7, 1.0)}</li>
 * </ul>
 * clamped to {@code [0.3 * base, 3.0 * base]} and then to the run or global per-step cap.
 */
public class ResourceMonitor {

    private static final Logger log = LoggerFactory.getLogger(ResourceMonitor.class);

    static final double TARGET_LOAD = 0.8;

    private final ResourceSettings settings;
    private final BehaviorTracker behavior;
    private final HealthTracker health;

    private final AtomicLong inFlightTokens = new AtomicLong();
    private final AtomicLong totalGranted = new AtomicLong();
    private final AtomicLong totalConsumed = new AtomicLong();
    private final AtomicLong denials = new AtomicLong();
    private final AtomicLong throttles = new AtomicLong();
    private final Map<String, StepAccount> accounts = new ConcurrentHashMap<>();
    // reduced grant of steps flagged for manual review, by step name
    private final Map<String, Long> throttledGrants = new ConcurrentHashMap<>();

    public ResourceMonitor(ResourceSettings settings, Clock clock) {
        this(settings, new BehaviorTracker(settings.behaviorWindow(), clock),
                new HealthTracker(settings.latencyTarget()));
    }

    public ResourceMonitor(ResourceSettings settings, BehaviorTracker behavior, HealthTracker health) {
        this.settings = settings;
        this.behavior = behavior;
        this.health = health;
    }

    public ResourceSettings settings() {
        return settings;
    }

    public BehaviorTracker behavior() {
        return behavior;
    }

    public HealthTracker health() {
        return health;
    }

    /**
     * Current token ceiling for a step, with its multiplier breakdown.
     */
    public TokenBudget calculate(AdmissionRequest request) {
        long base = request.baseBudget();
        double load = loadMultiplier(currentLoad());
        double priority = request.priority().multiplier();
        double behaviorFactor = behavior.multiplier(request.stepName());
        double healthFactor = health.multiplier();

        double raw = base * load * priority * behaviorFactor * healthFactor;
        double bounded = clamp(raw, TokenBudget.MIN_FACTOR * base, TokenBudget.MAX_FACTOR * base);
        long limit = (long) Math.floor(bounded);

        Long cap = request.maxTokensPerStep() != null ? request.maxTokensPerStep() : settings.maxTokensPerStep();
        if (cap != null && cap < limit) {
            limit = cap;
        }

        return new TokenBudget(base, load, priority, behaviorFactor, healthFactor, limit);
    }

    /**
     * APPROVE when the request fits under the ceiling, granting what was
     * requested, or the reduced grant of a throttled step; DENY otherwise. An
     * approval counts as in-flight until {@link #release(String, long)}.
     */
    public AdmissionDecision admit(AdmissionRequest request) {
        TokenBudget budget = calculate(request);

        if (request.requestedTokens() <= budget.limit()) {
            long granted = request.requestedTokens();
            Long throttledTo = throttledGrants.get(request.stepName());
            if (throttledTo != null && throttledTo < granted) {
                log.info("Step {} of run {} is throttled: granting {} of {} requested tokens",
                        request.stepName(), request.runId(), throttledTo, granted);
                granted = throttledTo;
            }
            inFlightTokens.addAndGet(granted);
            totalGranted.addAndGet(granted);
            long grant = granted;
            accounts.merge(request.stepName(), StepAccount.EMPTY.admitted(grant), (a, b) -> a.admitted(grant));
            log.debug("Admitted step {} of run {}: {} tokens (limit {})",
                    request.stepName(), request.runId(), granted, budget.limit());
            return AdmissionDecision.approve(request, budget, granted);
        }

        denials.incrementAndGet();
        accounts.merge(request.stepName(), StepAccount.EMPTY.denied(), (a, b) -> a.denied());
        AdmissionDecision decision = AdmissionDecision.deny(request, budget);
        log.warn("Denied step {} of run {}: requested {} tokens, maximum allowed {}, suggested {}",
                request.stepName(), request.runId(), request.requestedTokens(),
                decision.maximumAllowed(), decision.reductionSuggestion());
        return decision;
    }

    /**
     * Return a grant to the pool once the step is no longer running.
     */
    public void release(String stepName, long granted) {
        inFlightTokens.updateAndGet(current -> Math.max(current - granted, 0));
        log.trace("Released {} tokens of step {}", granted, stepName);
    }

    /**
     * Account for what a finished step consumed. Consumption over
     * {@code throttleRatio * granted} flags the step for manual review and cuts
     * its next grants to half of this one, until it again finishes within its grant.
     */
    public ConsumptionVerdict recordConsumption(String stepName, long granted, long consumed) {
        totalConsumed.addAndGet(consumed);

        boolean throttled = granted > 0 && consumed > settings.throttleRatio() * granted;
        boolean alert = granted > 0 && consumed > settings.alertThreshold() * granted;
        long newGranted = throttled ? Math.max(granted / 2, 1) : granted;

        if (throttled) {
            throttledGrants.put(stepName, newGranted);
        } else if (consumed <= granted && throttledGrants.remove(stepName) != null) {
            log.info("Step {} finished within its grant of {} tokens, throttle lifted", stepName, granted);
        }

        accounts.merge(stepName, StepAccount.EMPTY.consumed(consumed, throttled),
                (a, b) -> a.consumed(consumed, throttled));
        behavior.record(stepName, true, consumed <= granted);

        if (throttled) {
            throttles.incrementAndGet();
            log.warn("Step {} consumed {} tokens against a grant of {}; throttled to {} and flagged for review",
                    stepName, consumed, granted, newGranted);
        } else if (alert) {
            log.warn("Step {} used {}% of its {} token grant", stepName,
                    Math.round(100.0 * consumed / granted), granted);
        }

        return new ConsumptionVerdict(stepName, granted, consumed, throttled, newGranted, alert);
    }

    /**
     * Reduced grant a throttled step gets on its next admission, empty when not throttled
     */
    public OptionalLong throttledGrant(String stepName) {
        Long grant = throttledGrants.get(stepName);
        return grant != null ? OptionalLong.of(grant) : OptionalLong.empty();
    }

    /**
     * Record a step that ended without producing output
     */
    public void recordFailure(String stepName) {
        behavior.record(stepName, false, true);
    }

    public void recordAttempt(boolean success, Duration latency) {
        health.recordAttempt(success, latency);
    }

    public void recordRejection() {
        health.recordRejection();
    }

    public double currentLoad() {
        return (double) inFlightTokens.get() / settings.capacityTokens();
    }

    public ResourceSnapshot snapshot() {
        return new ResourceSnapshot(
                inFlightTokens.get(),
                settings.capacityTokens(),
                totalGranted.get(),
                totalConsumed.get(),
                denials.get(),
                throttles.get(),
                currentLoad(),
                health.multiplier(),
                new TreeMap<>(accounts)
        );
    }

    /**
     * {@code clamp(1 / (current / 0.8), 0.5, 2.0)}; an idle system gets the maximum
     */
    static double loadMultiplier(double current) {
        if (current <= 0.0) {
            return 2.0;
        }
        return clamp(TARGET_LOAD / current, 0.5, 2.0);
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
