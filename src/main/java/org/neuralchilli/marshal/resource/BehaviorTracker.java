package org.neuralchilli.marshal.resource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Success and budget-compliance history per step over a trailing window.
 */
public class BehaviorTracker {

    private record Outcome(Instant at, boolean success, boolean compliant) {
    }

    private final Duration window;
    private final Clock clock;
    private final Map<String, Deque<Outcome>> history = new ConcurrentHashMap<>();

    public BehaviorTracker(Duration window, Clock clock) {
        this.window = window;
        this.clock = clock;
    }

    public void record(String stepName, boolean success, boolean compliant) {
        Deque<Outcome> outcomes = history.computeIfAbsent(stepName, k -> new ArrayDeque<>());
        synchronized (outcomes) {
            outcomes.addLast(new Outcome(clock.instant(), success, compliant));
            evict(outcomes);
        }
    }

    public double successRate(String stepName) {
        return rate(stepName, true);
    }

    public double complianceRate(String stepName) {
        return rate(stepName, false);
    }

    /**
     * {@code clamp(0.6 * success + 0.4 * compliance, 0.8, 1.2)}; a step without history scores 1.0
     */
    public double multiplier(String stepName) {
        double score = 0.6 * successRate(stepName) + 0.4 * complianceRate(stepName);
        return ResourceMonitor.clamp(score, 0.8, 1.2);
    }

    private double rate(String stepName, boolean success) {
        Deque<Outcome> outcomes = history.get(stepName);
        if (outcomes == null) {
            return 1.0;
        }
        synchronized (outcomes) {
            evict(outcomes);
            if (outcomes.isEmpty()) {
                return 1.0;
            }
            long good = outcomes.stream()
                    .filter(o -> success ? o.success() : o.compliant())
                    .count();
            return (double) good / outcomes.size();
        }
    }

    private void evict(Deque<Outcome> outcomes) {
        Instant cutoff = clock.instant().minus(window);
        while (!outcomes.isEmpty() && outcomes.peekFirst().at().isBefore(cutoff)) {
            outcomes.removeFirst();
        }
    }
}
