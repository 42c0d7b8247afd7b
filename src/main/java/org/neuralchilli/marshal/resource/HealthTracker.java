package org.neuralchilli.marshal.resource;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * System health signals derived from step attempts: availability (share of calls
 * not rejected by an open circuit), error rate and mean latency.
 */
public class HealthTracker {

    private final Duration latencyTarget;
    private final AtomicLong attempts = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong rejections = new AtomicLong();
    private final AtomicLong totalLatencyMillis = new AtomicLong();

    public HealthTracker(Duration latencyTarget) {
        this.latencyTarget = latencyTarget;
    }

    public void recordAttempt(boolean success, Duration latency) {
        attempts.incrementAndGet();
        if (!success) {
            failures.incrementAndGet();
        }
        totalLatencyMillis.addAndGet(Math.max(latency.toMillis(), 0));
    }

    public void recordRejection() {
        rejections.incrementAndGet();
    }

    public double uptime() {
        long total = attempts.get() + rejections.get();
        return total == 0 ? 1.0 : 1.0 - (double) rejections.get() / total;
    }

    public double errorRate() {
        long total = attempts.get();
        return total == 0 ? 0.0 : (double) failures.get() / total;
    }

    /**
     * Mean latency over the target, capped at 1
     */
    public double latencyRatio() {
        long total = attempts.get();
        if (total == 0) {
            return 0.0;
        }
        double mean = (double) totalLatencyMillis.get() / total;
        return Math.min(mean / latencyTarget.toMillis(), 1.0);
    }

    /**
     * {@code clamp(0.4 * uptime + 0.4 * (1 - errorRate) + 0.2 * (1 - latency/target), 0.7, 1.0)}
     */
    public double multiplier() {
        double score = 0.4 * uptime() + 0.4 * (1.0 - errorRate()) + 0.2 * (1.0 - latencyRatio());
        return ResourceMonitor.clamp(score, 0.7, 1.0);
    }
}
