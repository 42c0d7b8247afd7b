package org.neuralchilli.marshal.resilience;

import org.neuralchilli.marshal.domain.CircuitBreakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Failure state machine guarding one step.
 *
 * <pre>
 * CLOSED --threshold consecutive failures--> OPEN
 * OPEN --recovery timeout elapsed, next call--> HALF_OPEN (single trial)
 * HALF_OPEN --trial succeeds--> CLOSED
 * HALF_OPEN --trial fails--> OPEN
 * </pre>
 *
 * All transitions are compare-and-swap on an immutable {@link Snapshot}.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    /**
     * @param openedAt        when the circuit last opened, null while closed
     * @param trialInFlight   whether the single HALF_OPEN trial has been handed out
     */
    public record Snapshot(
            CircuitState state,
            int consecutiveFailures,
            Instant openedAt,
            boolean trialInFlight
    ) {
        static Snapshot closed() {
            return new Snapshot(CircuitState.CLOSED, 0, null, false);
        }
    }

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final AtomicReference<Snapshot> state = new AtomicReference<>(Snapshot.closed());

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = name;
        this.config = config;
        this.clock = clock;
    }

    public String name() {
        return name;
    }

    public CircuitBreakerConfig config() {
        return config;
    }

    public Snapshot snapshot() {
        return state.get();
    }

    public CircuitState state() {
        return state.get().state();
    }

    /**
     * Ask to make a call. Returns false when the call must be rejected; a rejected
     * call does not count as an attempt.
     */
    public boolean tryAcquire() {
        while (true) {
            Snapshot current = state.get();
            switch (current.state()) {
                case CLOSED:
                    return true;
                case OPEN: {
                    if (clock.instant().isBefore(current.openedAt().plus(config.recoveryTimeout()))) {
                        return false;
                    }
                    Snapshot trial = new Snapshot(CircuitState.HALF_OPEN,
                            current.consecutiveFailures(), current.openedAt(), true);
                    if (state.compareAndSet(current, trial)) {
                        log.info("Circuit '{}' half-open, admitting trial call", name);
                        return true;
                    }
                    break;
                }
                case HALF_OPEN: {
                    if (current.trialInFlight()) {
                        return false;
                    }
                    Snapshot trial = new Snapshot(CircuitState.HALF_OPEN,
                            current.consecutiveFailures(), current.openedAt(), true);
                    if (state.compareAndSet(current, trial)) {
                        return true;
                    }
                    break;
                }
                default:
                    throw new IllegalStateException("Unknown circuit state: " + current.state());
            }
        }
    }

    /**
     * @return true if this success closed a HALF_OPEN circuit
     */
    public boolean recordSuccess() {
        while (true) {
            Snapshot current = state.get();
            if (current.state() == CircuitState.CLOSED && current.consecutiveFailures() == 0) {
                return false;
            }
            if (state.compareAndSet(current, Snapshot.closed())) {
                boolean recovered = current.state() != CircuitState.CLOSED;
                if (recovered) {
                    log.info("Circuit '{}' closed after successful trial", name);
                }
                return recovered;
            }
        }
    }

    /**
     * @return true if this failure opened the circuit
     */
    public boolean recordFailure() {
        while (true) {
            Snapshot current = state.get();
            int failures = current.consecutiveFailures() + 1;
            Snapshot next;
            switch (current.state()) {
                case CLOSED:
                    next = failures >= config.failureThreshold()
                            ? new Snapshot(CircuitState.OPEN, failures, clock.instant(), false)
                            : new Snapshot(CircuitState.CLOSED, failures, null, false);
                    break;
                case HALF_OPEN:
                    next = new Snapshot(CircuitState.OPEN, failures, clock.instant(), false);
                    break;
                default:
                    // late failure from a call admitted before the circuit opened;
                    // recovery is measured from the last failure
                    next = new Snapshot(CircuitState.OPEN, failures, clock.instant(), false);
                    break;
            }
            if (state.compareAndSet(current, next)) {
                boolean opened = current.state() != CircuitState.OPEN && next.state() == CircuitState.OPEN;
                if (opened) {
                    log.warn("Circuit '{}' opened after {} consecutive failures", name, failures);
                }
                return opened;
            }
        }
    }

    /**
     * Hand back a HALF_OPEN trial that was acquired but never made, so the next
     * caller can take it. No effect in any other state.
     *
     * @return true if a trial was released
     */
    public boolean releaseTrial() {
        while (true) {
            Snapshot current = state.get();
            if (current.state() != CircuitState.HALF_OPEN || !current.trialInFlight()) {
                return false;
            }
            Snapshot released = new Snapshot(CircuitState.HALF_OPEN,
                    current.consecutiveFailures(), current.openedAt(), false);
            if (state.compareAndSet(current, released)) {
                log.info("Circuit '{}' trial released without a call", name);
                return true;
            }
        }
    }

    /**
     * Time left until an OPEN circuit admits a trial; zero otherwise.
     */
    public Duration retryAfter() {
        Snapshot current = state.get();
        if (current.state() != CircuitState.OPEN) {
            return Duration.ZERO;
        }
        Duration left = Duration.between(clock.instant(), current.openedAt().plus(config.recoveryTimeout()));
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Force the circuit closed
     */
    public void reset() {
        state.set(Snapshot.closed());
        log.info("Circuit '{}' reset", name);
    }
}
