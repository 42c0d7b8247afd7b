package org.neuralchilli.marshal.state;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import org.neuralchilli.marshal.domain.LedgerEvent;
import org.neuralchilli.marshal.domain.Run;
import org.neuralchilli.marshal.domain.StepState;
import org.neuralchilli.marshal.domain.StepStatus;
import org.neuralchilli.marshal.ledger.EventLedger;
import org.neuralchilli.marshal.service.RunNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persists run records and step states in Hazelcast and recovers them for resume.
 *
 * <p>Step states live in one map per run ({@code <namespace>-steps-<runId>}) plus a
 * namespace-wide idempotency index from key to {@link StepStateKey}. Run records are
 * shared by every namespace, so a replay sandbox's run is visible next to the
 * original it replays.
 */
public class StateManager {

    private static final Logger log = LoggerFactory.getLogger(StateManager.class);

    private final HazelcastInstance hazelcast;
    private final EventLedger ledger;
    private final String namespace;
    private final String runsMapName;
    private final Duration stalenessThreshold;
    private final Clock clock;

    private final IMap<String, Run> runs;
    private final IMap<String, StepStateKey> idempotencyIndex;

    public StateManager(
            HazelcastInstance hazelcast,
            EventLedger ledger,
            String namespace,
            Duration stalenessThreshold,
            Clock clock
    ) {
        this(hazelcast, ledger, namespace, namespace + "-runs", stalenessThreshold, clock);
    }

    private StateManager(
            HazelcastInstance hazelcast,
            EventLedger ledger,
            String namespace,
            String runsMapName,
            Duration stalenessThreshold,
            Clock clock
    ) {
        this.hazelcast = hazelcast;
        this.ledger = ledger;
        this.namespace = namespace;
        this.runsMapName = runsMapName;
        this.stalenessThreshold = stalenessThreshold;
        this.clock = clock;
        this.runs = hazelcast.getMap(runsMapName);
        this.idempotencyIndex = hazelcast.getMap(namespace + "-idempotency");
    }

    /**
     * State manager for a replay run: its own step namespace, shared run records
     */
    public StateManager sandboxFor(String replayRunId) {
        String sandboxNamespace = namespace + "-replay-" + replayRunId;
        log.debug("Opening state sandbox '{}'", sandboxNamespace);
        return new StateManager(hazelcast, ledger, sandboxNamespace, runsMapName, stalenessThreshold, clock);
    }

    /**
     * State manager holding the step states of {@code run}
     */
    public StateManager forRun(Run run) {
        return run.isReplay() ? sandboxFor(run.runId()) : this;
    }

    public String namespace() {
        return namespace;
    }

    public Duration stalenessThreshold() {
        return stalenessThreshold;
    }

    // Step states

    public Optional<StepState> get(String runId, String stepName) {
        return Optional.ofNullable(steps(runId).get(stepName));
    }

    /**
     * Store a step state. A COMPLETED state already on record is never replaced.
     */
    public void put(StepState state) {
        IMap<String, StepState> map = steps(state.runId());
        StepState existing = map.get(state.stepName());
        if (existing != null && existing.isCompleted()) {
            if (!existing.equals(state)) {
                throw new IllegalStateException("Step " + state.runId() + "/" + state.stepName()
                        + " is already COMPLETED");
            }
            return;
        }
        map.set(state.stepName(), state);
        idempotencyIndex.set(state.idempotencyKey(), new StepStateKey(state.runId(), state.stepName()));
    }

    public Map<String, StepState> getAll(String runId) {
        return new HashMap<>(steps(runId));
    }

    public Optional<StepState> findByIdempotencyKey(String idempotencyKey) {
        StepStateKey key = idempotencyIndex.get(idempotencyKey);
        if (key == null) {
            return Optional.empty();
        }
        return get(key.runId(), key.stepName())
                .filter(s -> s.idempotencyKey().equals(idempotencyKey));
    }

    /**
     * Reload a run and put abandoned RUNNING states back to PENDING.
     * A RUNNING state counts as abandoned once its step's last ledger event is
     * older than the staleness threshold.
     */
    public RunState recover(String runId) {
        Run run = getRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
        Map<String, StepState> states = getAll(runId);
        Set<String> reset = new HashSet<>();
        Instant cutoff = clock.instant().minus(stalenessThreshold);

        for (StepState state : List.copyOf(states.values())) {
            if (state.status() != StepStatus.RUNNING) {
                continue;
            }
            Instant lastActivity = ledger.lastForStep(runId, state.stepName())
                    .map(LedgerEvent::timestamp)
                    .orElse(state.updatedAt());
            if (lastActivity.isBefore(cutoff)) {
                StepState pending = state.resetToPending();
                put(pending);
                states.put(pending.stepName(), pending);
                reset.add(pending.stepName());
                log.info("Recovered abandoned step {}/{} (last activity {})",
                        runId, state.stepName(), lastActivity);
            }
        }

        log.debug("Recovered run {}: {} step states, {} reset", runId, states.size(), reset.size());
        return new RunState(run, states, reset);
    }

    // Runs

    public void saveRun(Run run) {
        runs.set(run.runId(), run);
    }

    public Optional<Run> getRun(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    public List<Run> listRuns() {
        return runs.values().stream()
                .sorted(Comparator.comparing(Run::createdAt).reversed())
                .toList();
    }

    /**
     * Retention hook: drop finished runs created before {@code cutoff} together
     * with their step states, idempotency entries and ledger.
     *
     * @return number of runs removed
     */
    public int deleteBefore(Instant cutoff) {
        int removed = 0;
        for (Run run : List.copyOf(runs.values())) {
            if (!run.isFinished() || !run.createdAt().isBefore(cutoff)) {
                continue;
            }
            forRun(run).deleteSteps(run.runId());
            ledger.deleteRun(run.runId());
            runs.delete(run.runId());
            removed++;
        }
        if (removed > 0) {
            log.info("Retention removed {} runs created before {}", removed, cutoff);
        }
        return removed;
    }

    public void deleteSteps(String runId) {
        IMap<String, StepState> map = steps(runId);
        for (StepState state : map.values()) {
            idempotencyIndex.remove(state.idempotencyKey());
        }
        map.destroy();
    }

    private IMap<String, StepState> steps(String runId) {
        return hazelcast.getMap(namespace + "-steps-" + runId);
    }
}
