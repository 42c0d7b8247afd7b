package org.neuralchilli.marshal.replay;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.neuralchilli.marshal.core.DagService;
import org.neuralchilli.marshal.core.PipelineScheduler;
import org.neuralchilli.marshal.core.RunSession;
import org.neuralchilli.marshal.domain.PipelineTemplate;
import org.neuralchilli.marshal.domain.Run;
import org.neuralchilli.marshal.domain.StepState;
import org.neuralchilli.marshal.ledger.EventLedger;
import org.neuralchilli.marshal.ledger.LedgerVerification;
import org.neuralchilli.marshal.service.PipelineRegistry;
import org.neuralchilli.marshal.service.RunNotFoundException;
import org.neuralchilli.marshal.service.ValidationException;
import org.neuralchilli.marshal.state.StateManager;
import org.neuralchilli.marshal.util.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Re-executes a finished run in a sandbox and compares the outputs.
 *
 * <p>The replay run gets its own id, ledger and step-state namespace but keeps
 * the original run's identity for everything that shapes step behaviour: seed,
 * parameters and idempotency keys. Steps outside the requested subset are copied
 * into the sandbox as COMPLETED, so their outputs feed downstream steps without
 * being re-executed.
 */
public class ReplayEngine {

    private static final Logger log = LoggerFactory.getLogger(ReplayEngine.class);

    private final PipelineScheduler scheduler;
    private final StateManager states;
    private final EventLedger ledger;
    private final PipelineRegistry pipelines;
    private final DagService dagService;
    private final String engineVersion;
    private final Clock clock;

    public ReplayEngine(
            PipelineScheduler scheduler,
            StateManager states,
            EventLedger ledger,
            PipelineRegistry pipelines,
            DagService dagService,
            String engineVersion,
            Clock clock
    ) {
        this.scheduler = scheduler;
        this.states = states;
        this.ledger = ledger;
        this.pipelines = pipelines;
        this.dagService = dagService;
        this.engineVersion = engineVersion;
        this.clock = clock;
    }

    public String engineVersion() {
        return engineVersion;
    }

    public ReplayResult replay(String runId) {
        return replay(runId, ReplayOptions.all());
    }

    /**
     * Replay {@code runId}, or the run it replays when it is itself a replay.
     *
     * @throws RunNotFoundException if the run is unknown
     * @throws ValidationException  if the run is still executing, its ledger fails
     *                              verification, or it was recorded by another
     *                              engine version and {@code options.override()} is off
     */
    public ReplayResult replay(String runId, ReplayOptions options) {
        Run original = resolveOriginal(runId);
        checkReplayable(original, options);

        PipelineTemplate template = pipelines.require(original.templateName());
        DirectedAcyclicGraph<String, DefaultEdge> dag = dagService.buildDag(template);
        Set<String> subset = dagService.subset(dag, options.fromStep(), options.toStep());

        String replayRunId = Identifiers.newRunId(clock);
        Run replayRun = Run.replayOf(original, replayRunId, engineVersion);
        states.saveRun(replayRun);
        StateManager sandbox = states.sandboxFor(replayRunId);

        Map<String, StepState> originalStates = states.getAll(original.runId());
        Set<String> replayed = new LinkedHashSet<>();
        for (String stepName : dagService.topologicalOrder(dag)) {
            StepState recorded = originalStates.get(stepName);
            if (!subset.contains(stepName) && recorded != null && recorded.isCompleted()) {
                sandbox.put(recorded.copyFor(replayRunId));
            } else {
                replayed.add(stepName);
            }
        }

        log.info("Replaying run {} as {}: re-executing {} of {} steps {}",
                original.runId(), replayRunId, replayed.size(), originalStates.size(), replayed);

        RunSession session = scheduler.openSession(replayRun, template, sandbox);
        Run finished = PipelineScheduler.await(scheduler.execute(session));

        List<StepDiff> diffs = new ArrayList<>();
        for (String stepName : replayed) {
            diffs.add(compare(stepName, originalStates.get(stepName), sandbox.get(replayRunId, stepName).orElse(null)));
        }
        boolean matched = diffs.stream().allMatch(StepDiff::matched);

        if (matched) {
            log.info("Replay {} of run {} reproduced all {} re-executed step(s)",
                    replayRunId, original.runId(), diffs.size());
        } else {
            diffs.stream()
                    .filter(d -> !d.matched())
                    .forEach(d -> log.warn("Replay {} of run {}: step {} diverged ({} field difference(s))",
                            replayRunId, original.runId(), d.stepName(), d.differences().size()));
        }
        return new ReplayResult(replayRunId, original.runId(), finished.status(), replayed, diffs, matched);
    }

    private Run resolveOriginal(String runId) {
        Run run = states.getRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
        if (!run.isReplay()) {
            return run;
        }
        log.debug("Run {} is a replay, replaying its original {}", runId, run.replayOf());
        return states.getRun(run.replayOf()).orElseThrow(() -> new RunNotFoundException(run.replayOf()));
    }

    private void checkReplayable(Run original, ReplayOptions options) {
        if (!original.isFinished() || scheduler.isActive(original.runId())) {
            throw new ValidationException("Run " + original.runId() + " has not finished (status "
                    + original.status() + ")");
        }

        LedgerVerification verification = ledger.verifyDetailed(original.runId());
        if (!verification.valid()) {
            throw new ValidationException("Refusing to replay run " + original.runId()
                    + ": ledger verification failed at event " + verification.brokenAtEventId()
                    + " (" + verification.reason() + ")");
        }

        if (!Objects.equals(original.engineVersion(), engineVersion)) {
            if (!options.override()) {
                throw new ValidationException("Run " + original.runId() + " was recorded by engine version "
                        + original.engineVersion() + ", current version is " + engineVersion
                        + "; replay with override to proceed anyway");
            }
            log.warn("Replaying run {} across engine versions ({} -> {})",
                    original.runId(), original.engineVersion(), engineVersion);
        }
    }

    static StepDiff compare(String stepName, StepState original, StepState replay) {
        String originalHash = original != null && original.isCompleted() ? original.outputHash() : null;
        String replayHash = replay != null && replay.isCompleted() ? replay.outputHash() : null;
        boolean matched = originalHash != null && originalHash.equals(replayHash);

        List<FieldDifference> differences = new ArrayList<>();
        if (!matched) {
            Map<String, Object> before = flatten(original != null ? original.outputRefs() : Map.of());
            Map<String, Object> after = flatten(replay != null ? replay.outputRefs() : Map.of());
            Set<String> paths = new LinkedHashSet<>(before.keySet());
            paths.addAll(after.keySet());
            for (String path : paths) {
                Object left = before.get(path);
                Object right = after.get(path);
                if (!Objects.equals(left, right)) {
                    differences.add(new FieldDifference(path, left, right));
                }
            }
        }
        return new StepDiff(stepName, originalHash, replayHash, matched, differences);
    }

    /**
     * Flatten nested maps and lists into dotted paths, e.g. {@code rows[2].score}
     */
    static Map<String, Object> flatten(Map<String, Object> outputs) {
        Map<String, Object> flat = new TreeMap<>();
        outputs.forEach((key, value) -> flattenInto(flat, key, value));
        return flat;
    }

    private static void flattenInto(Map<String, Object> flat, String path, Object value) {
        if (value instanceof Map<?, ?> map && !map.isEmpty()) {
            map.forEach((k, v) -> flattenInto(flat, path + "." + k, v));
        } else if (value instanceof List<?> list && !list.isEmpty()) {
            for (int i = 0; i < list.size(); i++) {
                flattenInto(flat, path + "[" + i + "]", list.get(i));
            }
        } else {
            flat.put(path, value);
        }
    }
}
