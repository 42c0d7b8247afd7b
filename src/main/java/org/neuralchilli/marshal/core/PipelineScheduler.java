package org.neuralchilli.marshal.core;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.neuralchilli.marshal.domain.ErrorCategory;
import org.neuralchilli.marshal.domain.EventType;
import org.neuralchilli.marshal.domain.PipelineTemplate;
import org.neuralchilli.marshal.domain.Run;
import org.neuralchilli.marshal.domain.StepDefinition;
import org.neuralchilli.marshal.domain.StepState;
import org.neuralchilli.marshal.domain.StepStatus;
import org.neuralchilli.marshal.ledger.EventLedger;
import org.neuralchilli.marshal.resilience.CircuitBreakerRegistry;
import org.neuralchilli.marshal.resource.AdmissionDecision;
import org.neuralchilli.marshal.resource.AdmissionRequest;
import org.neuralchilli.marshal.resource.ResourceDeniedException;
import org.neuralchilli.marshal.resource.ResourceMonitor;
import org.neuralchilli.marshal.service.PipelineRegistry;
import org.neuralchilli.marshal.service.RunNotFoundException;
import org.neuralchilli.marshal.service.ValidationException;
import org.neuralchilli.marshal.state.RunState;
import org.neuralchilli.marshal.state.StateManager;
import org.neuralchilli.marshal.util.Hashing;
import org.neuralchilli.marshal.worker.StepExecutor;
import org.neuralchilli.marshal.worker.StepResult;
import org.neuralchilli.marshal.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Walks a run's DAG and dispatches steps as their dependencies complete.
 *
 * <p>Evaluation is event driven: a run is evaluated when it starts and again
 * whenever one of its steps reaches a terminal state. Each evaluation dispatches
 * the current frontier (PENDING steps whose dependencies are all COMPLETED), up
 * to {@code maxParallelism} steps in flight per run. Every dispatched step is
 * first admitted by the {@link ResourceMonitor}; a denied step fails without
 * reaching the executor.
 *
 * <p>A failed step skips its transitive dependents and nothing else. The run
 * ends when no step is in flight and none can be dispatched: FAILED if a
 * required step failed, otherwise COMPLETED (degraded if anything was lost).
 */
public class PipelineScheduler {

    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    private final DagService dagService;
    private final ExpressionEvaluator expressions;
    private final StepExecutor executor;
    private final ResourceMonitor resources;
    private final CircuitBreakerRegistry breakers;
    private final EventLedger ledger;
    private final StateManager states;
    private final PipelineRegistry pipelines;
    private final WorkerPool pool;
    private final int maxParallelism;

    private final Map<String, RunExecution> active = new ConcurrentHashMap<>();

    public PipelineScheduler(
            DagService dagService,
            ExpressionEvaluator expressions,
            StepExecutor executor,
            ResourceMonitor resources,
            CircuitBreakerRegistry breakers,
            EventLedger ledger,
            StateManager states,
            PipelineRegistry pipelines,
            WorkerPool pool,
            int maxParallelism
    ) {
        if (maxParallelism < 1) {
            throw new IllegalArgumentException("maxParallelism must be >= 1, got: " + maxParallelism);
        }
        this.dagService = dagService;
        this.expressions = expressions;
        this.executor = executor;
        this.resources = resources;
        this.breakers = breakers;
        this.ledger = ledger;
        this.states = states;
        this.pipelines = pipelines;
        this.pool = pool;
        this.maxParallelism = maxParallelism;
        log.info("PipelineScheduler initialized (max parallelism per run: {})", maxParallelism);
    }

    public int maxParallelism() {
        return maxParallelism;
    }

    /**
     * Session for {@code run} over the state store that holds its step states.
     */
    public RunSession openSession(Run run, PipelineTemplate template, StateManager runStates) {
        DirectedAcyclicGraph<String, DefaultEdge> dag = dagService.buildDag(template);
        return new RunSession(run, template, dag, runStates);
    }

    /**
     * Start a new run of {@code template}.
     */
    public CompletableFuture<Run> start(Run run, PipelineTemplate template) {
        states.saveRun(run);
        return execute(openSession(run, template, states));
    }

    /**
     * Execute a session until every step is terminal. Step states already in the
     * session's store are honoured: COMPLETED steps are not run again.
     */
    public CompletableFuture<Run> execute(RunSession session) {
        RunExecution execution = new RunExecution(session);
        if (active.putIfAbsent(session.runId(), execution) != null) {
            throw new ValidationException("Run " + session.runId() + " is already executing");
        }
        try {
            execution.start();
        } catch (RuntimeException e) {
            active.remove(session.runId());
            throw e;
        }
        return execution.done;
    }

    /**
     * Execute and block until the run ends.
     */
    public Run executeAndWait(RunSession session) {
        return await(execute(session));
    }

    /**
     * Continue a stopped run from its persisted state. COMPLETED steps are kept;
     * FAILED, SKIPPED, CANCELLED and abandoned RUNNING steps go back to PENDING.
     *
     * @throws ValidationException if the run is executing, or has a step that is
     *                             RUNNING and not yet stale
     */
    public CompletableFuture<Run> resume(String runId) {
        if (active.containsKey(runId)) {
            throw new ValidationException("Run " + runId + " is already executing");
        }
        Run run = states.getRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
        StateManager runStates = states.forRun(run);
        RunState recovered = runStates.recover(runId);

        Set<String> stillRunning = recovered.stepsIn(StepStatus.RUNNING);
        if (!stillRunning.isEmpty()) {
            throw new ValidationException("Run " + runId + " has steps still running " + stillRunning
                    + "; they become resumable after " + runStates.stalenessThreshold());
        }

        int reset = recovered.resetSteps().size();
        for (StepState state : recovered.steps().values()) {
            if (state.status().isResumable()) {
                runStates.put(state.resetToPending());
                reset++;
            }
        }

        PipelineTemplate template = pipelines.require(run.templateName());
        log.info("Resuming run {} of pipeline {}: {} step(s) reset, {} completed step(s) kept",
                runId, template.name(), reset, recovered.stepsIn(StepStatus.COMPLETED).size());
        return execute(openSession(run, template, runStates));
    }

    /**
     * Cancel a run. Steps not yet dispatched become CANCELLED and are never invoked;
     * in-flight handlers see the advisory flag and finish or time out.
     *
     * @return the run as it stands after cancellation was requested
     */
    public Run cancel(String runId) {
        RunExecution execution = active.get(runId);
        if (execution != null) {
            execution.cancel();
            return execution.session.run();
        }

        Run run = states.getRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
        if (run.isFinished()) {
            log.info("Run {} already finished with status {}, nothing to cancel", runId, run.status());
            return run;
        }

        // not executing here: settle persisted state directly
        StateManager runStates = states.forRun(run);
        List<String> cancelled = new ArrayList<>();
        for (StepState state : runStates.getAll(runId).values()) {
            if (!state.isFinished()) {
                runStates.put(state.cancel());
                ledger.append(runId, EventType.STEP_CANCELLED, state.stepName(), Map.of("reason", "run cancelled"));
                cancelled.add(state.stepName());
            }
        }
        Run cancelledRun = run.cancel();
        states.saveRun(cancelledRun);
        ledger.append(runId, EventType.RUN_COMPLETE, Map.of(
                "status", cancelledRun.status().name(),
                "cancelled", cancelled));
        log.info("Cancelled inactive run {} ({} step(s) cancelled)", runId, cancelled.size());
        return cancelledRun;
    }

    public boolean isActive(String runId) {
        return active.containsKey(runId);
    }

    public Set<String> activeRuns() {
        return Set.copyOf(active.keySet());
    }

    public static Run await(CompletableFuture<Run> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Scheduling state of one executing run. All methods that touch the
     * status map run under this object's monitor.
     */
    private final class RunExecution {

        private final RunSession session;
        private final CompletableFuture<Run> done = new CompletableFuture<>();
        private final Map<String, StepStatus> statuses = new HashMap<>();
        private final Set<String> inFlight = new HashSet<>();
        private final Map<String, Long> grants = new HashMap<>();
        private boolean finished;

        RunExecution(RunSession session) {
            this.session = session;
        }

        synchronized void start() {
            Run run = session.run();
            PipelineTemplate template = session.template();
            StateManager runStates = session.states();

            Map<String, Object> runParams = new LinkedHashMap<>(template.params());
            runParams.putAll(run.params());
            Map<String, Object> runVars = new LinkedHashMap<>();
            runVars.put("id", run.lineageRunId());
            runVars.put("template", template.name());
            runVars.put("seed", run.seed());
            ExpressionContext context = new ExpressionContext(runParams, runVars);

            int kept = 0;
            for (String stepName : dagService.topologicalOrder(session.dag())) {
                StepDefinition step = session.step(stepName);
                Map<String, Object> effective = new LinkedHashMap<>(runParams);
                effective.putAll(expressions.resolve(step.params(), context));
                session.setEffectiveParams(stepName, effective);

                String key = Hashing.idempotencyKey(run.lineageRunId(), stepName, effective);
                Optional<StepState> existing = runStates.get(run.runId(), stepName);
                if (existing.isPresent() && existing.get().isCompleted()) {
                    statuses.put(stepName, StepStatus.COMPLETED);
                    kept++;
                    continue;
                }
                StepState pending = existing
                        .filter(s -> s.idempotencyKey().equals(key))
                        .map(s -> s.status() == StepStatus.PENDING ? s : s.resetToPending())
                        .orElseGet(() -> StepState.pending(run.runId(), stepName, key));
                runStates.put(pending);
                statuses.put(stepName, StepStatus.PENDING);
            }

            Run started = run.start();
            session.updateRun(started);
            states.saveRun(started);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("template", template.name());
            payload.put("seed", started.seed());
            payload.put("params", runParams);
            payload.put("dry_run", started.dryRun());
            payload.put("engine_version", started.engineVersion());
            payload.put("steps", statuses.size());
            payload.put("completed_steps", kept);
            if (started.isReplay()) {
                payload.put("replay_of", started.replayOf());
            }
            ledger.append(started.runId(), EventType.RUN_START, payload);

            log.info("Run {} of pipeline {} started: {} steps ({} already completed)",
                    started.runId(), template.name(), statuses.size(), kept);
            evaluate();
        }

        synchronized void evaluate() {
            if (finished) {
                return;
            }
            if (!session.isCancelled()) {
                List<String> frontier = dagService.frontier(session.dag(), statuses);
                log.debug("Run {}: frontier {} ({} in flight)", session.runId(), frontier, inFlight.size());
                for (String stepName : frontier) {
                    if (inFlight.size() >= maxParallelism) {
                        break;
                    }
                    dispatch(stepName);
                }
            }
            if (inFlight.isEmpty()) {
                finish();
            }
        }

        private void dispatch(String stepName) {
            StepDefinition step = session.step(stepName);
            try {
                StepState state = session.states().get(session.runId(), stepName)
                        .orElseThrow(() -> new IllegalStateException("No state for step " + stepName));

                boolean cached = session.states().findByIdempotencyKey(state.idempotencyKey())
                        .filter(StepState::isCompleted)
                        .isPresent();
                if (!cached) {
                    AdmissionDecision decision = resources.admit(AdmissionRequest.of(session.run(), step));
                    if (!decision.approved()) {
                        deny(state, decision);
                        return;
                    }
                    state = state.admit(decision.granted());
                    session.states().put(state);
                    grants.put(stepName, decision.granted());
                }

                statuses.put(stepName, StepStatus.RUNNING);
                inFlight.add(stepName);
                log.debug("Run {}: dispatching step {}", session.runId(), stepName);

                executor.executeAsync(step, session, state)
                        .whenCompleteAsync((result, error) -> onStepFinished(stepName, result, error),
                                pool.executor());
            } catch (RuntimeException e) {
                log.error("Run {}: could not dispatch step {}", session.runId(), stepName, e);
                inFlight.remove(stepName);
                releaseGrant(stepName);
                failUnsettled(stepName, "Dispatch failed: " + e.getMessage());
            }
        }

        private void deny(StepState state, AdmissionDecision decision) {
            ResourceDeniedException denial = decision.toException();
            ledger.append(session.runId(), EventType.BUDGET_DENIED, state.stepName(), decision.toPayload());

            session.states().put(state.fail(denial.getMessage(), ErrorCategory.RESOURCE_DENIED));
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("error", denial.getMessage());
            payload.put("error_category", ErrorCategory.RESOURCE_DENIED.name());
            payload.put("idempotency_key", state.idempotencyKey());
            payload.put("attempts", 0);
            payload.put("maximum_allowed", denial.maximumAllowed());
            payload.put("suggested_budget", denial.suggestedBudget());
            ledger.append(session.runId(), EventType.STEP_FAILURE, state.stepName(), payload);

            settle(state.stepName(), StepStatus.FAILED);
        }

        synchronized void onStepFinished(String stepName, StepResult result, Throwable error) {
            inFlight.remove(stepName);
            releaseGrant(stepName);

            if (error != null) {
                log.error("Run {}: step {} ended with an internal error", session.runId(), stepName, error);
                failUnsettled(stepName, "Internal error: " + error.getMessage());
            } else {
                if (result.cached()) {
                    log.debug("Run {}: step {} served from cache", session.runId(), stepName);
                }
                settle(stepName, result.status());
            }
            evaluate();
        }

        synchronized void cancel() {
            if (finished || !session.cancel()) {
                return;
            }
            log.info("Cancelling run {} ({} step(s) in flight)", session.runId(), inFlight.size());

            for (String stepName : dagService.topologicalOrder(session.dag())) {
                if (statuses.get(stepName) != StepStatus.PENDING) {
                    continue;
                }
                session.states().get(session.runId(), stepName).ifPresent(state -> {
                    session.states().put(state.cancel());
                    ledger.append(session.runId(), EventType.STEP_CANCELLED, stepName,
                            Map.of("reason", "run cancelled"));
                });
                statuses.put(stepName, StepStatus.CANCELLED);
            }
            evaluate();
        }

        private void settle(String stepName, StepStatus status) {
            statuses.put(stepName, status);
            if (status == StepStatus.FAILED) {
                skipDependents(stepName);
            }
        }

        private void skipDependents(String failedStep) {
            Set<String> descendants = dagService.descendants(session.dag(), failedStep);
            for (String stepName : dagService.topologicalOrder(session.dag())) {
                if (!descendants.contains(stepName) || statuses.get(stepName) != StepStatus.PENDING) {
                    continue;
                }
                String reason = "Upstream step '" + failedStep + "' did not complete";
                session.states().get(session.runId(), stepName).ifPresent(state ->
                        session.states().put(state.skip(reason)));
                ledger.append(session.runId(), EventType.STEP_SKIPPED, stepName,
                        Map.of("reason", reason, "upstream", failedStep));
                statuses.put(stepName, StepStatus.SKIPPED);
                log.debug("Run {}: skipped step {} ({})", session.runId(), stepName, reason);
            }
        }

        private void failUnsettled(String stepName, String message) {
            Optional<StepState> state = session.states().get(session.runId(), stepName);
            if (state.isPresent() && state.get().isFinished()) {
                settle(stepName, state.get().status());
                return;
            }
            state.ifPresent(s -> session.states().put(s.fail(message, ErrorCategory.FATAL)));
            ledger.append(session.runId(), EventType.STEP_FAILURE, stepName, Map.of(
                    "error", message,
                    "error_category", ErrorCategory.FATAL.name()));
            settle(stepName, StepStatus.FAILED);
        }

        private void releaseGrant(String stepName) {
            Long granted = grants.remove(stepName);
            if (granted != null) {
                resources.release(stepName, granted);
            }
        }

        private void finish() {
            if (finished) {
                return;
            }
            finished = true;

            try {
                List<String> failedRequired = new ArrayList<>();
                Map<StepStatus, List<String>> byStatus = new LinkedHashMap<>();
                for (String stepName : dagService.topologicalOrder(session.dag())) {
                    StepStatus status = statuses.get(stepName);
                    byStatus.computeIfAbsent(status, s -> new ArrayList<>()).add(stepName);
                    if (status == StepStatus.FAILED && !session.step(stepName).optional()) {
                        failedRequired.add(stepName);
                    }
                }
                boolean degraded = byStatus.keySet().stream().anyMatch(s -> s != StepStatus.COMPLETED);

                Run run = session.run();
                Run finalRun;
                if (session.isCancelled()) {
                    finalRun = run.cancel();
                } else if (!failedRequired.isEmpty()) {
                    finalRun = run.fail("Required step(s) failed: " + String.join(", ", failedRequired));
                } else {
                    finalRun = run.complete(degraded);
                }
                session.updateRun(finalRun);
                states.saveRun(finalRun);

                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("status", finalRun.status().name());
                payload.put("degraded", finalRun.degraded());
                byStatus.forEach((status, steps) -> payload.put(status.name().toLowerCase(), steps));
                ledger.append(finalRun.runId(), EventType.RUN_COMPLETE, payload);

                breakers.release(finalRun);
                active.remove(finalRun.runId());
                log.info("Run {} finished: {}{}", finalRun.runId(), finalRun.status(),
                        finalRun.degraded() ? " (degraded)" : "");
                done.complete(finalRun);
            } catch (RuntimeException e) {
                active.remove(session.runId());
                log.error("Run {}: failed to record completion", session.runId(), e);
                done.completeExceptionally(e);
            }
        }
    }
}
