package org.neuralchilli.marshal.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.marshal.config.MarshalConfig;
import org.neuralchilli.marshal.core.PipelineScheduler;
import org.neuralchilli.marshal.domain.LedgerEvent;
import org.neuralchilli.marshal.domain.PipelineTemplate;
import org.neuralchilli.marshal.domain.Run;
import org.neuralchilli.marshal.domain.StepState;
import org.neuralchilli.marshal.ledger.EventLedger;
import org.neuralchilli.marshal.ledger.LedgerVerification;
import org.neuralchilli.marshal.replay.ReplayEngine;
import org.neuralchilli.marshal.replay.ReplayOptions;
import org.neuralchilli.marshal.replay.ReplayResult;
import org.neuralchilli.marshal.state.StateManager;
import org.neuralchilli.marshal.util.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for everything a caller can do with runs: start, replay, resume,
 * cancel, inspect, verify, export and clean up.
 */
@ApplicationScoped
public class OrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorService.class);

    @Inject
    PipelineRegistry pipelines;

    @Inject
    PipelineScheduler scheduler;

    @Inject
    ReplayEngine replayEngine;

    @Inject
    StateManager states;

    @Inject
    EventLedger ledger;

    @Inject
    RunArchiver archiver;

    @Inject
    MarshalConfig config;

    @Inject
    Clock clock;

    /**
     * Start a run and return immediately. The future completes when the run finishes.
     *
     * @throws ConfigurationException if the template is unknown
     */
    public CompletableFuture<Run> submit(RunRequest request) {
        PipelineTemplate template = pipelines.require(request.template());
        return scheduler.start(newRun(request, template), template);
    }

    /**
     * Start a run in the background.
     *
     * @return the run as recorded once scheduling has begun
     */
    public Run start(RunRequest request) {
        PipelineTemplate template = pipelines.require(request.template());
        Run run = newRun(request, template);
        scheduler.start(run, template).whenComplete((finished, error) -> {
            if (error != null) {
                log.error("Run {} ended with an internal error", run.runId(), error);
            }
        });
        return states.getRun(run.runId()).orElse(run);
    }

    /**
     * Run to completion.
     */
    public RunReport run(RunRequest request) {
        Run finished = PipelineScheduler.await(submit(request));
        return report(finished);
    }

    public ReplayResult replay(String runId, ReplayOptions options) {
        return replayEngine.replay(runId, options);
    }

    /**
     * Resume a stopped run and wait for it to finish.
     */
    public RunReport resume(String runId) {
        return report(PipelineScheduler.await(scheduler.resume(runId)));
    }

    public Run cancel(String runId) {
        return scheduler.cancel(runId);
    }

    public Run getRun(String runId) {
        return states.getRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    public List<Run> listRuns() {
        return states.listRuns();
    }

    public RunReport report(String runId) {
        return report(getRun(runId));
    }

    public List<LedgerEvent> events(String runId) {
        requireKnown(runId);
        return ledger.read(runId);
    }

    public LedgerVerification verify(String runId) {
        requireKnown(runId);
        return ledger.verifyDetailed(runId);
    }

    /**
     * Append a compensating event for {@code eventId}; history is never rewritten.
     */
    public LedgerEvent correct(String runId, long eventId, String reason, Map<String, Object> correction) {
        requireKnown(runId);
        return ledger.appendCorrection(runId, eventId, reason, correction);
    }

    public Path export(String runId) {
        return archiver.export(runId, Path.of(config.archive().directory()));
    }

    /**
     * Remove finished runs created before {@code cutoff}.
     */
    public int cleanup(Instant cutoff) {
        return states.deleteBefore(cutoff);
    }

    private Run newRun(RunRequest request, PipelineTemplate template) {
        Run run = Run.create(
                Identifiers.newRunId(clock),
                template.name(),
                request.seed(),
                request.params(),
                config.engine().version(),
                request.dryRun(),
                request.maxTokensPerStep());
        log.info("Submitting run {} of pipeline {}{}", run.runId(), template.name(),
                run.dryRun() ? " (dry run)" : "");
        return run;
    }

    private void requireKnown(String runId) {
        if (states.getRun(runId).isEmpty() && !ledger.hasRun(runId)) {
            throw new RunNotFoundException(runId);
        }
    }

    private RunReport report(Run run) {
        List<StepState> steps = new ArrayList<>(states.forRun(run).getAll(run.runId()).values());
        List<String> order = pipelines.find(run.templateName())
                .map(PipelineTemplate::stepNames)
                .orElse(List.of());
        steps.sort(Comparator
                .comparingInt((StepState s) -> order.contains(s.stepName()) ? order.indexOf(s.stepName()) : order.size())
                .thenComparing(StepState::stepName));
        return new RunReport(run, steps);
    }
}
