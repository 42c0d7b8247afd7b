package org.neuralchilli.marshal.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.marshal.OrchestratorFixture;
import org.neuralchilli.marshal.domain.ErrorCategory;
import org.neuralchilli.marshal.domain.EventType;
import org.neuralchilli.marshal.domain.LedgerEvent;
import org.neuralchilli.marshal.domain.PipelineTemplate;
import org.neuralchilli.marshal.domain.Run;
import org.neuralchilli.marshal.domain.RunStatus;
import org.neuralchilli.marshal.domain.StepDefinition;
import org.neuralchilli.marshal.domain.StepState;
import org.neuralchilli.marshal.domain.StepStatus;
import org.neuralchilli.marshal.resource.ResourceSettings;
import org.neuralchilli.marshal.service.RunNotFoundException;
import org.neuralchilli.marshal.service.ValidationException;
import org.neuralchilli.marshal.step.FatalStepException;
import org.neuralchilli.marshal.step.ScriptedStepHandler;
import org.neuralchilli.marshal.step.StepOutput;
import org.neuralchilli.marshal.util.Hashing;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class PipelineSchedulerTest {

    private OrchestratorFixture fixture;

    @BeforeEach
    void setup() {
        fixture = new OrchestratorFixture();
    }

    @AfterEach
    void teardown() {
        fixture.close();
    }

    @Test
    void shouldRunIndependentStepsConcurrentlyBeforeFanIn() {
        // Given: a and b both wait for each other, so they only finish if they run together
        CountDownLatch bothStarted = new CountDownLatch(2);
        ScriptedStepHandler rendezvous = new ScriptedStepHandler("rendezvous", (n, context, params) -> {
            bothStarted.countDown();
            if (!bothStarted.await(5, TimeUnit.SECONDS)) {
                throw new FatalStepException("sibling never started");
            }
            return StepOutput.of(Map.of("from", context.stepName()), 5);
        });
        ScriptedStepHandler join = ScriptedStepHandler.succeeding("join");
        fixture.register(rendezvous, join);

        PipelineTemplate template = PipelineTemplate.builder("fan-in")
                .steps(step("a", "rendezvous").build(),
                        step("b", "rendezvous").build(),
                        step("c", "join").dependsOn("a", "b").build())
                .build();

        // When
        Run run = fixture.run(template, 1L);

        // Then
        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.degraded()).isFalse();
        assertThat(join.contexts()).singleElement().satisfies(context -> {
            assertThat(context.upstreamOutputs()).containsOnlyKeys("a", "b");
            assertThat(context.upstream("a")).containsEntry("from", "a");
        });
        assertThat(eventTypes(run)).startsWith(EventType.RUN_START).endsWith(EventType.RUN_COMPLETE);
    }

    @Test
    void shouldSkipDescendantsOfFailedStepOnly() {
        ScriptedStepHandler broken = ScriptedStepHandler.alwaysFailing("broken",
                () -> new FatalStepException("bad input"));
        ScriptedStepHandler ok = ScriptedStepHandler.succeeding("ok");
        fixture.register(broken, ok);

        PipelineTemplate template = PipelineTemplate.builder("partial")
                .steps(step("ingest", "broken").build(),
                        step("analyze", "ok").dependsOn("ingest").build(),
                        step("report", "ok").dependsOn("analyze").build(),
                        step("sidecar", "ok").build())
                .build();

        Run run = fixture.run(template, null);

        assertThat(run.status()).isEqualTo(RunStatus.FAILED);
        assertThat(run.error()).contains("ingest");
        assertThat(status(run, "ingest")).isEqualTo(StepStatus.FAILED);
        assertThat(status(run, "analyze")).isEqualTo(StepStatus.SKIPPED);
        assertThat(status(run, "report")).isEqualTo(StepStatus.SKIPPED);
        assertThat(status(run, "sidecar")).isEqualTo(StepStatus.COMPLETED);
        assertThat(ok.contexts()).extracting(c -> c.stepName()).containsExactly("sidecar");

        LedgerEvent skipped = fixture.ledger.lastForStep(run.runId(), "analyze").orElseThrow();
        assertThat(skipped.eventType()).isEqualTo(EventType.STEP_SKIPPED);
        assertThat(Hashing.parseJsonObject(skipped.payload())).containsEntry("upstream", "ingest");
        assertThat(fixture.ledger.verify(run.runId())).isTrue();
    }

    @Test
    void shouldCompleteDegradedWhenOptionalStepFails() {
        fixture.register(ScriptedStepHandler.succeeding("ok"),
                ScriptedStepHandler.alwaysFailing("broken", () -> new FatalStepException("no chart")));

        PipelineTemplate template = PipelineTemplate.builder("optional")
                .steps(step("analyze", "ok").build(),
                        step("chart", "broken").dependsOn("analyze").optional(true).build())
                .build();

        Run run = fixture.run(template, null);

        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.degraded()).isTrue();
        Map<String, Object> summary = Hashing.parseJsonObject(fixture.ledger.last(run.runId()).orElseThrow().payload());
        assertThat(summary).containsEntry("degraded", true).containsEntry("failed", List.of("chart"));
    }

    @Test
    void shouldRespectMaxParallelism() {
        fixture.close();
        fixture = new OrchestratorFixture(ResourceSettings.defaults(), 1);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        fixture.register(new ScriptedStepHandler("slow", (n, context, params) -> {
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            Thread.sleep(50);
            running.decrementAndGet();
            return StepOutput.of(Map.of(), 1);
        }));

        PipelineTemplate template = PipelineTemplate.builder("wide")
                .steps(step("a", "slow").build(), step("b", "slow").build(), step("c", "slow").build())
                .build();

        Run run = fixture.run(template, null);

        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(peak.get()).isEqualTo(1);
    }

    @Test
    void shouldFailStepDeniedByBudgetWithoutStartingIt() {
        ScriptedStepHandler ok = ScriptedStepHandler.succeeding("ok");
        fixture.register(ok);

        PipelineTemplate template = PipelineTemplate.builder("greedy")
                .steps(step("ingest", "ok").build(),
                        step("analyze", "ok").dependsOn("ingest").tokenBudgetBase(1000).requestedTokens(50_000).build(),
                        step("report", "ok").dependsOn("analyze").build())
                .build();

        Run run = fixture.run(template, null);

        assertThat(run.status()).isEqualTo(RunStatus.FAILED);
        StepState denied = fixture.states.get(run.runId(), "analyze").orElseThrow();
        assertThat(denied.status()).isEqualTo(StepStatus.FAILED);
        assertThat(denied.errorCategory()).isEqualTo(ErrorCategory.RESOURCE_DENIED);
        assertThat(denied.attemptCount()).isZero();
        assertThat(status(run, "report")).isEqualTo(StepStatus.SKIPPED);
        assertThat(ok.invocations()).isEqualTo(1);

        List<LedgerEvent> analyzeEvents = fixture.ledger.read(run.runId()).stream()
                .filter(e -> "analyze".equals(e.stepName()))
                .toList();
        assertThat(analyzeEvents).extracting(LedgerEvent::eventType)
                .containsExactly(EventType.BUDGET_DENIED, EventType.STEP_FAILURE);
        assertThat(Hashing.parseJsonObject(analyzeEvents.get(1).payload()))
                .containsEntry("attempts", 0)
                .containsKeys("maximum_allowed", "suggested_budget");
        assertThat(fixture.resources.currentLoad()).isZero();
    }

    @Test
    void shouldResolveParameterExpressionsWithRunOverrides() {
        ScriptedStepHandler ok = ScriptedStepHandler.succeeding("ok");
        fixture.register(ok);
        PipelineTemplate template = PipelineTemplate.builder("params")
                .params(Map.of("topic", "llm-evals", "depth", 2))
                .steps(step("synthesize", "ok").params(Map.of(
                        "passes", "${params.depth * 2}",
                        "label", "${params.topic}-${run.seed}")).build())
                .build();
        fixture.register(template);

        Run run = PipelineScheduler.await(fixture.scheduler.start(
                fixture.newRun(template, 9L, Map.of("depth", 3), false), template));

        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        @SuppressWarnings("unchecked")
        Map<String, Object> received = (Map<String, Object>) fixture.states
                .get(run.runId(), "synthesize").orElseThrow().outputRefs().get("params");
        assertThat(received).containsEntry("topic", "llm-evals").containsEntry("label", "llm-evals-9");
        assertThat(((Number) received.get("passes")).intValue()).isEqualTo(6);
    }

    @Test
    void shouldNotInvokeHandlersInDryRun() {
        ScriptedStepHandler ok = ScriptedStepHandler.succeeding("ok");
        fixture.register(ok);
        PipelineTemplate template = linear("ok");
        fixture.register(template);

        Run run = PipelineScheduler.await(fixture.scheduler.start(
                fixture.newRun(template, null, Map.of(), true), template));

        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.dryRun()).isTrue();
        assertThat(ok.invocations()).isZero();
        assertThat(fixture.states.getAll(run.runId()).values())
                .allSatisfy(s -> assertThat(s.outputRefs()).containsEntry("dry_run", true));
    }

    @Test
    void shouldCancelPendingStepsAndLetInFlightFinish() {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        ScriptedStepHandler blocking = new ScriptedStepHandler("blocking", (n, context, params) -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return StepOutput.of(Map.of("cancelled_seen", context.isCancelled()), 1);
        });
        ScriptedStepHandler ok = ScriptedStepHandler.succeeding("ok");
        fixture.register(blocking, ok);
        PipelineTemplate template = PipelineTemplate.builder("cancellable")
                .steps(step("ingest", "blocking").build(),
                        step("analyze", "ok").dependsOn("ingest").build())
                .build();
        fixture.register(template);
        Run run = fixture.newRun(template, null);

        CompletableFuture<Run> future = fixture.scheduler.start(run, template);
        await().atMost(Duration.ofSeconds(5)).until(() -> started.getCount() == 0);

        fixture.scheduler.cancel(run.runId());
        release.countDown();
        Run finished = PipelineScheduler.await(future);

        assertThat(finished.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(status(finished, "analyze")).isEqualTo(StepStatus.CANCELLED);
        assertThat(status(finished, "ingest")).isEqualTo(StepStatus.COMPLETED);
        assertThat(fixture.states.get(run.runId(), "ingest").orElseThrow().outputRefs())
                .containsEntry("cancelled_seen", true);
        assertThat(ok.invocations()).isZero();
        assertThat(fixture.scheduler.isActive(run.runId())).isFalse();
    }

    @Test
    void shouldReturnFinishedRunUnchangedWhenCancelled() {
        fixture.register(ScriptedStepHandler.succeeding("ok"));
        Run run = fixture.run(linear("ok"), null);

        Run afterCancel = fixture.scheduler.cancel(run.runId());

        assertThat(afterCancel.status()).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    void shouldResumeFailedRunWithoutRerunningCompletedSteps() {
        ScriptedStepHandler first = ScriptedStepHandler.succeeding("first");
        ScriptedStepHandler flaky = ScriptedStepHandler.failingTimes("flaky", 1,
                () -> new FatalStepException("disk full"));
        ScriptedStepHandler last = ScriptedStepHandler.succeeding("last");
        fixture.register(first, flaky, last);
        PipelineTemplate template = PipelineTemplate.builder("resumable")
                .steps(step("ingest", "first").build(),
                        step("analyze", "flaky").dependsOn("ingest").build(),
                        step("report", "last").dependsOn("analyze").build())
                .build();

        Run failed = fixture.run(template, 5L);
        assertThat(failed.status()).isEqualTo(RunStatus.FAILED);
        StepState ingestBefore = fixture.states.get(failed.runId(), "ingest").orElseThrow();

        Run resumed = PipelineScheduler.await(fixture.scheduler.resume(failed.runId()));

        assertThat(resumed.runId()).isEqualTo(failed.runId());
        assertThat(resumed.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(first.invocations()).isEqualTo(1);
        assertThat(flaky.invocations()).isEqualTo(2);
        assertThat(last.invocations()).isEqualTo(1);
        assertThat(fixture.states.get(failed.runId(), "ingest").orElseThrow()).isEqualTo(ingestBefore);
        assertThat(fixture.ledger.verify(failed.runId())).isTrue();
        assertThat(fixture.ledger.read(failed.runId()))
                .filteredOn(e -> e.eventType() == EventType.RUN_START)
                .hasSize(2);
    }

    @Test
    void shouldRefuseToResumeUnknownRun() {
        assertThatThrownBy(() -> fixture.scheduler.resume("run-missing"))
                .isInstanceOf(RunNotFoundException.class);
    }

    @Test
    void shouldRefuseToExecuteSameRunTwice() {
        CountDownLatch release = new CountDownLatch(1);
        fixture.register(new ScriptedStepHandler("blocking", (n, context, params) -> {
            release.await(5, TimeUnit.SECONDS);
            return StepOutput.of(Map.of(), 1);
        }));
        PipelineTemplate template = linear("blocking");
        fixture.register(template);
        Run run = fixture.newRun(template, null);
        CompletableFuture<Run> future = fixture.scheduler.start(run, template);

        try {
            assertThatThrownBy(() -> fixture.scheduler.resume(run.runId()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("already executing");
        } finally {
            release.countDown();
        }
        assertThat(PipelineScheduler.await(future).status()).isEqualTo(RunStatus.COMPLETED);
    }

    private StepStatus status(Run run, String stepName) {
        return fixture.states.get(run.runId(), stepName).map(StepState::status).orElse(null);
    }

    private List<EventType> eventTypes(Run run) {
        return fixture.ledger.read(run.runId()).stream().map(LedgerEvent::eventType).toList();
    }

    private static PipelineTemplate linear(String handler) {
        return PipelineTemplate.builder("linear")
                .steps(step("ingest", handler).build(),
                        step("analyze", handler).dependsOn("ingest").build(),
                        step("report", handler).dependsOn("analyze").build())
                .build();
    }

    private static StepDefinition.Builder step(String name, String handler) {
        return StepDefinition.builder(name).handler(handler);
    }
}
