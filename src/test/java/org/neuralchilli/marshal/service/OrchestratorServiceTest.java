package org.neuralchilli.marshal.service;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import org.neuralchilli.marshal.domain.EventType;
import org.neuralchilli.marshal.domain.LedgerEvent;
import org.neuralchilli.marshal.domain.Run;
import org.neuralchilli.marshal.domain.RunStatus;
import org.neuralchilli.marshal.domain.StepState;
import org.neuralchilli.marshal.domain.StepStatus;
import org.neuralchilli.marshal.ledger.LedgerVerification;
import org.neuralchilli.marshal.replay.ReplayOptions;
import org.neuralchilli.marshal.replay.ReplayResult;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@QuarkusTest
class OrchestratorServiceTest {

    @Inject
    OrchestratorService orchestrator;

    @Test
    void shouldRunPipelineToCompletion() {
        // When: Run the research pipeline with a seed
        RunReport report = orchestrator.run(RunRequest.of("research").withSeed(42));

        // Then: Every step completed and the report follows template order
        assertThat(report.run().status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(report.exitCode()).isZero();
        assertThat(report.steps())
                .extracting(StepState::stepName)
                .containsExactly("ingest", "synthesize", "analyze", "report");
        assertThat(report.steps())
                .extracting(StepState::status)
                .containsOnly(StepStatus.COMPLETED);

        // And: Parameters were resolved against template defaults
        StepState synthesize = report.step("synthesize").orElseThrow();
        Map<?, ?> params = (Map<?, ?>) synthesize.outputRefs().get("params");
        assertThat(((Number) params.get("passes")).intValue()).isEqualTo(4);
        assertThat(synthesize.outputRefs().get("upstream")).isEqualTo(List.of("ingest"));

        Map<?, ?> reportParams = (Map<?, ?>) report.step("report").orElseThrow().outputRefs().get("params");
        assertThat(reportParams.get("title")).isEqualTo("Report on llm-evals");
    }

    @Test
    void shouldApplyParamOverrides() {
        RunReport report = orchestrator.run(RunRequest.of("research")
                .withParams(Map.of("topic", "agents")));

        Map<?, ?> ingestParams = (Map<?, ?>) report.step("ingest").orElseThrow().outputRefs().get("params");
        assertThat(ingestParams.get("source")).isEqualTo("archive/agents");
        assertThat(report.run().params()).containsEntry("topic", "agents");
    }

    @Test
    void shouldRecordHashChainedEvents() {
        RunReport report = orchestrator.run(RunRequest.of("fan-in"));
        String runId = report.run().runId();

        List<LedgerEvent> events = orchestrator.events(runId);

        assertThat(events.get(0).eventType()).isEqualTo(EventType.RUN_START);
        assertThat(events.get(events.size() - 1).eventType()).isEqualTo(EventType.RUN_COMPLETE);
        assertThat(events)
                .filteredOn(e -> e.eventType() == EventType.STEP_SUCCESS)
                .extracting(LedgerEvent::stepName)
                .containsExactlyInAnyOrder("a", "b", "c");

        LedgerVerification verification = orchestrator.verify(runId);
        assertThat(verification.valid()).isTrue();
        assertThat(verification.eventCount()).isEqualTo(events.size());
    }

    @Test
    void shouldAppendCorrectionWithoutRewritingHistory() {
        String runId = orchestrator.run(RunRequest.of("fan-in")).run().runId();
        int before = orchestrator.events(runId).size();

        LedgerEvent correction = orchestrator.correct(runId, 1, "wrong operator recorded",
                Map.of("operator", "alice"));

        List<LedgerEvent> events = orchestrator.events(runId);
        assertThat(events).hasSize(before + 1);
        assertThat(events.get(0).eventType()).isEqualTo(EventType.RUN_START);
        assertThat(correction.eventType()).isEqualTo(EventType.CORRECTION);
        assertThat(correction.eventId()).isEqualTo(before + 1L);
        assertThat(correction.payload()).contains("\"corrects\":1");
        assertThat(orchestrator.verify(runId).valid()).isTrue();
    }

    @Test
    void shouldReplaySeededRun() {
        String runId = orchestrator.run(RunRequest.of("research").withSeed(7)).run().runId();

        ReplayResult result = orchestrator.replay(runId, ReplayOptions.all());

        assertThat(result.originalRunId()).isEqualTo(runId);
        assertThat(result.replayRunId()).isNotEqualTo(runId);
        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(result.matched()).isTrue();
        assertThat(result.replayedSteps()).containsExactlyInAnyOrder("ingest", "synthesize", "analyze", "report");
        assertThat(orchestrator.getRun(runId).status()).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    void shouldStartInBackground() {
        Run run = orchestrator.start(RunRequest.of("fan-in"));

        await().atMost(Duration.ofSeconds(10))
                .until(() -> orchestrator.getRun(run.runId()).isFinished());

        assertThat(orchestrator.report(run.runId()).run().status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(orchestrator.listRuns())
                .extracting(Run::runId)
                .contains(run.runId());
    }

    @Test
    void shouldExportRunArchive() {
        String runId = orchestrator.run(RunRequest.of("fan-in")).run().runId();

        Path root = orchestrator.export(runId);

        assertThat(root).isEqualTo(Path.of("target/archive").resolve(runId));
        assertThat(root.resolve("run.json")).exists();
        assertThat(root.resolve("outputs").resolve("c.json")).exists();
        assertThat(Files.isRegularFile(root.resolve("events.jsonl"))).isTrue();
    }

    @Test
    void shouldRejectUnknownTemplateAndRun() {
        assertThatThrownBy(() -> orchestrator.run(RunRequest.of("no-such-pipeline")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("no-such-pipeline");

        assertThatThrownBy(() -> orchestrator.getRun("run-missing"))
                .isInstanceOf(RunNotFoundException.class);
        assertThatThrownBy(() -> orchestrator.events("run-missing"))
                .isInstanceOf(RunNotFoundException.class);
        assertThatThrownBy(() -> orchestrator.verify("run-missing"))
                .isInstanceOf(RunNotFoundException.class);
    }

    @Test
    void shouldRemoveFinishedRunsOnCleanup() {
        String runId = orchestrator.run(RunRequest.of("fan-in").asDryRun()).run().runId();

        assertThat(orchestrator.cleanup(Instant.EPOCH)).isZero();

        int removed = orchestrator.cleanup(Instant.now().plusSeconds(1));

        assertThat(removed).isGreaterThanOrEqualTo(1);
        assertThatThrownBy(() -> orchestrator.getRun(runId))
                .isInstanceOf(RunNotFoundException.class);
    }
}
