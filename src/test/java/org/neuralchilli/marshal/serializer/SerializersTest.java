package org.neuralchilli.marshal.serializer;

import com.hazelcast.collection.IList;
import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.neuralchilli.marshal.config.HazelcastTestSupport;
import org.neuralchilli.marshal.domain.ErrorCategory;
import org.neuralchilli.marshal.domain.EventType;
import org.neuralchilli.marshal.domain.LedgerEvent;
import org.neuralchilli.marshal.domain.Run;
import org.neuralchilli.marshal.domain.RunStatus;
import org.neuralchilli.marshal.domain.StepState;
import org.neuralchilli.marshal.domain.StepStatus;
import org.neuralchilli.marshal.state.StepStateKey;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Round trips through the shared Hazelcast member, so every value goes
 * through the registered stream serializers.
 */
class SerializersTest {

    private static HazelcastInstance hazelcast;
    private static String namespace;

    @BeforeAll
    static void setupClass() {
        hazelcast = HazelcastTestSupport.instance();
        namespace = HazelcastTestSupport.uniqueNamespace("serializers");
    }

    @Test
    void shouldRoundTripFinishedRun() {
        // Given
        Run original = new Run("run-1", "research", 42L,
                Map.of("topic", "llm-evals", "depth", 2, "filters", Map.of("lang", List.of("en", "de"))),
                RunStatus.FAILED, Instant.now(), Instant.now(), true, "run-0", "1.0.0", true, 500L,
                "Required step(s) failed: [analyze]");
        IMap<String, Run> map = hazelcast.getMap(namespace + "-runs");

        // When
        map.set(original.runId(), original);

        // Then
        assertThat(map.get("run-1")).isEqualTo(original);
    }

    @Test
    void shouldRoundTripRunWithNulls() {
        Run original = Run.create("run-2", "research", null, Map.of(), null, false, null);
        IMap<String, Run> map = hazelcast.getMap(namespace + "-runs");

        map.set(original.runId(), original);

        Run restored = map.get("run-2");
        assertThat(restored).isEqualTo(original);
        assertThat(restored.seed()).isNull();
        assertThat(restored.completedAt()).isNull();
    }

    @Test
    void shouldRoundTripStepState() {
        StepState original = new StepState("run-1", "analyze", "key-1",
                StepStatus.FAILED, 3,
                Instant.now(), Instant.now(), "timed out", ErrorCategory.TIMEOUT,
                1200, 800, true, Map.of("rows", List.of(Map.of("score", 0.5))), "hash", Instant.now());
        IMap<String, StepState> map = hazelcast.getMap(namespace + "-steps");

        map.set("analyze", original);

        assertThat(map.get("analyze")).isEqualTo(original);
    }

    @Test
    void shouldRoundTripPendingStepState() {
        StepState original = StepState.pending("run-1", "ingest", "key-2");
        IMap<String, StepState> map = hazelcast.getMap(namespace + "-steps");

        map.set("ingest", original);

        StepState restored = map.get("ingest");
        assertThat(restored).isEqualTo(original);
        assertThat(restored.errorCategory()).isNull();
        assertThat(restored.outputRefs()).isEmpty();
    }

    @Test
    void shouldRoundTripLedgerEvent() {
        LedgerEvent original = new LedgerEvent("run-1", 7, EventType.STEP_SUCCESS,
                Instant.now().truncatedTo(ChronoUnit.MILLIS), "analyze", "{\"tokens\":10}", "abc123");
        IList<LedgerEvent> list = hazelcast.getList(namespace + "-events");

        list.add(original);

        assertThat(list.get(0)).isEqualTo(original);
    }

    @Test
    void shouldRoundTripRunScopedLedgerEvent() {
        LedgerEvent original = new LedgerEvent("run-1", 1, EventType.RUN_START,
                Instant.now().truncatedTo(ChronoUnit.MILLIS), null, "{}", "def456");
        IList<LedgerEvent> list = hazelcast.getList(namespace + "-run-events");

        list.add(original);

        assertThat(list.get(0).stepName()).isNull();
        assertThat(list.get(0)).isEqualTo(original);
    }

    @Test
    void shouldUseStepStateKeyAsMapValue() {
        IMap<String, StepStateKey> index = hazelcast.getMap(namespace + "-index");

        index.set("key-1", new StepStateKey("run-1", "analyze"));

        assertThat(index.get("key-1")).isEqualTo(new StepStateKey("run-1", "analyze"));
    }
}
