package org.neuralchilli.marshal.ledger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.neuralchilli.marshal.domain.EventType;
import org.neuralchilli.marshal.domain.LedgerEvent;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class FileLedgerStoreTest {

    @TempDir
    Path root;

    private FileLedgerStore store;
    private EventLedger ledger;

    @BeforeEach
    void setup() {
        store = new FileLedgerStore(root);
        ledger = new EventLedger(store);
    }

    @Test
    void shouldWriteOneJsonLinePerEvent() throws Exception {
        ledger.append("run-1", EventType.RUN_START, Map.of("template", "research"));
        ledger.append("run-1", EventType.STEP_START, "ingest", Map.of());

        List<String> lines = Files.readAllLines(store.eventsFile("run-1"), StandardCharsets.UTF_8);

        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).contains("\"eventType\":\"RUN_START\"");
        assertThat(store.runIds()).containsExactly("run-1");
    }

    @Test
    void shouldReadBackEqualEvents() {
        LedgerEvent written = ledger.append("run-1", EventType.STEP_SUCCESS, "ingest",
                Map.of("outputs", Map.of("rows", 3)));

        assertThat(store.read("run-1")).containsExactly(written);
        assertThat(store.last("run-1")).contains(written);
        assertThat(ledger.verify("run-1")).isTrue();
    }

    @Test
    void shouldContinueChainAcrossStoreInstances() {
        ledger.append("run-1", EventType.RUN_START, Map.of());

        EventLedger reopened = new EventLedger(new FileLedgerStore(root));
        LedgerEvent next = reopened.append("run-1", EventType.RUN_COMPLETE, Map.of());

        assertThat(next.eventId()).isEqualTo(2);
        assertThat(reopened.verify("run-1")).isTrue();
    }

    @Test
    void shouldDetectHandEditedLine() throws Exception {
        ledger.append("run-1", EventType.RUN_START, Map.of());
        ledger.append("run-1", EventType.STEP_SUCCESS, "ingest", Map.of("tokens", 10));

        Path file = store.eventsFile("run-1");
        String edited = Files.readString(file, StandardCharsets.UTF_8).replace("{\\\"tokens\\\":10}", "{\\\"tokens\\\":99}");
        Files.writeString(file, edited, StandardCharsets.UTF_8);

        LedgerVerification verification = ledger.verifyDetailed("run-1");
        assertThat(verification.valid()).isFalse();
        assertThat(verification.brokenAtEventId()).isEqualTo(2);
    }

    @Test
    void shouldDetectTruncatedFile() throws Exception {
        ledger.append("run-1", EventType.RUN_START, Map.of());
        ledger.append("run-1", EventType.STEP_SUCCESS, "ingest", Map.of("tokens", 10));
        ledger.append("run-1", EventType.RUN_COMPLETE, Map.of());

        // When: the last line is dropped from the events file
        Path file = store.eventsFile("run-1");
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        Files.write(file, lines.subList(0, 2), StandardCharsets.UTF_8);

        // Then: both the live store and a fresh one see the cut
        assertThat(ledger.verifyDetailed("run-1").brokenAtEventId()).isEqualTo(3);
        LedgerVerification reopened = new EventLedger(new FileLedgerStore(root)).verifyDetailed("run-1");
        assertThat(reopened.valid()).isFalse();
        assertThat(reopened.brokenAtEventId()).isEqualTo(3);
        assertThat(reopened.reason()).contains("head is #3");
    }

    @Test
    void shouldServeLastEventFromHeadFile() throws Exception {
        ledger.append("run-1", EventType.RUN_START, Map.of());
        LedgerEvent latest = ledger.append("run-1", EventType.RUN_COMPLETE, Map.of("status", "COMPLETED"));

        assertThat(Files.exists(store.headFile("run-1"))).isTrue();
        assertThat(store.last("run-1")).contains(latest);
        assertThat(new FileLedgerStore(root).last("run-1")).contains(latest);
        assertThat(store.last("run-2")).isEmpty();
    }

    @Test
    void shouldDeleteRunFiles() {
        ledger.append("run-1", EventType.RUN_START, Map.of());

        store.deleteRun("run-1");

        assertThat(Files.exists(store.eventsFile("run-1"))).isFalse();
        assertThat(Files.exists(store.headFile("run-1"))).isFalse();
        assertThat(store.last("run-1")).isEmpty();
        assertThat(store.read("run-1")).isEmpty();
        assertThat(store.runIds()).isEmpty();
    }
}
