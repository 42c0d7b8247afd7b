package org.neuralchilli.marshal.service;

import com.fasterxml.jackson.databind.ObjectWriter;
import org.neuralchilli.marshal.domain.LedgerEvent;
import org.neuralchilli.marshal.domain.Run;
import org.neuralchilli.marshal.domain.StepState;
import org.neuralchilli.marshal.ledger.EventLedger;
import org.neuralchilli.marshal.ledger.FileLedgerStore;
import org.neuralchilli.marshal.state.StateManager;
import org.neuralchilli.marshal.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes a self-contained copy of a run to disk:
 *
 * <pre>
 * &lt;dir&gt;/&lt;run_id&gt;/
 *   run.json
 *   inputs/params.json
 *   outputs/&lt;step&gt;.json     (completed steps only)
 *   state/&lt;step&gt;.json
 *   events.jsonl              (hash-chained, one event per line)
 * </pre>
 */
public class RunArchiver {

    private static final Logger log = LoggerFactory.getLogger(RunArchiver.class);

    private final StateManager states;
    private final EventLedger ledger;
    private final ObjectWriter pretty = Hashing.canonicalMapper().writerWithDefaultPrettyPrinter();

    public RunArchiver(StateManager states, EventLedger ledger) {
        this.states = states;
        this.ledger = ledger;
    }

    /**
     * @return the directory the run was written to
     * @throws RunNotFoundException if the run is unknown
     * @throws UncheckedIOException if writing fails
     */
    public Path export(String runId, Path directory) {
        Run run = states.getRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
        Map<String, StepState> steps = states.forRun(run).getAll(runId);
        Path root = directory.resolve(runId);

        try {
            Files.createDirectories(root.resolve("inputs"));
            Files.createDirectories(root.resolve("outputs"));
            Files.createDirectories(root.resolve("state"));

            pretty.writeValue(root.resolve("run.json").toFile(), run);
            pretty.writeValue(root.resolve("inputs").resolve("params.json").toFile(), run.params());

            for (StepState state : steps.values()) {
                pretty.writeValue(root.resolve("state").resolve(state.stepName() + ".json").toFile(), state);
                if (state.isCompleted()) {
                    pretty.writeValue(root.resolve("outputs").resolve(state.stepName() + ".json").toFile(),
                            state.outputRefs());
                }
            }

            int events = 0;
            try (BufferedWriter writer = Files.newBufferedWriter(root.resolve(FileLedgerStore.EVENTS_FILE))) {
                for (LedgerEvent event : ledger.read(runId)) {
                    writer.write(Hashing.canonicalJson(event));
                    writer.newLine();
                    events++;
                }
            }

            log.info("Exported run {} to {} ({} steps, {} events)", runId, root, steps.size(), events);
            return root;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export run " + runId + " to " + root, e);
        }
    }
}
