package org.neuralchilli.marshal.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.neuralchilli.marshal.domain.LedgerEvent;
import org.neuralchilli.marshal.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Ledger kept on disk as JSON lines: {@code <root>/<runId>/events.jsonl}.
 * The run's head is rewritten to {@code <root>/<runId>/head.json} on every
 * append and cached in memory.
 */
public class FileLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(FileLedgerStore.class);

    public static final String EVENTS_FILE = "events.jsonl";
    public static final String HEAD_FILE = "head.json";

    private final Path root;
    private final ObjectMapper mapper = Hashing.canonicalMapper();
    // guarded by this
    private final Map<String, LedgerEvent> heads = new HashMap<>();

    public FileLedgerStore(Path root) {
        this.root = root;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create ledger directory " + root, e);
        }
        log.info("File ledger store at {}", root.toAbsolutePath());
    }

    public Path eventsFile(String runId) {
        return root.resolve(runId).resolve(EVENTS_FILE);
    }

    public Path headFile(String runId) {
        return root.resolve(runId).resolve(HEAD_FILE);
    }

    @Override
    public synchronized void append(LedgerEvent event) {
        Path file = eventsFile(event.runId());
        try {
            Files.createDirectories(file.getParent());
            String json = mapper.writeValueAsString(event);
            Files.writeString(file, json + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            writeHead(event.runId(), json);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append ledger event to " + file, e);
        }
        heads.put(event.runId(), event);
    }

    @Override
    public synchronized List<LedgerEvent> read(String runId) {
        Path file = eventsFile(runId);
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            List<LedgerEvent> events = new ArrayList<>();
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    events.add(parse(line));
                }
            }
            return events;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read ledger " + file, e);
        }
    }

    @Override
    public synchronized Optional<LedgerEvent> last(String runId) {
        LedgerEvent cached = heads.get(runId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Path file = headFile(runId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            LedgerEvent head = parse(Files.readString(file, StandardCharsets.UTF_8).trim());
            heads.put(runId, head);
            return Optional.of(head);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read ledger head " + file, e);
        }
    }

    @Override
    public synchronized Set<String> runIds() {
        if (!Files.isDirectory(root)) {
            return Set.of();
        }
        Set<String> ids = new HashSet<>();
        try (Stream<Path> dirs = Files.list(root)) {
            dirs.filter(dir -> Files.exists(dir.resolve(EVENTS_FILE)))
                    .forEach(dir -> ids.add(dir.getFileName().toString()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list ledger directory " + root, e);
        }
        return ids;
    }

    @Override
    public synchronized void deleteRun(String runId) {
        Path file = eventsFile(runId);
        heads.remove(runId);
        try {
            Files.deleteIfExists(file);
            Files.deleteIfExists(headFile(runId));
            Files.deleteIfExists(file.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete ledger " + file, e);
        }
    }

    // replaced through a rename so a crash never leaves a half-written head
    private void writeHead(String runId, String json) throws IOException {
        Path head = headFile(runId);
        Path staged = head.resolveSibling(HEAD_FILE + ".tmp");
        Files.writeString(staged, json, StandardCharsets.UTF_8);
        Files.move(staged, head, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private LedgerEvent parse(String line) {
        try {
            return mapper.readValue(line, LedgerEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt ledger line: " + e.getOriginalMessage(), e);
        }
    }
}
