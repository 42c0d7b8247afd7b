package org.neuralchilli.marshal.ledger;

import org.neuralchilli.marshal.domain.EventType;
import org.neuralchilli.marshal.domain.LedgerEvent;
import org.neuralchilli.marshal.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, hash-chained log of run and step lifecycle events.
 *
 * <p>Appends are serialized per run, so event ids within a run are gap-free and
 * start at 1. Each event's hash covers its own content and the previous event's
 * hash ({@link #GENESIS_HASH} for the first), which makes any in-place edit
 * detectable by {@link #verify(String)}. New events chain from the store's
 * head, and verification checks the chain ends there, so events removed from
 * the end are caught as well.
 */
public class EventLedger {

    private static final Logger log = LoggerFactory.getLogger(EventLedger.class);

    public static final String GENESIS_HASH = "0".repeat(64);

    private final LedgerStore store;
    private final Clock clock;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public EventLedger(LedgerStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public EventLedger(LedgerStore store) {
        this(store, Clock.systemUTC());
    }

    public LedgerEvent append(String runId, EventType type, String stepName, Map<String, Object> payload) {
        ReentrantLock lock = locks.computeIfAbsent(runId, id -> new ReentrantLock());
        lock.lock();
        try {
            Optional<LedgerEvent> previous = store.last(runId);
            long eventId = previous.map(e -> e.eventId() + 1).orElse(1L);
            String previousHash = previous.map(LedgerEvent::dataHash).orElse(GENESIS_HASH);

            LedgerEvent unsealed = new LedgerEvent(runId, eventId, type,
                    Instant.ofEpochMilli(clock.millis()), stepName,
                    Hashing.canonicalJson(payload != null ? payload : Map.of()), null);
            LedgerEvent event = new LedgerEvent(unsealed.runId(), eventId, type, unsealed.timestamp(),
                    stepName, unsealed.payload(), Hashing.chain(unsealed.hashMaterial(), previousHash));

            store.append(event);
            log.trace("Ledger {} #{} {} {}", runId, eventId, type, stepName != null ? stepName : "");
            return event;
        } finally {
            lock.unlock();
        }
    }

    public LedgerEvent append(String runId, EventType type, Map<String, Object> payload) {
        return append(runId, type, null, payload);
    }

    /**
     * Record a compensating entry for an earlier event. The original stays untouched.
     */
    public LedgerEvent appendCorrection(String runId, long correctedEventId, String reason,
                                        Map<String, Object> correction) {
        List<LedgerEvent> events = store.read(runId);
        LedgerEvent target = events.stream()
                .filter(e -> e.eventId() == correctedEventId)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Run " + runId + " has no event #" + correctedEventId));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("corrects", correctedEventId);
        payload.put("corrected_type", target.eventType().name());
        payload.put("reason", reason);
        payload.put("correction", correction != null ? correction : Map.of());

        log.info("Appending correction to run {} for event #{}: {}", runId, correctedEventId, reason);
        return append(runId, EventType.CORRECTION, target.stepName(), payload);
    }

    public List<LedgerEvent> read(String runId) {
        return store.read(runId);
    }

    public Optional<LedgerEvent> last(String runId) {
        return store.last(runId);
    }

    /**
     * Last event recorded for one step of a run
     */
    public Optional<LedgerEvent> lastForStep(String runId, String stepName) {
        List<LedgerEvent> events = store.read(runId);
        for (int i = events.size() - 1; i >= 0; i--) {
            if (stepName.equals(events.get(i).stepName())) {
                return Optional.of(events.get(i));
            }
        }
        return Optional.empty();
    }

    public boolean verify(String runId) {
        return verifyDetailed(runId).valid();
    }

    public LedgerVerification verifyDetailed(String runId) {
        List<LedgerEvent> events = store.read(runId);
        String previousHash = GENESIS_HASH;
        long expectedId = 1;

        for (LedgerEvent event : events) {
            if (!runId.equals(event.runId())) {
                return broken(runId, events.size(), event.eventId(),
                        "event belongs to run " + event.runId());
            }
            if (event.eventId() != expectedId) {
                return broken(runId, events.size(), event.eventId(),
                        "expected event #" + expectedId + " but found #" + event.eventId());
            }
            String expectedHash = Hashing.chain(event.hashMaterial(), previousHash);
            if (!expectedHash.equals(event.dataHash())) {
                return broken(runId, events.size(), event.eventId(), "hash mismatch");
            }
            previousHash = event.dataHash();
            expectedId++;
        }

        long lastId = expectedId - 1;
        Optional<LedgerEvent> head = store.last(runId);
        if (head.isEmpty()) {
            if (lastId == 0) {
                return LedgerVerification.ok(runId, 0);
            }
            return broken(runId, events.size(), lastId, "no head recorded for chain ending at #" + lastId);
        }
        long headId = head.get().eventId();
        if (headId != lastId) {
            return broken(runId, events.size(), Math.min(headId, lastId) + 1,
                    "chain ends at #" + lastId + " but head is #" + headId);
        }
        if (!head.get().dataHash().equals(previousHash)) {
            return broken(runId, events.size(), lastId, "head hash does not match event #" + lastId);
        }

        return LedgerVerification.ok(runId, events.size());
    }

    public boolean hasRun(String runId) {
        return store.last(runId).isPresent();
    }

    public void deleteRun(String runId) {
        store.deleteRun(runId);
        locks.remove(runId);
    }

    private LedgerVerification broken(String runId, int count, long eventId, String reason) {
        log.warn("Ledger of run {} failed verification at event #{}: {}", runId, eventId, reason);
        return LedgerVerification.broken(runId, count, eventId, reason);
    }
}
