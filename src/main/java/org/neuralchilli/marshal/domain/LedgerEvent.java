package org.neuralchilli.marshal.domain;

import java.io.Serializable;
import java.time.Instant;

/**
 * Immutable, hash-chained ledger entry.
 *
 * <p>{@code payload} is canonical JSON text so that hashing and tamper detection
 * work on the exact bytes that were written. {@code dataHash} covers this event's
 * identity, payload and the previous event's hash.
 */
public record LedgerEvent(
        String runId,
        long eventId,
        EventType eventType,
        Instant timestamp,
        String stepName,
        String payload,
        String dataHash
) implements Serializable {

    public LedgerEvent {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("Run ID cannot be null or empty");
        }
        if (eventId < 1) {
            throw new IllegalArgumentException("Event ID must be >= 1");
        }
        if (eventType == null) {
            throw new IllegalArgumentException("Event type cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Timestamp cannot be null");
        }
        if (payload == null) {
            payload = "{}";
        }
    }

    /**
     * Text fed to the hash function together with the previous hash.
     */
    public String hashMaterial() {
        return eventId + "|" + eventType + "|" + (stepName != null ? stepName : "")
                + "|" + timestamp.toEpochMilli() + "|" + payload;
    }

    public boolean stepScoped() {
        return stepName != null;
    }
}
