package org.neuralchilli.marshal.ledger;

import org.neuralchilli.marshal.domain.LedgerEvent;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only storage of ledger events, one ordered sequence per run.
 * Callers serialize appends per run; implementations only need to keep order.
 *
 * <p>Besides the sequence, every store keeps a head per run: the last appended
 * event, stored apart from the sequence and replaced on each append. The head
 * lets verification notice events cut from the end of a chain.
 */
public interface LedgerStore {

    void append(LedgerEvent event);

    /**
     * All events of a run in append order. Empty if the run has no events.
     */
    List<LedgerEvent> read(String runId);

    /**
     * Head of a run: the event most recently appended, as recorded at append time.
     * Empty if the run has no events.
     */
    Optional<LedgerEvent> last(String runId);

    Set<String> runIds();

    /**
     * Drop a run's events. Only retention cleanup calls this.
     */
    void deleteRun(String runId);
}
