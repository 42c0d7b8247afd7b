package org.neuralchilli.marshal.ledger;

/**
 * Outcome of checking a run's hash chain.
 *
 * @param brokenAtEventId first event whose hash or sequence does not check out, or 0 when valid
 */
public record LedgerVerification(
        String runId,
        boolean valid,
        int eventCount,
        long brokenAtEventId,
        String reason
) {

    public static LedgerVerification ok(String runId, int eventCount) {
        return new LedgerVerification(runId, true, eventCount, 0, null);
    }

    public static LedgerVerification broken(String runId, int eventCount, long eventId, String reason) {
        return new LedgerVerification(runId, false, eventCount, eventId, reason);
    }
}
