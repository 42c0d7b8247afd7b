package org.neuralchilli.marshal.replay;

/**
 * Which part of a run to replay.
 *
 * @param fromStep first step of the subset, null for the DAG's roots
 * @param toStep   last step of the subset, null for the DAG's leaves
 * @param override replay even when the recorded engine version differs
 */
public record ReplayOptions(String fromStep, String toStep, boolean override) {

    public static ReplayOptions all() {
        return new ReplayOptions(null, null, false);
    }

    public static ReplayOptions from(String fromStep) {
        return new ReplayOptions(fromStep, null, false);
    }

    public static ReplayOptions between(String fromStep, String toStep) {
        return new ReplayOptions(fromStep, toStep, false);
    }

    public ReplayOptions withOverride() {
        return new ReplayOptions(fromStep, toStep, true);
    }

    public boolean isPartial() {
        return fromStep != null || toStep != null;
    }
}
