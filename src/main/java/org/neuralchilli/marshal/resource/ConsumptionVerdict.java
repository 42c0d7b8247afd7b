package org.neuralchilli.marshal.resource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Post-execution check of a step's token consumption against its grant.
 *
 * @param newGranted grant after throttling, equal to {@code granted} when not throttled
 * @param alert      consumption crossed the alert threshold
 */
public record ConsumptionVerdict(
        String stepName,
        long granted,
        long consumed,
        boolean throttled,
        long newGranted,
        boolean alert
) {

    public double usage() {
        return granted == 0 ? 0.0 : (double) consumed / granted;
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("granted", granted);
        payload.put("consumed", consumed);
        payload.put("new_granted", newGranted);
        payload.put("manual_review", throttled);
        return payload;
    }
}
