package org.neuralchilli.marshal.resource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Breakdown of one dynamic token ceiling:
 * {@code base * load * priority * behavior * health}, clamped to
 * {@code [0.3 * base, 3.0 * base]} and then to any per-step cap.
 */
public record TokenBudget(
        long base,
        double loadMultiplier,
        double priorityMultiplier,
        double behaviorMultiplier,
        double healthMultiplier,
        long limit
) {

    public static final double MIN_FACTOR = 0.3;
    public static final double MAX_FACTOR = 3.0;

    public double combinedMultiplier() {
        return loadMultiplier * priorityMultiplier * behaviorMultiplier * healthMultiplier;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("base", base);
        map.put("load", loadMultiplier);
        map.put("priority", priorityMultiplier);
        map.put("behavior", behaviorMultiplier);
        map.put("health", healthMultiplier);
        map.put("limit", limit);
        return map;
    }
}
