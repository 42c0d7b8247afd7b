package org.neuralchilli.marshal.domain;

/**
 * Scheduling priority of a step. Each level scales the step's token ceiling.
 */
public enum Priority {
    LOW(0.7),
    NORMAL(1.0),
    HIGH(1.3),
    CRITICAL(1.5);

    private final double multiplier;

    Priority(double multiplier) {
        this.multiplier = multiplier;
    }

    public double multiplier() {
        return multiplier;
    }

    /**
     * Parse from template text (case-insensitive). Null or blank means NORMAL.
     */
    public static Priority fromString(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return Priority.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown priority: " + value + " (expected low, normal, high or critical)"
            );
        }
    }
}
