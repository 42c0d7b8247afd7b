package org.neuralchilli.marshal.service;

import java.util.List;

/**
 * Thrown when a pipeline template's dependencies form a cycle.
 * Raised at load time, never during a run.
 */
public class CycleDetectedException extends ConfigurationException {

    private final List<String> steps;

    public CycleDetectedException(String message) {
        this(message, List.of());
    }

    public CycleDetectedException(String message, List<String> steps) {
        super(message);
        this.steps = List.copyOf(steps);
    }

    /**
     * Steps that could not be ordered, if known
     */
    public List<String> steps() {
        return steps;
    }
}
