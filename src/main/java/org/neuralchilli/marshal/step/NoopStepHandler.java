package org.neuralchilli.marshal.step;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.Map;

/**
 * Built-in handler that does nothing and echoes its parameters. Useful as a join
 * point in templates and for wiring checks.
 */
@ApplicationScoped
public class NoopStepHandler implements StepHandler {

    public static final String NAME = "noop";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StepOutput execute(RunContext context, Map<String, Object> params) {
        return StepOutput.of(Map.of("params", params), 0);
    }
}
