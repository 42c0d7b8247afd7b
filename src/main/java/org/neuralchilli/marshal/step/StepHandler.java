package org.neuralchilli.marshal.step;

import java.util.Map;

/**
 * External implementation of a pipeline step (ingestion, synthesis, simulation,
 * analysis, reporting). Handlers are CDI beans collected by name into the
 * {@link StepHandlerRegistry}.
 *
 * <p>Implementations must be idempotent for a given run id and parameters, and
 * should signal failures with {@link TransientStepException} (worth retrying) or
 * {@link FatalStepException} (not worth retrying). Any other exception is treated
 * as transient.
 */
public interface StepHandler {

    /**
     * Name templates use to reference this handler
     */
    String name();

    StepOutput execute(RunContext context, Map<String, Object> params) throws Exception;
}
