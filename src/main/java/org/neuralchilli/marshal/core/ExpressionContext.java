package org.neuralchilli.marshal.core;

import java.util.Map;

/**
 * Variables visible to step parameter expressions: {@code params.*} (run
 * parameters over template defaults) and {@code run.*} (id, template, seed).
 */
public record ExpressionContext(
        Map<String, Object> params,
        Map<String, Object> run
) {
    public ExpressionContext {
        if (params == null) {
            params = Map.of();
        }
        if (run == null) {
            run = Map.of();
        }
    }

    /**
     * Create a context with only parameters
     */
    public static ExpressionContext withParams(Map<String, Object> params) {
        return new ExpressionContext(params, Map.of());
    }

    /**
     * Create an empty context
     */
    public static ExpressionContext empty() {
        return new ExpressionContext(Map.of(), Map.of());
    }
}
