package org.neuralchilli.marshal.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.jexl3.JexlBuilder;
import org.apache.commons.jexl3.JexlContext;
import org.apache.commons.jexl3.JexlEngine;
import org.apache.commons.jexl3.JexlExpression;
import org.apache.commons.jexl3.MapContext;
import org.apache.commons.jexl3.introspection.JexlPermissions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates {@code ${...}} JEXL expressions in step parameters.
 *
 * <p>A value that is exactly one expression keeps the expression's type
 * ({@code "${params.limit * 2}"} yields a number); text with embedded
 * expressions is interpolated into a string.
 */
@ApplicationScoped
public class ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private final JexlEngine jexl;

    public ExpressionEvaluator() {
        this.jexl = new JexlBuilder()
                .cache(512)
                .strict(false)
                .silent(false)
                .permissions(JexlPermissions.UNRESTRICTED)
                .create();
    }

    /**
     * Evaluate an expression to a string.
     * If the value is not an expression, it's returned as-is.
     */
    public String evaluate(String expression, ExpressionContext context) {
        Object result = evaluateToObject(expression, context);
        return result != null ? result.toString() : null;
    }

    /**
     * Evaluate an expression to its raw object type.
     */
    public Object evaluateToObject(String expression, ExpressionContext context) {
        if (expression == null || !isExpression(expression)) {
            return expression;
        }

        try {
            return evaluateExpression(expression, context);
        } catch (ExpressionException e) {
            throw e;
        } catch (Exception e) {
            String msg = String.format("Failed to evaluate expression: %s - %s", expression, e.getMessage());
            log.error(msg, e);
            throw new ExpressionException(msg, e);
        }
    }

    /**
     * Resolve every expression in a parameter map, descending into nested maps and lists.
     */
    public Map<String, Object> resolve(Map<String, Object> params, ExpressionContext context) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (params == null) {
            return result;
        }
        params.forEach((key, value) -> result.put(key, resolveValue(value, context)));
        return result;
    }

    @SuppressWarnings("unchecked")
    private Object resolveValue(Object value, ExpressionContext context) {
        if (value instanceof String text) {
            return evaluateToObject(text, context);
        }
        if (value instanceof Map<?, ?> map) {
            return resolve((Map<String, Object>) map, context);
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            for (Object item : list) {
                resolved.add(resolveValue(item, context));
            }
            return resolved;
        }
        return value;
    }

    /**
     * Check if a string contains an expression
     */
    public boolean isExpression(String value) {
        return value != null && value.contains("${") && value.contains("}");
    }

    /**
     * Test if an expression is valid (can be compiled)
     */
    public boolean isValid(String expression) {
        return getValidationError(expression) == null;
    }

    /**
     * Get a detailed error message for an invalid expression, or null when it compiles
     */
    public String getValidationError(String expression) {
        if (expression == null || !isExpression(expression)) {
            return null;
        }

        int pos = 0;
        while (true) {
            int start = expression.indexOf("${", pos);
            if (start == -1) {
                return null;
            }
            int end = findClosingBrace(expression, start + 2);
            if (end == -1) {
                return "Unclosed expression in: " + expression;
            }
            try {
                jexl.createExpression(expression.substring(start + 2, end));
            } catch (RuntimeException e) {
                return e.getMessage();
            }
            pos = end + 1;
        }
    }

    private Object evaluateExpression(String expression, ExpressionContext context) {
        if (!isSingleExpression(expression)) {
            return interpolateString(expression, context);
        }

        String extracted = expression.substring(2, expression.length() - 1);
        JexlExpression compiled = jexl.createExpression(extracted);
        return compiled.evaluate(createJexlContext(context));
    }

    private boolean isSingleExpression(String expression) {
        if (!expression.startsWith("${") || !expression.endsWith("}")) {
            return false;
        }
        return findClosingBrace(expression, 2) == expression.length() - 1;
    }

    private String interpolateString(String template, ExpressionContext context) {
        StringBuilder result = new StringBuilder();
        int pos = 0;

        while (pos < template.length()) {
            int start = template.indexOf("${", pos);
            if (start == -1) {
                result.append(template.substring(pos));
                break;
            }

            result.append(template, pos, start);

            int end = findClosingBrace(template, start + 2);
            if (end == -1) {
                throw new ExpressionException("Unclosed expression in: " + template);
            }

            Object evaluated = evaluateToObject(template.substring(start, end + 1), context);
            result.append(evaluated != null ? evaluated.toString() : "");

            pos = end + 1;
        }

        return result.toString();
    }

    private int findClosingBrace(String str, int start) {
        int depth = 1;
        for (int i = start; i < str.length(); i++) {
            if (str.charAt(i) == '{') {
                depth++;
            } else if (str.charAt(i) == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private JexlContext createJexlContext(ExpressionContext context) {
        MapContext jexlContext = new MapContext();
        jexlContext.set("params", context.params());
        jexlContext.set("run", context.run());
        jexlContext.set("Math", Math.class);
        return jexlContext;
    }
}
