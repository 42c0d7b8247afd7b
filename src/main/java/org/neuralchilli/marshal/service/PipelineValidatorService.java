package org.neuralchilli.marshal.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.marshal.core.ExpressionEvaluator;
import org.neuralchilli.marshal.domain.PipelineTemplate;
import org.neuralchilli.marshal.domain.StepDefinition;
import org.neuralchilli.marshal.step.StepHandlerRegistry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a pipeline template beyond what the domain constructors enforce:
 * step references, handler names, parameter expressions and cycles.
 * All reference problems are reported together in one exception.
 */
@ApplicationScoped
public class PipelineValidatorService {

    private final ExpressionEvaluator expressions;
    private final StepHandlerRegistry handlers;

    @Inject
    public PipelineValidatorService(ExpressionEvaluator expressions, StepHandlerRegistry handlers) {
        this.expressions = expressions;
        this.handlers = handlers;
    }

    /**
     * Validate a pipeline template
     *
     * @throws CycleDetectedException if the dependencies form a cycle
     * @throws ConfigurationException if any other check fails
     */
    public void validate(PipelineTemplate template) {
        List<String> errors = new ArrayList<>();

        validateStepNames(template, errors);
        validateDependencies(template, errors);
        validateHandlers(template, errors);
        validateExpressions(template, errors);

        if (!errors.isEmpty()) {
            throw new ConfigurationException("Pipeline validation failed for '" + template.name() + "':\n" +
                    String.join("\n", errors));
        }

        List<String> unordered = unorderedSteps(template);
        if (!unordered.isEmpty()) {
            throw new CycleDetectedException("Pipeline '" + template.name()
                    + "' has a dependency cycle involving steps " + unordered, unordered);
        }
    }

    private void validateStepNames(PipelineTemplate template, List<String> errors) {
        Set<String> seen = new HashSet<>();
        for (StepDefinition step : template.steps()) {
            if (!seen.add(step.name())) {
                errors.add("Step '" + step.name() + "' is defined more than once");
            }
        }
    }

    private void validateDependencies(PipelineTemplate template, List<String> errors) {
        Set<String> stepNames = new HashSet<>(template.stepNames());

        for (StepDefinition step : template.steps()) {
            for (String dependency : step.dependsOn()) {
                if (dependency.equals(step.name())) {
                    errors.add("Step '" + step.name() + "' depends on itself");
                } else if (!stepNames.contains(dependency)) {
                    errors.add("Step '" + step.name() +
                            "' depends on '" + dependency + "' which is not defined in this pipeline");
                }
            }
        }
    }

    private void validateHandlers(PipelineTemplate template, List<String> errors) {
        for (StepDefinition step : template.steps()) {
            if (!handlers.contains(step.handler())) {
                errors.add("Step '" + step.name() + "' uses unknown handler '" + step.handler()
                        + "' (registered: " + handlers.names() + ")");
            }
        }
    }

    private void validateExpressions(PipelineTemplate template, List<String> errors) {
        for (StepDefinition step : template.steps()) {
            step.params().forEach((key, value) -> checkExpression(step.name() + "." + key, value, errors));
        }
    }

    private void checkExpression(String path, Object value, List<String> errors) {
        if (value instanceof String text) {
            String error = expressions.getValidationError(text);
            if (error != null) {
                errors.add("Invalid expression in '" + path + "': " + error);
            }
        } else if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> checkExpression(path + "." + k, v, errors));
        } else if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                checkExpression(path + "[" + i + "]", list.get(i), errors);
            }
        }
    }

    /**
     * Kahn's algorithm; returns the steps left with unmet in-degree, empty when acyclic.
     */
    private List<String> unorderedSteps(PipelineTemplate template) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (StepDefinition step : template.steps()) {
            inDegree.put(step.name(), step.dependsOn().size());
            for (String dependency : step.dependsOn()) {
                dependents.computeIfAbsent(dependency, d -> new ArrayList<>()).add(step.name());
            }
        }

        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((step, degree) -> {
            if (degree == 0) {
                ready.add(step);
            }
        });

        while (!ready.isEmpty()) {
            String step = ready.poll();
            inDegree.remove(step);
            for (String dependent : dependents.getOrDefault(step, List.of())) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        return template.stepNames().stream()
                .filter(inDegree::containsKey)
                .toList();
    }
}
