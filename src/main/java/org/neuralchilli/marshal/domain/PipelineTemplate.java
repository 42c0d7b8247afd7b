package org.neuralchilli.marshal.domain;

import javax.annotation.Nonnull;
import java.io.Serial;
import java.io.Serializable;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A pipeline template: a named DAG of step definitions plus default run parameters.
 * Structural checks (unknown references, cycles) happen at load time in the validator.
 */
public final class PipelineTemplate implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String name;
    private final String description;
    private final Map<String, Object> params;
    private final List<StepDefinition> steps;

    public PipelineTemplate(
            String name,
            String description,
            Map<String, Object> params,
            List<StepDefinition> steps
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pipeline name cannot be null or empty");
        }

        if (!name.matches("^[a-z0-9-]+$")) {
            throw new IllegalArgumentException(
                    "Pipeline name must match pattern ^[a-z0-9-]+$, got: " + name
            );
        }

        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Pipeline must have at least one step");
        }

        this.name = name;
        this.description = description;
        this.params = params != null ? Map.copyOf(params) : Map.of();
        this.steps = List.copyOf(steps);
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public Map<String, Object> params() {
        return params;
    }

    public List<StepDefinition> steps() {
        return steps;
    }

    public List<String> stepNames() {
        return steps.stream()
                .map(StepDefinition::name)
                .toList();
    }

    public Optional<StepDefinition> step(String stepName) {
        return steps.stream()
                .filter(s -> s.name().equals(stepName))
                .findFirst();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        PipelineTemplate that = (PipelineTemplate) obj;
        return Objects.equals(this.name, that.name) &&
                Objects.equals(this.description, that.description) &&
                Objects.equals(this.params, that.params) &&
                Objects.equals(this.steps, that.steps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, params, steps);
    }

    @Nonnull
    @Override
    public String toString() {
        return "PipelineTemplate[name=" + name + ", steps=" + stepNames() + ']';
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String description;
        private Map<String, Object> params = Map.of();
        private List<StepDefinition> steps;

        public Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder params(Map<String, Object> params) {
            this.params = params;
            return this;
        }

        public Builder steps(List<StepDefinition> steps) {
            this.steps = steps;
            return this;
        }

        public Builder steps(StepDefinition... steps) {
            this.steps = List.of(steps);
            return this;
        }

        public PipelineTemplate build() {
            return new PipelineTemplate(name, description, params, steps);
        }
    }
}
