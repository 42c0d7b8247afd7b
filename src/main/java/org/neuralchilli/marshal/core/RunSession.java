package org.neuralchilli.marshal.core;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.neuralchilli.marshal.domain.PipelineTemplate;
import org.neuralchilli.marshal.domain.Run;
import org.neuralchilli.marshal.domain.StepDefinition;
import org.neuralchilli.marshal.domain.StepState;
import org.neuralchilli.marshal.state.StateManager;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Everything the scheduler and executor share about one executing run: the run
 * record, its template and DAG, the state store holding its step states, the
 * resolved step parameters and the cancellation flag.
 */
public class RunSession {

    private volatile Run run;
    private final PipelineTemplate template;
    private final DirectedAcyclicGraph<String, DefaultEdge> dag;
    private final StateManager states;
    private final Map<String, Map<String, Object>> effectiveParams = new ConcurrentHashMap<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicInteger spanSequence = new AtomicInteger();

    public RunSession(
            Run run,
            PipelineTemplate template,
            DirectedAcyclicGraph<String, DefaultEdge> dag,
            StateManager states
    ) {
        this.run = run;
        this.template = template;
        this.dag = dag;
        this.states = states;
    }

    public Run run() {
        return run;
    }

    void updateRun(Run updated) {
        this.run = updated;
    }

    public String runId() {
        return run.runId();
    }

    public PipelineTemplate template() {
        return template;
    }

    public DirectedAcyclicGraph<String, DefaultEdge> dag() {
        return dag;
    }

    public StateManager states() {
        return states;
    }

    public StepDefinition step(String stepName) {
        return template.step(stepName).orElseThrow(() -> new IllegalArgumentException(
                "Pipeline '" + template.name() + "' has no step '" + stepName + "'"));
    }

    public Map<String, Object> effectiveParams(String stepName) {
        return effectiveParams.getOrDefault(stepName, Map.of());
    }

    void setEffectiveParams(String stepName, Map<String, Object> params) {
        effectiveParams.put(stepName, params);
    }

    /**
     * Outputs of the step's direct dependencies
     */
    public Map<String, Map<String, Object>> upstreamOutputs(String stepName) {
        Map<String, Map<String, Object>> outputs = new LinkedHashMap<>();
        for (String dependency : step(stepName).dependsOn()) {
            states.get(runId(), dependency)
                    .filter(StepState::isCompleted)
                    .ifPresent(s -> outputs.put(dependency, s.outputRefs()));
        }
        return outputs;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @return false if the session was already cancelled
     */
    boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public int nextSpanSequence() {
        return spanSequence.incrementAndGet();
    }
}
