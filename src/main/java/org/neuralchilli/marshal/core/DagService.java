package org.neuralchilli.marshal.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.neuralchilli.marshal.domain.PipelineTemplate;
import org.neuralchilli.marshal.domain.StepDefinition;
import org.neuralchilli.marshal.domain.StepStatus;
import org.neuralchilli.marshal.service.ConfigurationException;
import org.neuralchilli.marshal.service.CycleDetectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds step DAGs with JGraphT and answers the scheduler's and replay engine's
 * structural questions. Vertices are step names; an edge runs from a dependency
 * to its dependent. All walks are iterative.
 */
@ApplicationScoped
public class DagService {

    private static final Logger log = LoggerFactory.getLogger(DagService.class);

    /**
     * Build the DAG of a pipeline template.
     *
     * @throws ConfigurationException if a dependency names an unknown step
     * @throws CycleDetectedException if the dependencies form a cycle
     */
    public DirectedAcyclicGraph<String, DefaultEdge> buildDag(PipelineTemplate template) {
        log.debug("Building DAG for pipeline: {}", template.name());

        DirectedAcyclicGraph<String, DefaultEdge> dag = new DirectedAcyclicGraph<>(DefaultEdge.class);

        for (StepDefinition step : template.steps()) {
            if (!dag.addVertex(step.name())) {
                throw new ConfigurationException("Pipeline '" + template.name()
                        + "' defines step '" + step.name() + "' more than once");
            }
        }

        for (StepDefinition step : template.steps()) {
            for (String dependency : step.dependsOn()) {
                if (!dag.containsVertex(dependency)) {
                    throw new ConfigurationException("Step '" + step.name() + "' depends on '"
                            + dependency + "' which does not exist in pipeline '" + template.name() + "'");
                }
                try {
                    dag.addEdge(dependency, step.name());
                    log.trace("Added edge: {} -> {}", dependency, step.name());
                } catch (IllegalArgumentException e) {
                    // JGraphT refuses edges that would close a cycle (and self loops)
                    throw new CycleDetectedException("Adding dependency '" + dependency + "' -> '"
                            + step.name() + "' would create a cycle in pipeline '" + template.name() + "'",
                            List.of(dependency, step.name()));
                }
            }
        }

        log.debug("DAG built: {} steps, {} edges", dag.vertexSet().size(), dag.edgeSet().size());
        return dag;
    }

    /**
     * Steps that may be dispatched now: PENDING (or without a status) with every
     * dependency COMPLETED. Returned in topological order.
     */
    public List<String> frontier(DirectedAcyclicGraph<String, DefaultEdge> dag, Map<String, StepStatus> statuses) {
        List<String> ready = new ArrayList<>();
        for (String step : topologicalOrder(dag)) {
            if (statuses.getOrDefault(step, StepStatus.PENDING) != StepStatus.PENDING) {
                continue;
            }
            boolean dependenciesDone = dependencies(dag, step).stream()
                    .allMatch(dep -> statuses.getOrDefault(dep, StepStatus.PENDING) == StepStatus.COMPLETED);
            if (dependenciesDone) {
                ready.add(step);
            }
        }
        return ready;
    }

    public Set<String> dependencies(DirectedAcyclicGraph<String, DefaultEdge> dag, String step) {
        return dag.incomingEdgesOf(step).stream()
                .map(dag::getEdgeSource)
                .collect(Collectors.toSet());
    }

    public Set<String> dependents(DirectedAcyclicGraph<String, DefaultEdge> dag, String step) {
        return dag.outgoingEdgesOf(step).stream()
                .map(dag::getEdgeTarget)
                .collect(Collectors.toSet());
    }

    /**
     * All steps reachable from {@code step}, excluding itself
     */
    public Set<String> descendants(DirectedAcyclicGraph<String, DefaultEdge> dag, String step) {
        return walk(dag, step, true);
    }

    /**
     * All steps {@code step} transitively depends on, excluding itself
     */
    public Set<String> ancestors(DirectedAcyclicGraph<String, DefaultEdge> dag, String step) {
        return walk(dag, step, false);
    }

    /**
     * Steps between {@code from} and {@code to}, both inclusive:
     * {@code ({from} + descendants(from)) ∩ ({to} + ancestors(to))}.
     * A null bound leaves that side open.
     */
    public Set<String> subset(DirectedAcyclicGraph<String, DefaultEdge> dag, String from, String to) {
        Set<String> lower;
        if (from == null) {
            lower = new LinkedHashSet<>(dag.vertexSet());
        } else {
            requireStep(dag, from);
            lower = new LinkedHashSet<>(descendants(dag, from));
            lower.add(from);
        }

        Set<String> upper;
        if (to == null) {
            upper = new HashSet<>(dag.vertexSet());
        } else {
            requireStep(dag, to);
            upper = new HashSet<>(ancestors(dag, to));
            upper.add(to);
        }

        Set<String> result = new LinkedHashSet<>();
        for (String step : topologicalOrder(dag)) {
            if (lower.contains(step) && upper.contains(step)) {
                result.add(step);
            }
        }
        return result;
    }

    /**
     * Steps in an order where every dependency comes before its dependents
     */
    public List<String> topologicalOrder(DirectedAcyclicGraph<String, DefaultEdge> dag) {
        List<String> order = new ArrayList<>();
        TopologicalOrderIterator<String, DefaultEdge> iterator = new TopologicalOrderIterator<>(dag);
        while (iterator.hasNext()) {
            order.add(iterator.next());
        }
        return order;
    }

    private Set<String> walk(DirectedAcyclicGraph<String, DefaultEdge> dag, String start, boolean downstream) {
        requireStep(dag, start);
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);

        while (!queue.isEmpty()) {
            String step = queue.poll();
            Set<String> next = downstream ? dependents(dag, step) : dependencies(dag, step);
            for (String neighbour : next) {
                if (visited.add(neighbour)) {
                    queue.add(neighbour);
                }
            }
        }
        return visited;
    }

    private void requireStep(DirectedAcyclicGraph<String, DefaultEdge> dag, String step) {
        if (!dag.containsVertex(step)) {
            throw new ConfigurationException("Unknown step: " + step);
        }
    }
}
