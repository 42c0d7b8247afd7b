package org.neuralchilli.marshal.core;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.junit.jupiter.api.Test;
import org.neuralchilli.marshal.domain.PipelineTemplate;
import org.neuralchilli.marshal.domain.StepDefinition;
import org.neuralchilli.marshal.domain.StepStatus;
import org.neuralchilli.marshal.service.ConfigurationException;
import org.neuralchilli.marshal.service.CycleDetectedException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DagServiceTest {

    private final DagService service = new DagService();

    @Test
    void shouldOrderLinearPipeline() {
        // Given: ingest -> synthesize -> analyze -> report
        PipelineTemplate template = linear();

        DirectedAcyclicGraph<String, DefaultEdge> dag = service.buildDag(template);

        assertThat(dag.vertexSet()).hasSize(4);
        assertThat(dag.edgeSet()).hasSize(3);
        assertThat(service.topologicalOrder(dag))
                .containsExactly("ingest", "synthesize", "analyze", "report");
    }

    @Test
    void shouldResolveDiamondNeighbours() {
        // Given: a -> b, a -> c, (b, c) -> d
        DirectedAcyclicGraph<String, DefaultEdge> dag = service.buildDag(diamond());

        assertThat(service.topologicalOrder(dag)).startsWith("a").endsWith("d");
        assertThat(service.dependencies(dag, "d")).containsExactlyInAnyOrder("b", "c");
        assertThat(service.dependents(dag, "a")).containsExactlyInAnyOrder("b", "c");
    }

    @Test
    void shouldRejectUnknownDependency() {
        PipelineTemplate template = PipelineTemplate.builder("broken")
                .steps(step("a"), step("b", "missing"))
                .build();

        assertThatThrownBy(() -> service.buildDag(template))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void shouldRejectCycle() {
        PipelineTemplate template = PipelineTemplate.builder("cyclic")
                .steps(step("a", "c"), step("b", "a"), step("c", "b"))
                .build();

        assertThatThrownBy(() -> service.buildDag(template))
                .isInstanceOf(CycleDetectedException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    void shouldComputeFrontierFromStatuses() {
        DirectedAcyclicGraph<String, DefaultEdge> dag = service.buildDag(diamond());

        assertThat(service.frontier(dag, Map.of())).containsExactly("a");
        assertThat(service.frontier(dag, Map.of("a", StepStatus.COMPLETED)))
                .containsExactlyInAnyOrder("b", "c");
        assertThat(service.frontier(dag, Map.of(
                "a", StepStatus.COMPLETED,
                "b", StepStatus.COMPLETED,
                "c", StepStatus.RUNNING))).isEmpty();
        assertThat(service.frontier(dag, Map.of(
                "a", StepStatus.COMPLETED,
                "b", StepStatus.COMPLETED,
                "c", StepStatus.COMPLETED))).containsExactly("d");
    }

    @Test
    void shouldNotDispatchDependentsOfFailedStep() {
        DirectedAcyclicGraph<String, DefaultEdge> dag = service.buildDag(diamond());

        List<String> frontier = service.frontier(dag, Map.of(
                "a", StepStatus.COMPLETED,
                "b", StepStatus.FAILED,
                "c", StepStatus.COMPLETED));

        assertThat(frontier).isEmpty();
    }

    @Test
    void shouldWalkAncestorsAndDescendants() {
        DirectedAcyclicGraph<String, DefaultEdge> dag = service.buildDag(diamond());

        assertThat(service.descendants(dag, "b")).containsExactly("d");
        assertThat(service.descendants(dag, "a")).containsExactlyInAnyOrder("b", "c", "d");
        assertThat(service.ancestors(dag, "d")).containsExactlyInAnyOrder("a", "b", "c");
        assertThat(service.ancestors(dag, "a")).isEmpty();
    }

    @Test
    void shouldSelectSubsetBetweenSteps() {
        DirectedAcyclicGraph<String, DefaultEdge> dag = service.buildDag(linear());

        assertThat(service.subset(dag, "synthesize", "analyze")).containsExactly("synthesize", "analyze");
        assertThat(service.subset(dag, "analyze", null)).containsExactly("analyze", "report");
        assertThat(service.subset(dag, null, "synthesize")).containsExactly("ingest", "synthesize");
        assertThat(service.subset(dag, null, null)).hasSize(4);
    }

    @Test
    void shouldIntersectSubsetInDiamond() {
        DirectedAcyclicGraph<String, DefaultEdge> dag = service.buildDag(diamond());

        assertThat(service.subset(dag, "b", "d")).containsExactly("b", "d");
        assertThat(service.subset(dag, "b", "c")).isEmpty();
    }

    @Test
    void shouldRejectUnknownSubsetBound() {
        DirectedAcyclicGraph<String, DefaultEdge> dag = service.buildDag(linear());

        assertThatThrownBy(() -> service.subset(dag, "nope", null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Unknown step");
    }

    @Test
    void shouldHandleDeepChainsIteratively() {
        StepDefinition[] steps = new StepDefinition[2000];
        steps[0] = step("s0");
        for (int i = 1; i < steps.length; i++) {
            steps[i] = step("s" + i, "s" + (i - 1));
        }
        DirectedAcyclicGraph<String, DefaultEdge> dag =
                service.buildDag(PipelineTemplate.builder("deep").steps(steps).build());

        assertThat(service.descendants(dag, "s0")).hasSize(1999);
        assertThat(service.ancestors(dag, "s1999")).hasSize(1999);
    }

    private static PipelineTemplate linear() {
        return PipelineTemplate.builder("research")
                .steps(step("ingest"), step("synthesize", "ingest"),
                        step("analyze", "synthesize"), step("report", "analyze"))
                .build();
    }

    private static PipelineTemplate diamond() {
        return PipelineTemplate.builder("diamond")
                .steps(step("a"), step("b", "a"), step("c", "a"), step("d", "b", "c"))
                .build();
    }

    private static StepDefinition step(String name, String... dependsOn) {
        return StepDefinition.builder(name).handler("noop").dependsOn(dependsOn).build();
    }
}
