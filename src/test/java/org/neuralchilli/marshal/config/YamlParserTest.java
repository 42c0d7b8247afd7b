package org.neuralchilli.marshal.config;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import org.neuralchilli.marshal.domain.PipelineTemplate;
import org.neuralchilli.marshal.domain.Priority;
import org.neuralchilli.marshal.domain.StepDefinition;
import org.neuralchilli.marshal.service.ConfigurationException;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@QuarkusTest
class YamlParserTest {

    @Inject
    YamlParser yamlParser;

    @Test
    void shouldParseFullPipeline() {
        // Given: a pipeline using every step field
        String yaml = """
                name: research
                description: Research pipeline
                params:
                  topic: llm-evals
                  depth: 2
                steps:
                  - name: ingest
                    handler: http-fetch
                    timeout: 30s
                    token_budget: 2000
                    requested_tokens: 1500
                    priority: high
                    retry:
                      max_attempts: 4
                      base_delay: 500ms
                      max_delay: 1m
                      jitter: 0.25
                      retry_on_timeout: false
                    circuit_breaker:
                      failure_threshold: 3
                      recovery_timeout: PT2M
                  - name: analyze
                    handler: llm
                    depends_on: [ingest]
                    optional: true
                    params:
                      prompt: "Summarise ${params.topic}"
                """;

        // When: Parse
        PipelineTemplate template = yamlParser.parsePipeline(yaml);

        // Then: every field is mapped
        assertThat(template.name()).isEqualTo("research");
        assertThat(template.description()).isEqualTo("Research pipeline");
        assertThat(template.params()).containsEntry("topic", "llm-evals").containsEntry("depth", 2);
        assertThat(template.stepNames()).containsExactly("ingest", "analyze");

        StepDefinition ingest = template.step("ingest").orElseThrow();
        assertThat(ingest.handler()).isEqualTo("http-fetch");
        assertThat(ingest.timeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(ingest.tokenBudgetBase()).isEqualTo(2000);
        assertThat(ingest.requestedTokens()).isEqualTo(1500);
        assertThat(ingest.priority()).isEqualTo(Priority.HIGH);
        assertThat(ingest.retryPolicy().maxAttempts()).isEqualTo(4);
        assertThat(ingest.retryPolicy().baseDelay()).isEqualTo(Duration.ofMillis(500));
        assertThat(ingest.retryPolicy().maxDelay()).isEqualTo(Duration.ofMinutes(1));
        assertThat(ingest.retryPolicy().jitterFactor()).isEqualTo(0.25);
        assertThat(ingest.retryPolicy().retryOnTimeout()).isFalse();
        assertThat(ingest.circuitBreaker().failureThreshold()).isEqualTo(3);
        assertThat(ingest.circuitBreaker().recoveryTimeout()).isEqualTo(Duration.ofMinutes(2));

        StepDefinition analyze = template.step("analyze").orElseThrow();
        assertThat(analyze.dependsOn()).containsExactly("ingest");
        assertThat(analyze.optional()).isTrue();
        assertThat(analyze.params()).containsEntry("prompt", "Summarise ${params.topic}");
        assertThat(analyze.requestedTokens()).isEqualTo(analyze.tokenBudgetBase());
    }

    @Test
    void shouldApplyDefaults() {
        String yaml = """
                name: minimal
                steps:
                  - name: only
                    handler: noop
                """;

        StepDefinition only = yamlParser.parsePipeline(yaml).steps().get(0);

        assertThat(only.priority()).isEqualTo(Priority.NORMAL);
        assertThat(only.timeout()).isEqualTo(Duration.ofMinutes(10));
        assertThat(only.tokenBudgetBase()).isEqualTo(1000);
        assertThat(only.optional()).isFalse();
        assertThat(only.dependsOn()).isEmpty();
    }

    @Test
    void shouldParseFromStream() {
        String yaml = """
                name: streamed
                steps:
                  - name: a
                    handler: noop
                  - name: b
                    handler: noop
                    depends_on: a
                """;

        PipelineTemplate template = yamlParser.parsePipeline(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        assertThat(template.step("b").orElseThrow().dependsOn()).isEqualTo(List.of("a"));
    }

    @Test
    void shouldRejectMissingName() {
        String yaml = """
                steps:
                  - name: a
                    handler: noop
                """;

        assertThatThrownBy(() -> yamlParser.parsePipeline(yaml))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("name");
    }

    @Test
    void shouldRejectPipelineWithoutSteps() {
        assertThatThrownBy(() -> yamlParser.parsePipeline("name: empty\nsteps: []\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("at least one step");
    }

    @Test
    void shouldRejectInvalidStepFields() {
        String yaml = """
                name: bad
                steps:
                  - name: a
                    handler: noop
                    priority: urgent
                """;

        assertThatThrownBy(() -> yamlParser.parsePipeline(yaml))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid step 'a'")
                .hasMessageContaining("urgent");
    }

    @Test
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> yamlParser.parsePipeline("name: [unclosed"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Malformed YAML");
    }

    @Test
    void shouldParseDurationForms() {
        assertThat(YamlParser.parseDuration(5)).isEqualTo(Duration.ofSeconds(5));
        assertThat(YamlParser.parseDuration(1.5)).isEqualTo(Duration.ofMillis(1500));
        assertThat(YamlParser.parseDuration("250ms")).isEqualTo(Duration.ofMillis(250));
        assertThat(YamlParser.parseDuration("5m")).isEqualTo(Duration.ofMinutes(5));
        assertThat(YamlParser.parseDuration("1h")).isEqualTo(Duration.ofHours(1));
        assertThat(YamlParser.parseDuration("PT45S")).isEqualTo(Duration.ofSeconds(45));
        assertThatThrownBy(() -> YamlParser.parseDuration("soon"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldIgnoreUnusedMapEntries() {
        String yaml = """
                name: extra
                owner: research-team
                steps:
                  - name: a
                    handler: noop
                    params:
                      nested:
                        values: [1, 2]
                """;

        PipelineTemplate template = yamlParser.parsePipeline(yaml);

        assertThat(template.steps().get(0).params()).containsEntry("nested", Map.of("values", List.of(1, 2)));
    }
}
