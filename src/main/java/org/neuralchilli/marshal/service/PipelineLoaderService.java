package org.neuralchilli.marshal.service;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.marshal.config.MarshalConfig;
import org.neuralchilli.marshal.config.YamlParser;
import org.neuralchilli.marshal.domain.PipelineTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Loads pipeline templates from YAML files into the {@link PipelineRegistry}.
 * Every template is validated before it is registered; a bad file is reported
 * and skipped without affecting the others.
 */
@ApplicationScoped
public class PipelineLoaderService {

    private static final Logger log = LoggerFactory.getLogger(PipelineLoaderService.class);

    @Inject
    YamlParser yamlParser;

    @Inject
    PipelineValidatorService validator;

    @Inject
    PipelineRegistry registry;

    @Inject
    MarshalConfig config;

    void onStart(@Observes StartupEvent event) {
        log.info("Loading pipelines from: {}", config.pipelines().path());
        List<LoadResult> results = loadAll(Path.of(config.pipelines().path()));
        logResults(results);
    }

    /**
     * Load every {@code .yaml}/{@code .yml} file under {@code directory}
     */
    public List<LoadResult> loadAll(Path directory) {
        List<LoadResult> results = new ArrayList<>();

        if (!Files.isDirectory(directory)) {
            log.warn("Pipelines directory does not exist: {}", directory);
            return results;
        }

        try (Stream<Path> paths = Files.walk(directory)) {
            paths.filter(p -> p.toString().endsWith(".yaml") || p.toString().endsWith(".yml"))
                    .sorted()
                    .forEach(path -> results.add(load(path)));
        } catch (IOException e) {
            throw new UncheckedIOException("Error scanning pipelines directory: " + directory, e);
        }

        return results;
    }

    /**
     * Load a single pipeline file
     */
    public LoadResult load(Path path) {
        try {
            log.debug("Loading pipeline from: {}", path);
            PipelineTemplate template = register(Files.readString(path));
            return LoadResult.success(template.name(), template.steps().size());
        } catch (IOException e) {
            log.error("Failed to read pipeline file: {}", path, e);
            return LoadResult.failure(path.getFileName().toString(), e);
        } catch (OrchestrationException e) {
            log.error("Failed to load pipeline from {}: {}", path, e.getMessage());
            return LoadResult.failure(path.getFileName().toString(), e);
        }
    }

    /**
     * Parse, validate and register a template given as YAML text.
     *
     * @throws ConfigurationException if the template is malformed or invalid
     */
    public PipelineTemplate loadFromString(String yaml) {
        return register(yaml);
    }

    private PipelineTemplate register(String yaml) {
        PipelineTemplate template = yamlParser.parsePipeline(yaml);
        validator.validate(template);
        registry.register(template);
        log.info("Loaded pipeline: {} ({} steps)", template.name(), template.steps().size());
        return template;
    }

    private void logResults(List<LoadResult> results) {
        long successful = results.stream().filter(LoadResult::isSuccess).count();
        long failed = results.size() - successful;

        if (failed > 0) {
            log.warn("Loaded {} pipelines: {} successful, {} failed", results.size(), successful, failed);
            results.stream()
                    .filter(r -> !r.isSuccess())
                    .forEach(r -> log.error("  {}: {}", r.name(), r.error().orElse("unknown error")));
        } else {
            log.info("Loaded {} pipelines: all successful", results.size());
        }
    }
}
