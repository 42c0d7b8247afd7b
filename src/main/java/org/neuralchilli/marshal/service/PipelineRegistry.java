package org.neuralchilli.marshal.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.marshal.domain.PipelineTemplate;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Validated pipeline templates by name.
 */
@ApplicationScoped
public class PipelineRegistry {

    private final Map<String, PipelineTemplate> templates = new ConcurrentHashMap<>();

    public void register(PipelineTemplate template) {
        templates.put(template.name(), template);
    }

    public Optional<PipelineTemplate> find(String name) {
        return Optional.ofNullable(templates.get(name));
    }

    public PipelineTemplate require(String name) {
        PipelineTemplate template = templates.get(name);
        if (template == null) {
            throw new ConfigurationException("Pipeline not found: " + name);
        }
        return template;
    }

    public Collection<PipelineTemplate> all() {
        return List.copyOf(templates.values());
    }

    public boolean remove(String name) {
        return templates.remove(name) != null;
    }
}
