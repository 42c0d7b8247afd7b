package org.neuralchilli.marshal.step;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Step handlers by name.
 */
public class StepHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepHandlerRegistry.class);

    private final Map<String, StepHandler> handlers = new ConcurrentHashMap<>();

    public StepHandlerRegistry() {
    }

    public StepHandlerRegistry(Iterable<? extends StepHandler> handlers) {
        handlers.forEach(this::register);
    }

    public void register(StepHandler handler) {
        StepHandler previous = handlers.put(handler.name(), handler);
        if (previous != null && previous != handler) {
            log.warn("Step handler '{}' replaced: {} -> {}", handler.name(),
                    previous.getClass().getSimpleName(), handler.getClass().getSimpleName());
        } else {
            log.debug("Registered step handler '{}' ({})", handler.name(), handler.getClass().getSimpleName());
        }
    }

    public Optional<StepHandler> find(String name) {
        return Optional.ofNullable(handlers.get(name));
    }

    public boolean contains(String name) {
        return handlers.containsKey(name);
    }

    public Set<String> names() {
        return new TreeSet<>(handlers.keySet());
    }

    public Collection<StepHandler> all() {
        return handlers.values();
    }
}
