package org.neuralchilli.marshal.config;

import com.hazelcast.core.HazelcastInstance;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.neuralchilli.marshal.core.DagService;
import org.neuralchilli.marshal.core.ExpressionEvaluator;
import org.neuralchilli.marshal.core.PipelineScheduler;
import org.neuralchilli.marshal.ledger.EventLedger;
import org.neuralchilli.marshal.ledger.FileLedgerStore;
import org.neuralchilli.marshal.ledger.HazelcastLedgerStore;
import org.neuralchilli.marshal.ledger.LedgerStore;
import org.neuralchilli.marshal.replay.ReplayEngine;
import org.neuralchilli.marshal.resilience.CircuitBreakerRegistry;
import org.neuralchilli.marshal.resource.ResourceMonitor;
import org.neuralchilli.marshal.resource.ResourceSettings;
import org.neuralchilli.marshal.service.PipelineRegistry;
import org.neuralchilli.marshal.service.RunArchiver;
import org.neuralchilli.marshal.state.StateManager;
import org.neuralchilli.marshal.step.StepHandler;
import org.neuralchilli.marshal.step.StepHandlerRegistry;
import org.neuralchilli.marshal.worker.StepExecutor;
import org.neuralchilli.marshal.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Builds the stateful orchestration components from {@link MarshalConfig}.
 * The components themselves are plain classes so tests can build them by hand.
 */
@ApplicationScoped
public class OrchestratorProducers {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorProducers.class);

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    LedgerStore ledgerStore(MarshalConfig config, HazelcastInstance hazelcast) {
        MarshalConfig.Ledger ledger = config.ledger();
        if (ledger.store() == MarshalConfig.StoreType.FILE) {
            log.info("Event ledger stored in files under {}", ledger.directory());
            return new FileLedgerStore(Path.of(ledger.directory()));
        }
        log.info("Event ledger stored in Hazelcast lists with prefix '{}'", ledger.listPrefix());
        return new HazelcastLedgerStore(hazelcast, ledger.listPrefix());
    }

    @Produces
    @Singleton
    EventLedger eventLedger(LedgerStore store, Clock clock) {
        return new EventLedger(store, clock);
    }

    @Produces
    @Singleton
    StateManager stateManager(HazelcastInstance hazelcast, EventLedger ledger, MarshalConfig config, Clock clock) {
        return new StateManager(hazelcast, ledger, config.state().namespace(),
                config.state().stalenessThreshold(), clock);
    }

    @Produces
    @Singleton
    CircuitBreakerRegistry circuitBreakerRegistry(MarshalConfig config, Clock clock) {
        return new CircuitBreakerRegistry(config.breaker().scope(), clock);
    }

    @Produces
    @Singleton
    ResourceMonitor resourceMonitor(MarshalConfig config, Clock clock) {
        MarshalConfig.Resource resource = config.resource();
        ResourceSettings settings = new ResourceSettings(
                resource.capacityTokens(),
                resource.alertThreshold(),
                resource.throttleRatio(),
                resource.behaviorWindow(),
                resource.latencyTarget(),
                resource.maxTokensPerStep().orElse(null));
        return new ResourceMonitor(settings, clock);
    }

    @Produces
    @Singleton
    StepHandlerRegistry stepHandlerRegistry(@Any Instance<StepHandler> handlers) {
        StepHandlerRegistry registry = new StepHandlerRegistry(handlers);
        log.info("Step handlers available: {}", registry.names());
        return registry;
    }

    @Produces
    @Singleton
    WorkerPool workerPool(MarshalConfig config) {
        return new WorkerPool(config.worker().id(), config.worker().threads());
    }

    void shutdownWorkerPool(@Disposes WorkerPool pool) {
        pool.shutdown();
    }

    @Produces
    @Singleton
    StepExecutor stepExecutor(
            StepHandlerRegistry handlers,
            CircuitBreakerRegistry breakers,
            ResourceMonitor resources,
            EventLedger ledger,
            WorkerPool pool,
            Clock clock
    ) {
        return new StepExecutor(handlers, breakers, resources, ledger, pool, clock);
    }

    @Produces
    @Singleton
    PipelineScheduler pipelineScheduler(
            DagService dagService,
            ExpressionEvaluator expressions,
            StepExecutor executor,
            ResourceMonitor resources,
            CircuitBreakerRegistry breakers,
            EventLedger ledger,
            StateManager states,
            PipelineRegistry pipelines,
            WorkerPool pool,
            MarshalConfig config
    ) {
        return new PipelineScheduler(dagService, expressions, executor, resources, breakers, ledger,
                states, pipelines, pool, config.scheduler().maxParallelism());
    }

    @Produces
    @Singleton
    ReplayEngine replayEngine(
            PipelineScheduler scheduler,
            StateManager states,
            EventLedger ledger,
            PipelineRegistry pipelines,
            DagService dagService,
            MarshalConfig config,
            Clock clock
    ) {
        return new ReplayEngine(scheduler, states, ledger, pipelines, dagService,
                config.engine().version(), clock);
    }

    @Produces
    @Singleton
    RunArchiver runArchiver(StateManager states, EventLedger ledger) {
        return new RunArchiver(states, ledger);
    }
}
