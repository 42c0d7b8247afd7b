package org.neuralchilli.marshal.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import org.neuralchilli.marshal.resilience.BreakerScope;

import java.time.Duration;
import java.util.Optional;

/**
 * Orchestrator settings under the {@code marshal.} prefix.
 */
@ConfigMapping(prefix = "marshal")
public interface MarshalConfig {

    Scheduler scheduler();

    State state();

    Breaker breaker();

    Resource resource();

    Ledger ledger();

    Pipelines pipelines();

    Engine engine();

    Worker worker();

    Archive archive();

    interface Scheduler {
        @WithName("max-parallelism")
        @WithDefault("4")
        int maxParallelism();
    }

    interface State {
        @WithDefault("marshal")
        String namespace();

        /**
         * How long a RUNNING step may go without a ledger event before recovery resets it
         */
        @WithName("staleness-threshold")
        @WithDefault("PT5M")
        Duration stalenessThreshold();
    }

    interface Breaker {
        @WithDefault("TEMPLATE")
        BreakerScope scope();
    }

    interface Resource {
        @WithName("capacity-tokens")
        @WithDefault("100000")
        long capacityTokens();

        @WithName("max-tokens-per-step")
        Optional<Long> maxTokensPerStep();

        @WithName("alert-threshold")
        @WithDefault("0.8")
        double alertThreshold();

        @WithName("throttle-ratio")
        @WithDefault("1.5")
        double throttleRatio();

        @WithName("behavior-window")
        @WithDefault("P30D")
        Duration behaviorWindow();

        @WithName("latency-target")
        @WithDefault("PT30S")
        Duration latencyTarget();
    }

    interface Ledger {
        @WithDefault("HAZELCAST")
        StoreType store();

        @WithDefault("data/ledger")
        String directory();

        @WithName("list-prefix")
        @WithDefault("marshal-ledger")
        String listPrefix();
    }

    enum StoreType {
        HAZELCAST,
        FILE
    }

    interface Pipelines {
        @WithDefault("config/pipelines")
        String path();
    }

    interface Engine {
        /**
         * Recorded on every run; replay across different versions needs an explicit override
         */
        @WithDefault("1.0.0")
        String version();
    }

    interface Worker {
        @WithDefault("marshal-worker")
        String id();

        @WithDefault("8")
        int threads();
    }

    interface Archive {
        @WithDefault("data/archive")
        String directory();
    }
}
