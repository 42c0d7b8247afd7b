package org.neuralchilli.marshal.config;

import com.hazelcast.config.Config;
import com.hazelcast.config.SerializationConfig;
import com.hazelcast.config.SerializerConfig;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.marshal.domain.LedgerEvent;
import org.neuralchilli.marshal.domain.Run;
import org.neuralchilli.marshal.domain.StepState;
import org.neuralchilli.marshal.serializer.LedgerEventSerializer;
import org.neuralchilli.marshal.serializer.RunSerializer;
import org.neuralchilli.marshal.serializer.StepStateKeySerializer;
import org.neuralchilli.marshal.serializer.StepStateSerializer;
import org.neuralchilli.marshal.state.StepStateKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the embedded Hazelcast member that backs the state store and,
 * by default, the event ledger.
 */
@ApplicationScoped
public class HazelcastConfig {

    private static final Logger log = LoggerFactory.getLogger(HazelcastConfig.class);

    @ConfigProperty(name = "marshal.hazelcast.cluster-name", defaultValue = "marshal-dev")
    String clusterName;

    @Produces
    @Singleton
    @Startup
    public HazelcastInstance hazelcastInstance() {
        log.info("Initializing Hazelcast with cluster name: {}", clusterName);

        Config config = new Config();
        config.setClusterName(clusterName);

        // Embedded, single member
        config.getNetworkConfig().getJoin().getMulticastConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getTcpIpConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getAutoDetectionConfig().setEnabled(false);
        config.setProperty("hazelcast.phone.home.enabled", "false");

        registerSerializers(config.getSerializationConfig());

        HazelcastInstance instance = Hazelcast.newHazelcastInstance(config);
        log.info("Hazelcast instance created successfully");
        return instance;
    }

    void shutdown(@Disposes HazelcastInstance instance) {
        if (instance.getLifecycleService().isRunning()) {
            log.info("Shutting down Hazelcast instance");
            instance.getLifecycleService().shutdown();
        }
    }

    /**
     * Register the stream serializers for everything the orchestrator stores in Hazelcast.
     */
    public static void registerSerializers(SerializationConfig serializationConfig) {
        serializationConfig.setEnableCompression(false);
        serializationConfig.setEnableSharedObject(false);

        serializationConfig.addSerializerConfig(new SerializerConfig()
                .setTypeClass(Run.class)
                .setImplementation(new RunSerializer()));
        serializationConfig.addSerializerConfig(new SerializerConfig()
                .setTypeClass(StepState.class)
                .setImplementation(new StepStateSerializer()));
        serializationConfig.addSerializerConfig(new SerializerConfig()
                .setTypeClass(LedgerEvent.class)
                .setImplementation(new LedgerEventSerializer()));
        serializationConfig.addSerializerConfig(new SerializerConfig()
                .setTypeClass(StepStateKey.class)
                .setImplementation(new StepStateKeySerializer()));

        log.debug("Registered serializers: Run ({}), StepState ({}), LedgerEvent ({}), StepStateKey ({})",
                RunSerializer.TYPE_ID, StepStateSerializer.TYPE_ID,
                LedgerEventSerializer.TYPE_ID, StepStateKeySerializer.TYPE_ID);
    }
}
