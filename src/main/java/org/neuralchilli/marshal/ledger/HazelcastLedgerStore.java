package org.neuralchilli.marshal.ledger;

import com.hazelcast.collection.IList;
import com.hazelcast.collection.ISet;
import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import org.neuralchilli.marshal.domain.LedgerEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ledger kept in the embedded Hazelcast member: one {@link IList} per run,
 * plus an {@link IMap} of run heads.
 */
public class HazelcastLedgerStore implements LedgerStore {

    private final HazelcastInstance hazelcast;
    private final String prefix;
    private final ISet<String> runs;
    private final IMap<String, LedgerEvent> heads;

    public HazelcastLedgerStore(HazelcastInstance hazelcast, String prefix) {
        this.hazelcast = hazelcast;
        this.prefix = prefix;
        this.runs = hazelcast.getSet(prefix + "-runs");
        this.heads = hazelcast.getMap(prefix + "-heads");
    }

    /**
     * Name of the distributed list holding a run's events
     */
    public String listName(String runId) {
        return prefix + "-" + runId;
    }

    @Override
    public void append(LedgerEvent event) {
        runs.add(event.runId());
        events(event.runId()).add(event);
        heads.set(event.runId(), event);
    }

    @Override
    public List<LedgerEvent> read(String runId) {
        return new ArrayList<>(events(runId));
    }

    @Override
    public Optional<LedgerEvent> last(String runId) {
        return Optional.ofNullable(heads.get(runId));
    }

    @Override
    public Set<String> runIds() {
        return Set.copyOf(runs);
    }

    @Override
    public void deleteRun(String runId) {
        events(runId).destroy();
        heads.delete(runId);
        runs.remove(runId);
    }

    private IList<LedgerEvent> events(String runId) {
        return hazelcast.getList(listName(runId));
    }
}
