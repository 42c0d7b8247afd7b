package org.neuralchilli.marshal.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.marshal.domain.EventType;
import org.neuralchilli.marshal.domain.LedgerEvent;

import java.io.IOException;
import java.time.Instant;

import static org.neuralchilli.marshal.serializer.SerializerSupport.readStringOrNull;
import static org.neuralchilli.marshal.serializer.SerializerSupport.writeStringOrNull;

/**
 * Serializer for {@link LedgerEvent}. The payload is stored as the exact
 * canonical text it was hashed over.
 */
public class LedgerEventSerializer implements StreamSerializer<LedgerEvent> {

    public static final int TYPE_ID = 1003;

    @Override
    public int getTypeId() {
        return TYPE_ID;
    }

    @Override
    public void write(ObjectDataOutput out, LedgerEvent event) throws IOException {
        out.writeString(event.runId());
        out.writeLong(event.eventId());
        out.writeString(event.eventType().name());
        out.writeLong(event.timestamp().toEpochMilli());
        writeStringOrNull(out, event.stepName());
        out.writeString(event.payload());
        writeStringOrNull(out, event.dataHash());
    }

    @Override
    public LedgerEvent read(ObjectDataInput in) throws IOException {
        String runId = in.readString();
        long eventId = in.readLong();
        EventType type = EventType.valueOf(in.readString());
        Instant timestamp = Instant.ofEpochMilli(in.readLong());
        String stepName = readStringOrNull(in);
        String payload = in.readString();
        String dataHash = readStringOrNull(in);

        return new LedgerEvent(runId, eventId, type, timestamp, stepName, payload, dataHash);
    }
}
