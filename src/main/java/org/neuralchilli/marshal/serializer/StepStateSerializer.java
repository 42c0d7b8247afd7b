package org.neuralchilli.marshal.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.marshal.domain.ErrorCategory;
import org.neuralchilli.marshal.domain.StepState;
import org.neuralchilli.marshal.domain.StepStatus;

import java.io.IOException;

import static org.neuralchilli.marshal.serializer.SerializerSupport.*;

/**
 * Serializer for {@link StepState}. Written on every transition, so it is the
 * hottest path into Hazelcast.
 */
public class StepStateSerializer implements StreamSerializer<StepState> {

    public static final int TYPE_ID = 1002;

    @Override
    public int getTypeId() {
        return TYPE_ID;
    }

    @Override
    public void write(ObjectDataOutput out, StepState state) throws IOException {
        out.writeString(state.runId());
        out.writeString(state.stepName());
        out.writeString(state.idempotencyKey());
        out.writeString(state.status().name());
        out.writeInt(state.attemptCount());

        writeInstantOrNull(out, state.startTime());
        writeInstantOrNull(out, state.endTime());
        writeStringOrNull(out, state.lastError());
        writeEnumOrNull(out, state.errorCategory());

        out.writeLong(state.grantedTokens());
        out.writeLong(state.consumedTokens());
        out.writeBoolean(state.throttled());

        writeMap(out, state.outputRefs());
        writeStringOrNull(out, state.outputHash());
        writeInstantOrNull(out, state.updatedAt());
    }

    @Override
    public StepState read(ObjectDataInput in) throws IOException {
        return new StepState(
                in.readString(),
                in.readString(),
                in.readString(),
                StepStatus.valueOf(in.readString()),
                in.readInt(),
                readInstantOrNull(in),
                readInstantOrNull(in),
                readStringOrNull(in),
                readEnumOrNull(in, ErrorCategory.class),
                in.readLong(),
                in.readLong(),
                in.readBoolean(),
                readMap(in),
                readStringOrNull(in),
                readInstantOrNull(in)
        );
    }
}
