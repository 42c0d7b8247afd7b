package org.neuralchilli.marshal.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.marshal.state.StepStateKey;

import java.io.IOException;

public class StepStateKeySerializer implements StreamSerializer<StepStateKey> {

    public static final int TYPE_ID = 1004;

    @Override
    public int getTypeId() {
        return TYPE_ID;
    }

    @Override
    public void write(ObjectDataOutput out, StepStateKey key) throws IOException {
        out.writeString(key.runId());
        out.writeString(key.stepName());
    }

    @Override
    public StepStateKey read(ObjectDataInput in) throws IOException {
        return new StepStateKey(in.readString(), in.readString());
    }
}
