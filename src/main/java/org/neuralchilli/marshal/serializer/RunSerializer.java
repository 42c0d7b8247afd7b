package org.neuralchilli.marshal.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.marshal.domain.Run;
import org.neuralchilli.marshal.domain.RunStatus;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

import static org.neuralchilli.marshal.serializer.SerializerSupport.*;

/**
 * Compact binary form of {@link Run} for the runs map.
 */
public class RunSerializer implements StreamSerializer<Run> {

    public static final int TYPE_ID = 1001;

    @Override
    public int getTypeId() {
        return TYPE_ID;
    }

    @Override
    public void write(ObjectDataOutput out, Run run) throws IOException {
        out.writeString(run.runId());
        out.writeString(run.templateName());
        writeLongOrNull(out, run.seed());
        writeMap(out, run.params());

        out.writeString(run.status().name());
        writeInstantOrNull(out, run.createdAt());
        writeInstantOrNull(out, run.completedAt());
        out.writeBoolean(run.degraded());

        writeStringOrNull(out, run.replayOf());
        writeStringOrNull(out, run.engineVersion());
        out.writeBoolean(run.dryRun());
        writeLongOrNull(out, run.maxTokensPerStep());
        writeStringOrNull(out, run.error());
    }

    @Override
    public Run read(ObjectDataInput in) throws IOException {
        String runId = in.readString();
        String templateName = in.readString();
        Long seed = readLongOrNull(in);
        Map<String, Object> params = readMap(in);

        RunStatus status = RunStatus.valueOf(in.readString());
        Instant createdAt = readInstantOrNull(in);
        Instant completedAt = readInstantOrNull(in);
        boolean degraded = in.readBoolean();

        String replayOf = readStringOrNull(in);
        String engineVersion = readStringOrNull(in);
        boolean dryRun = in.readBoolean();
        Long maxTokensPerStep = readLongOrNull(in);
        String error = readStringOrNull(in);

        return new Run(runId, templateName, seed, params, status, createdAt, completedAt, degraded,
                replayOf, engineVersion, dryRun, maxTokensPerStep, error);
    }
}
