package org.neuralchilli.marshal.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import org.neuralchilli.marshal.util.Hashing;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/**
 * Nullable field helpers shared by the stream serializers. Free-form maps are
 * written as canonical JSON so nested values survive the round trip.
 */
final class SerializerSupport {

    private SerializerSupport() {
    }

    static void writeStringOrNull(ObjectDataOutput out, String value) throws IOException {
        if (value == null) {
            out.writeBoolean(false);
        } else {
            out.writeBoolean(true);
            out.writeString(value);
        }
    }

    static String readStringOrNull(ObjectDataInput in) throws IOException {
        boolean hasValue = in.readBoolean();
        return hasValue ? in.readString() : null;
    }

    static void writeLongOrNull(ObjectDataOutput out, Long value) throws IOException {
        if (value == null) {
            out.writeBoolean(false);
        } else {
            out.writeBoolean(true);
            out.writeLong(value);
        }
    }

    static Long readLongOrNull(ObjectDataInput in) throws IOException {
        boolean hasValue = in.readBoolean();
        return hasValue ? in.readLong() : null;
    }

    static void writeInstantOrNull(ObjectDataOutput out, Instant value) throws IOException {
        if (value == null) {
            out.writeBoolean(false);
        } else {
            out.writeBoolean(true);
            out.writeLong(value.getEpochSecond());
            out.writeInt(value.getNano());
        }
    }

    static Instant readInstantOrNull(ObjectDataInput in) throws IOException {
        boolean hasValue = in.readBoolean();
        return hasValue ? Instant.ofEpochSecond(in.readLong(), in.readInt()) : null;
    }

    static <E extends Enum<E>> void writeEnumOrNull(ObjectDataOutput out, E value) throws IOException {
        writeStringOrNull(out, value != null ? value.name() : null);
    }

    static <E extends Enum<E>> E readEnumOrNull(ObjectDataInput in, Class<E> type) throws IOException {
        String name = readStringOrNull(in);
        return name != null ? Enum.valueOf(type, name) : null;
    }

    static void writeMap(ObjectDataOutput out, Map<String, Object> map) throws IOException {
        try {
            out.writeString(Hashing.canonicalJson(map != null ? map : Map.of()));
        } catch (IllegalArgumentException e) {
            throw new IOException("Cannot serialize map: " + e.getMessage(), e);
        }
    }

    static Map<String, Object> readMap(ObjectDataInput in) throws IOException {
        try {
            return Hashing.parseJsonObject(in.readString());
        } catch (IllegalArgumentException e) {
            throw new IOException("Cannot deserialize map: " + e.getMessage(), e);
        }
    }
}
