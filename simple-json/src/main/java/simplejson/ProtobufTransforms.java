package simplejson;

import static simplejson.Json.isClassPresent;

import com.google.protobuf.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Contributes a {@link ScalarTransform} for {@code google.protobuf.Timestamp}, using the same fixed date pattern as
 * {@link java.util.Date}. Contributes nothing when protobuf is not on the classpath.
 *
 * @author Freeman
 * @since 0.1.0
 */
public final class ProtobufTransforms implements ScalarTransform.Provider {

    private static final boolean PROTOBUF_PRESENT = isClassPresent("com.google.protobuf.Message");

    public ProtobufTransforms() {}

    @Override
    public List<ScalarTransform<?>> transforms() {
        if (!PROTOBUF_PRESENT) return List.of();
        return List.of(TimestampTransform.create());
    }

    // Only loaded when protobuf is present.
    static final class TimestampTransform {

        private TimestampTransform() {}

        static ScalarTransform<Timestamp> create() {
            return ScalarTransform.of(
                    Timestamp.class,
                    s -> toTimestamp(ScalarTransforms.parseInstant(s)),
                    ts -> ScalarTransforms.formatInstant(toInstant(ts)));
        }

        static Timestamp toTimestamp(Instant instant) {
            return Timestamp.newBuilder()
                    .setSeconds(instant.getEpochSecond())
                    .setNanos(instant.getNano())
                    .build();
        }

        static Instant toInstant(Timestamp timestamp) {
            return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
        }
    }
}
