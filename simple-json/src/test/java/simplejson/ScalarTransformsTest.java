package simplejson;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

import com.google.protobuf.Timestamp;
import java.net.URI;
import java.net.URL;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Map;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 *
 *
 * @author Freeman
 * @since 0.1.0
 */
class ScalarTransformsTest {

    @Nested
    class DateFormatTests {

        @Test
        void parseUtcSeconds() {
            assertThat(ScalarTransforms.parseInstant("2017-05-16T11:44:00Z"))
                    .isEqualTo(Instant.parse("2017-05-16T11:44:00Z"));
            assertThat(ScalarTransforms.parseInstant("1970-01-01T00:00:00Z")).isEqualTo(Instant.EPOCH);
        }

        @Test
        void formatTruncatesToSeconds() {
            assertThat(ScalarTransforms.formatInstant(Instant.parse("2017-05-16T11:44:00.999Z")))
                    .isEqualTo("2017-05-16T11:44:00Z");
        }

        @Test
        void rejectOtherLayouts() {
            // @spotless:off
            var table = new String[] {
                    "2017-05-16 11:44:00",
                    "2017-05-16T11:44:00",
                    "2017-05-16T11:44:00.000Z",
                    "2017-05-16T11:44:00+09:00",
                    "2017-05-16",
                    "2017-02-30T00:00:00Z",
                    "2017-05-16T24:00:00Z",
                    "16/05/2017",
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> assertThatThrownBy(
                            () -> ScalarTransforms.parseInstant(table[i]))
                    .as("input '%s'", table[i])
                    .isInstanceOf(DateTimeParseException.class)));
        }
    }

    @Nested
    class RoundTripTests {

        @Test
        void datesSurviveEncodeThenDecode() {
            // @spotless:off
            var table = new Instant[] {
                    Instant.EPOCH,
                    Instant.parse("2017-05-16T11:44:00Z"),
                    Instant.parse("1969-07-20T20:17:40Z"),
                    Instant.parse("1900-02-28T23:59:59Z"),
                    Instant.parse("2000-02-29T00:00:01Z"),
                    Instant.parse("9999-12-31T23:59:59Z"),
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var instant = table[i];
                var date = Date.from(instant);
                var json = new JsonObject(Map.of("d", Json.encode(date), "i", Json.encode(instant)));

                assertThat(Json.decode("d", json, Date.class)).as("date %s", instant).isEqualTo(date);
                assertThat(Json.decode("i", json, Instant.class)).as("instant %s", instant).isEqualTo(instant);
            }));
        }

        @Test
        void subSecondPrecisionIsDropped() {
            var instant = Instant.parse("2017-05-16T11:44:00.750Z");
            var json = new JsonObject(Map.of("d", Json.encode(Date.from(instant))));

            assertThat(Json.decode("d", json, Date.class)).isEqualTo(Date.from(instant.truncatedTo(ChronoUnit.SECONDS)));
        }
    }

    @Nested
    class RegistryTests {

        @Test
        void builtinsComeFirst() {
            assertThat(ScalarTransforms.all().subList(0, 4))
                    .extracting(t -> (Object) t.type())
                    .containsExactly(Instant.class, Date.class, URI.class, URL.class);
        }

        @Test
        void providersAreLoaded() {
            assertThat(ScalarTransforms.all())
                    .extracting(t -> (Object) t.type())
                    .contains(UUID.class, Timestamp.class);
        }

        @Test
        void lookupByExactType() {
            assertThat(ScalarTransforms.forType(Date.class)).isNotNull();
            assertThat(ScalarTransforms.forType(java.sql.Date.class)).isNull();
            assertThat(ScalarTransforms.forType(String.class)).isNull();
        }

        @Test
        void lookupByValueAcceptsSubclasses() {
            var transform = ScalarTransforms.forValue(new java.sql.Timestamp(0));

            assertThat(transform).isNotNull();
            assertThat(transform.type()).isEqualTo(Date.class);
        }

        @Test
        void registryIsReadOnly() {
            var uuid = ScalarTransform.of(UUID.class, UUID::fromString, UUID::toString);

            assertThatThrownBy(() -> ScalarTransforms.all().add(uuid))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Test
    void parsedValueMustNotBeNull() {
        var transform = ScalarTransform.of(String.class, s -> null, s -> s);

        assertThatThrownBy(() -> transform.parse("x")).isInstanceOf(NullPointerException.class);
    }

    @Test
    void malformedUrlIsRejected() {
        assertThatThrownBy(() -> ScalarTransforms.parseUrl("not a url"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a url");
    }
}
