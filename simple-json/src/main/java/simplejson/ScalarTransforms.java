package simplejson;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

/**
 * Process-wide registry of {@link ScalarTransform}s: the built-in date and URL transforms followed by the ones
 * contributed through {@link ScalarTransform.Provider}. Built once, read-only afterwards.
 *
 * @author Freeman
 * @since 0.1.0
 */
@Slf4j
final class ScalarTransforms {

    static final String DATE_PATTERN = "uuuu-MM-dd'T'HH:mm:ss'Z'";

    /**
     * {@code yyyy-MM-ddTHH:mm:ssZ} in UTC, independent of the default locale.
     */
    static final DateTimeFormatter ISO8601_UTC = DateTimeFormatter.ofPattern(DATE_PATTERN, Locale.ROOT)
            .withZone(ZoneOffset.UTC)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final List<ScalarTransform<?>> transforms = loadTransforms();

    private ScalarTransforms() {
        throw new UnsupportedOperationException();
    }

    static List<ScalarTransform<?>> all() {
        return transforms;
    }

    /**
     * @param raw decode target class
     * @return the transform registered for exactly {@code raw}, or {@code null}
     */
    static @Nullable ScalarTransform<?> forType(Class<?> raw) {
        for (var t : transforms) {
            if (t.type() == raw) return t;
        }
        return null;
    }

    /**
     * @param value value being encoded
     * @return the first transform whose type accepts {@code value}, or {@code null}
     */
    static @Nullable ScalarTransform<?> forValue(Object value) {
        for (var t : transforms) {
            if (t.type().isInstance(value)) return t;
        }
        return null;
    }

    static Instant parseInstant(String text) {
        return ISO8601_UTC.parse(text, Instant::from);
    }

    static String formatInstant(Instant instant) {
        return ISO8601_UTC.format(instant);
    }

    static List<ScalarTransform<?>> builtins() {
        return List.of(
                ScalarTransform.of(Instant.class, ScalarTransforms::parseInstant, ScalarTransforms::formatInstant),
                ScalarTransform.of(
                        Date.class, s -> Date.from(parseInstant(s)), d -> formatInstant(Instant.ofEpochMilli(d.getTime()))),
                ScalarTransform.of(URI.class, URI::create, u -> u.normalize().toString()),
                ScalarTransform.of(URL.class, ScalarTransforms::parseUrl, URL::toExternalForm));
    }

    static URL parseUrl(String text) {
        try {
            return new URI(text).toURL();
        } catch (URISyntaxException | MalformedURLException e) {
            throw new IllegalArgumentException("Malformed URL: '" + text + "'", e);
        }
    }

    static List<ScalarTransform<?>> loadTransforms() {
        var list = new ArrayList<>(builtins());
        for (var provider : ServiceLoader.load(ScalarTransform.Provider.class)) {
            var contributed = provider.transforms();
            log.debug("Provider {} contributed {} scalar transform(s)", provider.getClass().getName(), contributed.size());
            list.addAll(contributed);
        }
        return Collections.unmodifiableList(list);
    }
}
