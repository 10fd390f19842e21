package simplejson;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Converts between a JSON string and a scalar Java type that has no JSON counterpart, such as dates and URLs.
 *
 * <p> Decoding a registered type reads the property as a string and calls {@link #parse(String)}; encoding a value
 * of the type emits {@link #format(Object)} as a JSON string. Additional transforms are registered through
 * {@link Provider} with {@link java.util.ServiceLoader}.
 *
 * @param <T> the Java type handled by this transform
 * @author Freeman
 * @since 0.1.0
 */
public interface ScalarTransform<T> {

    /**
     * @return the exact class this transform decodes to
     */
    Class<T> type();

    /**
     * Parse a JSON string into the target type.
     *
     * @param text string value of the property
     * @return parsed value, never {@code null}
     * @throws RuntimeException if {@code text} is not a valid representation, reported as an invalid parameter
     */
    T parse(String text);

    /**
     * @param value value to format, never {@code null}
     * @return the string form that {@link #parse(String)} accepts
     */
    String format(T value);

    static <T> ScalarTransform<T> of(Class<T> type, Function<String, T> parser, Function<T, String> formatter) {
        return new Simple<>(type, parser, formatter);
    }

    /**
     * Service provider interface for contributing transforms, registered in
     * {@code META-INF/services/simplejson.ScalarTransform$Provider}.
     */
    interface Provider {
        List<ScalarTransform<?>> transforms();
    }

    record Simple<T>(Class<T> type, Function<String, T> parser, Function<T, String> formatter)
            implements ScalarTransform<T> {

        public Simple {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(parser, "parser");
            Objects.requireNonNull(formatter, "formatter");
        }

        @Override
        public T parse(String text) {
            return Objects.requireNonNull(parser.apply(text), "parsed value");
        }

        @Override
        public String format(T value) {
            return formatter.apply(value);
        }
    }
}
