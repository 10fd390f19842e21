package simplejson;

import java.util.Objects;

/**
 * A JSON number. The wrapped {@link Number} is kept as given; {@link Json#encode(Object)} never produces
 * a non-finite one.
 */
public record JsonNumber(Number value) implements JsonValue {

    public JsonNumber {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public Number toJava() {
        return value;
    }
}
