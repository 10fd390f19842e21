package simplejson;

import org.jspecify.annotations.Nullable;

/**
 *
 *
 * @author Freeman
 * @since 0.1.0
 */
public record JsonNull() implements JsonValue {

    public static final JsonNull INSTANCE = new JsonNull();

    @Override
    public @Nullable Object toJava() {
        return null;
    }
}
