package simplejson;

import org.jspecify.annotations.Nullable;

/**
 * A node of a JSON document tree.
 *
 * <p> Trees are immutable once constructed. They are either built in code or produced by {@link Json#parse(String)},
 * and they are the sole input of {@link Json#decode} and the sole output of {@link Json#encode(Object)}.
 *
 * @author Freeman
 * @since 0.1.0
 */
public sealed interface JsonValue permits JsonArray, JsonBoolean, JsonNull, JsonNumber, JsonObject, JsonString {

    /**
     * Plain Java view of this node: {@link java.util.Map}, {@link java.util.List}, {@link String}, {@link Number},
     * {@link Boolean} or {@code null}.
     *
     * @return the plain Java value
     */
    @Nullable Object toJava();

    /**
     * Compact JSON text of this node.
     *
     * @return non-null JSON text
     */
    default String stringify() {
        return JsonText.write(this);
    }
}
