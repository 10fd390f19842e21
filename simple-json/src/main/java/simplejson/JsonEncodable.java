package simplejson;

import org.jspecify.annotations.Nullable;

/**
 * A type that describes itself as a loosely-typed value for {@link Json#encode(Object)}.
 *
 * @author Freeman
 * @since 0.1.0
 */
public interface JsonEncodable {

    /**
     * Returns the value this object encodes as: {@code null}, a {@link String}, {@link Number} or {@link Boolean},
     * a {@code Map<String, ?>}, a collection or array, or another {@link JsonEncodable}. The result is normalized
     * recursively, anything unsupported becomes JSON null.
     *
     * @return the encodable representation
     */
    @Nullable Object encodableValue();
}
