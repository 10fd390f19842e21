package simplejson;

/**
 * Marks a type that can construct itself from a {@link JsonObject}.
 *
 * <p> Implementations must declare a constructor taking a single {@link JsonObject}. The constructor reads its
 * properties with {@link Json#decode} and lets any {@link Json.DecodingException} propagate, so that enclosing
 * decode calls can prefix the failing parameter with their own key.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * record Model(int id, String type) implements JsonDecodable {
 *     Model(JsonObject json) {
 *         this(Json.decode("id", json, int.class), Json.decode("type", json, String.class));
 *     }
 * }
 *
 * Model model = Json.decode("my_model", root, Model.class);
 * }</pre>
 *
 * @author Freeman
 * @since 0.1.0
 */
public interface JsonDecodable {}
