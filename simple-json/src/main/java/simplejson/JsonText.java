package simplejson;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.json.JsonMapper;

/**
 * JSON text handling, delegated to Jackson. Parsed text is read untyped ({@code Map}, {@code List}, scalars) and then
 * turned into a {@link JsonValue} tree by {@link Json#encode(Object)}; writing goes the other way through
 * {@link JsonValue#toJava()}.
 *
 * @author Freeman
 * @since 0.1.0
 */
final class JsonText {

    private static final JsonMapper mapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            // floats stay exact, 1e400 included
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .build();

    private JsonText() {
        throw new UnsupportedOperationException();
    }

    static JsonValue read(String json) {
        Object untyped;
        try {
            untyped = mapper.readValue(json, Object.class);
        } catch (JacksonException e) {
            throw new Json.SyntaxException(e.getOriginalMessage(), e);
        }
        return Json.encode(untyped);
    }

    static String write(JsonValue value) {
        try {
            return mapper.writeValueAsString(value.toJava());
        } catch (JacksonException e) {
            throw new Json.WriteException("Failed to write JSON text: " + e.getOriginalMessage(), e);
        }
    }
}
