package simplejson;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.jspecify.annotations.Nullable;

/**
 * Domain types shared by the tests.
 */
final class Models {

    private Models() {}

    record Model(int id, String type) implements JsonDecodable, JsonEncodable {
        Model(JsonObject json) {
            this(Json.decode("id", json, int.class), Json.decode("type", json, String.class));
        }

        @Override
        public Object encodableValue() {
            var map = new LinkedHashMap<String, Object>();
            map.put("id", id);
            map.put("type", type);
            return map;
        }
    }

    record RootModel(boolean isRoot, Model model) implements JsonDecodable, JsonEncodable {
        RootModel(JsonObject json) {
            this(Json.decode("is_root", json, boolean.class), Json.decode("model", json, Model.class));
        }

        @Override
        public Object encodableValue() {
            var map = new LinkedHashMap<String, Object>();
            map.put("is_root", isRoot);
            map.put("model", model);
            return map;
        }
    }

    enum Status implements RawRepresentable<Integer> {
        UNKNOWN(0),
        IDLE(1),
        ACTIVE(2);

        private final int rawValue;

        Status(int rawValue) {
            this.rawValue = rawValue;
        }

        @Override
        public Integer rawValue() {
            return rawValue;
        }
    }

    enum Color {
        RED,
        GREEN
    }

    enum Flag implements RawRepresentable<Boolean> {
        ON(true),
        OFF(false);

        private final boolean rawValue;

        Flag(boolean rawValue) {
            this.rawValue = rawValue;
        }

        @Override
        public Boolean rawValue() {
            return rawValue;
        }
    }

    interface Coded extends RawRepresentable<Integer> {}

    enum Level implements Coded {
        LOW(1),
        HIGH(2);

        private final int code;

        Level(int code) {
            this.code = code;
        }

        @Override
        public Integer rawValue() {
            return code;
        }
    }

    interface Keyed<K> extends RawRepresentable<K> {}

    interface Labelled<L> extends Keyed<L> {}

    enum Shade implements Labelled<String> {
        DARK,
        LIGHT;

        @Override
        public String rawValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    // {"b": {"c": ...}} three levels deep: A -> B -> C
    record C(int c) implements JsonDecodable {
        C(JsonObject json) {
            this(Json.decode("c", json, int.class));
        }
    }

    record B(C b) implements JsonDecodable {
        B(JsonObject json) {
            this(Json.decode("b", json, C.class));
        }
    }

    record A(B a) implements JsonDecodable {
        A(JsonObject json) {
            this(Json.decode("a", json, B.class));
        }
    }

    @Value
    @AllArgsConstructor
    static class Catalog implements JsonDecodable, JsonEncodable {
        String name;
        List<Model> models;

        Catalog(JsonObject json) {
            this(Json.decode("name", json, String.class), Json.decodeArray("models", json, Model.class, true));
        }

        @Override
        public Object encodableValue() {
            return Map.of("name", name, "models", models);
        }
    }

    /**
     * Encodes as whatever it wraps.
     */
    @Value
    static class Wrapper implements JsonEncodable {
        @Nullable Object inner;

        @Override
        public @Nullable Object encodableValue() {
            return inner;
        }
    }

    static final class Unsupported {}

    static final class SelfReferencing implements JsonEncodable {
        @Override
        public Object encodableValue() {
            return this;
        }
    }

    static final class Failing implements JsonEncodable {
        @Override
        public Object encodableValue() {
            throw new IllegalStateException("boom");
        }
    }

    static final class NotConstructible implements JsonDecodable {
        NotConstructible(String ignored) {}
    }

    record Positive(int id) implements JsonDecodable {
        Positive {
            if (id <= 0) throw new IllegalArgumentException("id must be positive: " + id);
        }

        Positive(JsonObject json) {
            this(Json.decode("id", json, int.class));
        }
    }

    static final class Validated implements JsonDecodable {
        Validated(JsonObject json) {
            if (!json.has("ok")) throw new IllegalArgumentException("not ok");
        }
    }
}
