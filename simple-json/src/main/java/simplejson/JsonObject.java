package simplejson;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 *
 *
 * @author Freeman
 * @since 0.1.0
 */
public record JsonObject(Map<String, JsonValue> value) implements JsonValue {

    public JsonObject {
        var copy = new LinkedHashMap<String, JsonValue>(value.size());
        for (var en : value.entrySet()) {
            copy.put(Objects.requireNonNull(en.getKey(), "key"), Objects.requireNonNull(en.getValue(), "value"));
        }
        value = Collections.unmodifiableMap(copy);
    }

    public static JsonObject empty() {
        return new JsonObject(Map.of());
    }

    /**
     * @param key property name
     * @return the value mapped to {@code key}, or {@code null} if the key is absent
     */
    public @Nullable JsonValue get(String key) {
        return value.get(key);
    }

    public boolean has(String key) {
        return value.containsKey(key);
    }

    public int size() {
        return value.size();
    }

    @Override
    public Map<String, @Nullable Object> toJava() {
        var map = new LinkedHashMap<String, @Nullable Object>(value.size());
        for (var en : value.entrySet()) {
            map.put(en.getKey(), en.getValue().toJava());
        }
        return map;
    }
}
