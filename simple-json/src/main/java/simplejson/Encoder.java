package simplejson;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

/**
 * Encode dispatch. Total: every input maps to a valid JSON tree, unsupported input maps to {@link JsonNull}.
 *
 * <p> One instance per top-level {@link Json#encode(Object)} call, it tracks the containers and encodables being
 * encoded so that reference cycles terminate.
 *
 * @author Freeman
 * @since 0.1.0
 */
@Slf4j
final class Encoder {

    private final Set<Object> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());

    JsonValue encode(@Nullable Object o) {
        // 1) null / absent
        if (o == null) return JsonNull.INSTANCE;
        if (o instanceof Optional<?> optional) return optional.isPresent() ? encode(optional.get()) : JsonNull.INSTANCE;
        if (o instanceof JsonValue jv) return normalize(jv);

        // 2) JSON scalars
        if (o instanceof String s) return new JsonString(s);
        if (o instanceof Boolean b) return JsonBoolean.of(b);
        if (o instanceof Number n) return encodeNumber(n);

        // 3) encodable values
        if (o instanceof JsonEncodable encodable) {
            return guarded(encodable, () -> encodeEncodable(encodable));
        }
        var transform = ScalarTransforms.forValue(o);
        if (transform != null) return encodeScalar(transform, o);
        if (o instanceof Enum<?> e) return new JsonString(e.name());

        // 4) string-keyed maps
        if (o instanceof Map<?, ?> map) {
            return guarded(map, () -> encodeMap(map));
        }

        // 5) sequences
        if (o instanceof Collection<?> coll) {
            return guarded(coll, () -> encodeCollection(coll));
        }
        if (o.getClass().isArray()) {
            return guarded(o, () -> encodeArray(o));
        }

        // 6) anything else cannot be represented
        return JsonNull.INSTANCE;
    }

    private JsonValue guarded(Object o, Supplier<JsonValue> encoding) {
        if (!inProgress.add(o)) return JsonNull.INSTANCE; // cycle
        try {
            return encoding.get();
        } finally {
            inProgress.remove(o);
        }
    }

    JsonValue normalize(JsonValue jv) {
        if (jv instanceof JsonNumber n) return encodeNumber(n.value());
        if (jv instanceof JsonArray a) {
            var values = new ArrayList<JsonValue>(a.size());
            for (var e : a.value()) {
                values.add(normalize(e));
            }
            return new JsonArray(values);
        }
        if (jv instanceof JsonObject obj) {
            var values = new LinkedHashMap<String, JsonValue>(obj.size());
            for (var en : obj.value().entrySet()) {
                values.put(en.getKey(), normalize(en.getValue()));
            }
            return new JsonObject(values);
        }
        return jv;
    }

    private JsonValue encodeEncodable(JsonEncodable encodable) {
        Object value;
        try {
            value = encodable.encodableValue();
        } catch (RuntimeException e) {
            log.warn("encodableValue() of {} failed, encoding null", encodable.getClass().getName(), e);
            return JsonNull.INSTANCE;
        }
        return encode(value);
    }

    static JsonValue encodeNumber(Number n) {
        if (n instanceof Integer || n instanceof Long || n instanceof BigInteger || n instanceof BigDecimal) {
            return new JsonNumber(n);
        }
        if (n instanceof Short || n instanceof Byte) return new JsonNumber(n.intValue());
        if (n instanceof Double || n instanceof Float) {
            // NaN and Infinity are not valid in JSON
            return Double.isFinite(n.doubleValue()) ? new JsonNumber(n) : JsonNull.INSTANCE;
        }
        // other Number implementations (AtomicLong, LongAdder...) go through their decimal form
        try {
            return new JsonNumber(new BigDecimal(n.toString()));
        } catch (NumberFormatException e) {
            return JsonNull.INSTANCE;
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static JsonValue encodeScalar(ScalarTransform transform, Object o) {
        try {
            return new JsonString(transform.format(o));
        } catch (RuntimeException e) {
            log.warn("Cannot format {} as {}, encoding null", o.getClass().getName(), transform.type().getName(), e);
            return JsonNull.INSTANCE;
        }
    }

    private JsonValue encodeMap(Map<?, ?> map) {
        var values = new LinkedHashMap<String, JsonValue>(map.size());
        for (var en : map.entrySet()) {
            if (!(en.getKey() instanceof String key)) return JsonNull.INSTANCE;
            values.put(key, encode(en.getValue()));
        }
        return new JsonObject(values);
    }

    private JsonValue encodeCollection(Collection<?> coll) {
        List<JsonValue> values = new ArrayList<>(coll.size());
        for (var e : coll) {
            values.add(encode(e));
        }
        return new JsonArray(values);
    }

    private JsonValue encodeArray(Object arr) {
        int len = Array.getLength(arr);
        List<JsonValue> values = new ArrayList<>(len);
        for (int i = 0; i < len; i++) {
            values.add(encode(Array.get(arr, i)));
        }
        return new JsonArray(values);
    }
}
