package simplejson;

import static simplejson.Json.canonicalize;
import static simplejson.Json.raw;
import static simplejson.Json.typeArgument;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;
import simplejson.Json.ConversionException;
import simplejson.Json.DecodingException;

/**
 * Decode dispatch: resolves a property to the requested type, strictly, in this order:
 * structural match, raw-representable enum, {@link JsonDecodable}, {@link ScalarTransform}.
 *
 * @author Freeman
 * @since 0.1.0
 */
@Slf4j
final class Decoder {

    /**
     * Result of a structural match that failed. Distinct from {@code null}, which is a valid match for JSON null.
     */
    private static final Object NO_MATCH = new Object();

    private static final Type JSON_OBJECT_LIST = new Json.Type<List<JsonObject>>() {}.getType();

    private Decoder() {
        throw new UnsupportedOperationException();
    }

    @SuppressWarnings("unchecked")
    static <T> T decode(String key, JsonObject object, Type targetType) {
        var value = object.get(key);
        if (value == null) throw DecodingException.missing(key);
        return (T) decodeValue(key, value, canonicalize(targetType));
    }

    static <T extends JsonDecodable> List<T> decodeArray(
            String key, JsonObject object, Class<T> type, boolean strict) {
        List<JsonObject> array = decode(key, object, JSON_OBJECT_LIST);
        var constructor = decodableConstructor(type);

        var decoded = new ArrayList<T>(array.size());
        for (int i = 0; i < array.size(); i++) {
            try {
                decoded.add(construct(constructor, array.get(i)));
            } catch (DecodingException e) {
                if (strict) throw e.nestedIn(key, i);
                log.debug("Dropping element {}[{}] of {}: {}", key, i, type.getName(), e.getMessage());
            } catch (RuntimeException e) {
                if (strict) throw e;
                log.debug("Dropping element {}[{}] of {}: {}", key, i, type.getName(), e.toString());
            }
        }
        return Collections.unmodifiableList(decoded);
    }

    static @Nullable Object decodeValue(String key, JsonValue value, Type targetType) {
        Class<?> raw = raw(targetType);

        // 1) Value already has the requested shape
        if (isStructural(targetType)) {
            var matched = match(value, targetType);
            if (matched == NO_MATCH) throw DecodingException.invalid(key);
            return matched;
        }

        // 2) Raw-representable enum
        if (raw.isEnum()) {
            return decodeEnum(key, value, raw);
        }

        // 3) Nested decodable object
        if (JsonDecodable.class.isAssignableFrom(raw)) {
            if (!(value instanceof JsonObject jo)) throw DecodingException.invalid(key);
            try {
                return construct(decodableConstructor(raw), jo);
            } catch (DecodingException e) {
                throw e.nestedIn(key);
            }
        }

        // 4) Custom scalar transform
        var transform = ScalarTransforms.forType(raw);
        if (transform != null) {
            if (!(value instanceof JsonString s)) throw DecodingException.invalid(key);
            try {
                return transform.parse(s.value());
            } catch (RuntimeException e) {
                throw DecodingException.invalid(key, e);
            }
        }

        throw new ConversionException("Unsupported decode target type: " + targetType.getTypeName());
    }

    // ============================================================
    // Structural match
    // ============================================================

    /**
     * Whether {@code t} is a JSON-shaped type: a scalar, {@code Object}, a {@link JsonValue} type, or a list or
     * string-keyed map whose element types are JSON-shaped too.
     */
    static boolean isStructural(Type t) {
        t = canonicalize(t);
        Class<?> raw = raw(t);
        if (raw == Object.class || JsonValue.class.isAssignableFrom(raw)) return true;
        if (raw == String.class || raw == CharSequence.class) return true;
        if (raw == Boolean.class || raw == boolean.class) return true;
        if (isNumeric(raw)) return true;
        if (isListType(raw)) return isStructural(typeArgument(t, 0));
        if (isMapType(raw)) {
            var keyType = typeArgument(t, 0);
            return (keyType == String.class || keyType == Object.class) && isStructural(typeArgument(t, 1));
        }
        return false;
    }

    /**
     * @return the matched value, or {@link #NO_MATCH}
     */
    static @Nullable Object match(JsonValue value, Type t) {
        t = canonicalize(t);
        Class<?> raw = raw(t);

        if (raw == Object.class) return unmodifiableJava(value);
        if (JsonValue.class.isAssignableFrom(raw)) return raw.isInstance(value) ? value : NO_MATCH;

        if (raw == String.class || raw == CharSequence.class) {
            return value instanceof JsonString s ? s.value() : NO_MATCH;
        }
        if (raw == Boolean.class || raw == boolean.class) {
            return value instanceof JsonBoolean b ? b.value() : NO_MATCH;
        }
        if (isNumeric(raw)) {
            return value instanceof JsonNumber n ? matchNumber(n.value(), raw) : NO_MATCH;
        }
        if (isListType(raw)) {
            if (!(value instanceof JsonArray ja)) return NO_MATCH;
            var elementType = typeArgument(t, 0);
            var list = new ArrayList<@Nullable Object>(ja.size());
            for (var e : ja.value()) {
                var m = match(e, elementType);
                if (m == NO_MATCH) return NO_MATCH;
                list.add(m);
            }
            return Collections.unmodifiableList(list);
        }
        if (isMapType(raw)) {
            if (!(value instanceof JsonObject jo)) return NO_MATCH;
            var valueType = typeArgument(t, 1);
            var map = new LinkedHashMap<String, @Nullable Object>(jo.size());
            for (var en : jo.value().entrySet()) {
                var m = match(en.getValue(), valueType);
                if (m == NO_MATCH) return NO_MATCH;
                map.put(en.getKey(), m);
            }
            return Collections.unmodifiableMap(map);
        }
        return NO_MATCH;
    }

    /**
     * Like {@link JsonValue#toJava()}, with unmodifiable maps and lists at every level.
     */
    static @Nullable Object unmodifiableJava(JsonValue value) {
        if (value instanceof JsonObject jo) {
            var map = new LinkedHashMap<String, @Nullable Object>(jo.size());
            for (var en : jo.value().entrySet()) {
                map.put(en.getKey(), unmodifiableJava(en.getValue()));
            }
            return Collections.unmodifiableMap(map);
        }
        if (value instanceof JsonArray ja) {
            var list = new ArrayList<@Nullable Object>(ja.size());
            for (var e : ja.value()) {
                list.add(unmodifiableJava(e));
            }
            return Collections.unmodifiableList(list);
        }
        return value.toJava();
    }

    static boolean isNumeric(Class<?> raw) {
        return Number.class.isAssignableFrom(raw) && isKnownNumber(raw)
                || raw.isPrimitive() && raw != boolean.class && raw != char.class && raw != void.class;
    }

    private static boolean isKnownNumber(Class<?> raw) {
        return raw == Number.class
                || raw == Integer.class
                || raw == Long.class
                || raw == Short.class
                || raw == Byte.class
                || raw == Double.class
                || raw == Float.class
                || raw == BigInteger.class
                || raw == BigDecimal.class;
    }

    // List, Collection and Iterable are all satisfied by an ArrayList
    static boolean isListType(Class<?> raw) {
        return raw.isInterface() && raw.isAssignableFrom(ArrayList.class) && Iterable.class.isAssignableFrom(raw);
    }

    static boolean isMapType(Class<?> raw) {
        return raw == Map.class;
    }

    /**
     * Integral targets only accept numbers they can hold exactly.
     */
    static Object matchNumber(Number number, Class<?> raw) {
        if (raw == Number.class) return number;
        BigDecimal bd = toBigDecimal(number);
        if (bd == null) return NO_MATCH;
        try {
            if (raw == double.class || raw == Double.class) {
                double d = bd.doubleValue();
                return Double.isFinite(d) ? d : NO_MATCH;
            }
            if (raw == float.class || raw == Float.class) {
                float f = bd.floatValue();
                return Float.isFinite(f) ? f : NO_MATCH;
            }
            if (raw == BigDecimal.class) return bd;
            if (raw == BigInteger.class) return bd.toBigIntegerExact();
            if (raw == long.class || raw == Long.class) return bd.longValueExact();
            if (raw == int.class || raw == Integer.class) return bd.intValueExact();
            if (raw == short.class || raw == Short.class) return bd.shortValueExact();
            if (raw == byte.class || raw == Byte.class) return bd.byteValueExact();
        } catch (ArithmeticException e) {
            return NO_MATCH;
        }
        return NO_MATCH;
    }

    private static @Nullable BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal bd) return bd;
        if (number instanceof BigInteger bi) return new BigDecimal(bi);
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        try {
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // ============================================================
    // Raw-representable
    // ============================================================

    static Object decodeEnum(String key, JsonValue value, Class<?> raw) {
        var rawValueType = rawValueType(raw);
        var rawValue = match(value, rawValueType);
        if (rawValue == NO_MATCH || rawValue == null) throw DecodingException.invalid(key);

        for (Object constant : raw.getEnumConstants()) {
            var candidate = constant instanceof RawRepresentable<?> r ? r.rawValue() : ((Enum<?>) constant).name();
            if (rawValue.equals(candidate)) return constant;
        }
        throw DecodingException.invalid(key);
    }

    /**
     * @return {@code R} of {@code RawRepresentable<R>} implemented by {@code enumClass}, directly or through a
     * sub-interface, or {@code String} for plain enums, whose raw value is their name
     */
    static Type rawValueType(Class<?> enumClass) {
        if (!RawRepresentable.class.isAssignableFrom(enumClass)) return String.class;
        var found = findRawValueType(enumClass, Map.of());
        if (found == null)
            throw new ConversionException(
                    enumClass.getName() + " must implement RawRepresentable with a concrete raw value type");
        var r = canonicalize(found);
        if (!isStructural(r) || raw(r) == Object.class)
            throw new ConversionException(
                    "Unsupported raw value type " + r.getTypeName() + " of " + enumClass.getName());
        return r;
    }

    /**
     * Walks the generic interfaces of {@code type}, carrying the type arguments bound so far, up to
     * {@code RawRepresentable<R>}.
     */
    private static @Nullable Type findRawValueType(Class<?> type, Map<TypeVariable<?>, Type> bindings) {
        for (var itf : type.getGenericInterfaces()) {
            Class<?> raw = raw(itf);
            if (!RawRepresentable.class.isAssignableFrom(raw)) continue;
            if (itf instanceof ParameterizedType p) {
                var args = p.getActualTypeArguments();
                if (raw == RawRepresentable.class) return bound(args[0], bindings);
                var params = raw.getTypeParameters();
                var next = new HashMap<TypeVariable<?>, Type>(params.length);
                for (int i = 0; i < params.length; i++) {
                    next.put(params[i], bound(args[i], bindings));
                }
                var found = findRawValueType(raw, next);
                if (found != null) return found;
            } else if (raw != RawRepresentable.class) {
                var found = findRawValueType(raw, Map.of());
                if (found != null) return found;
            }
        }
        return null;
    }

    private static Type bound(Type t, Map<TypeVariable<?>, Type> bindings) {
        if (t instanceof TypeVariable<?> tv && bindings.containsKey(tv)) return bindings.get(tv);
        return t;
    }

    // ============================================================
    // Decodable
    // ============================================================

    static <T> Constructor<T> decodableConstructor(Class<T> raw) {
        if (raw.isInterface() || Modifier.isAbstract(raw.getModifiers()))
            throw new ConversionException("Cannot instantiate abstract JsonDecodable type " + raw.getName());
        try {
            var ctor = raw.getDeclaredConstructor(JsonObject.class);
            ctor.setAccessible(true);
            return ctor;
        } catch (NoSuchMethodException e) {
            throw new ConversionException(
                    raw.getName() + " implements JsonDecodable but declares no constructor taking a JsonObject", e);
        } catch (RuntimeException e) {
            throw new ConversionException("Cannot access JsonObject constructor of " + raw.getName(), e);
        }
    }

    static <T> T construct(Constructor<T> ctor, JsonObject json) {
        try {
            return ctor.newInstance(json);
        } catch (InvocationTargetException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new ConversionException(
                    "Failed to construct " + ctor.getDeclaringClass().getName(), cause);
        } catch (ReflectiveOperationException e) {
            throw new ConversionException(
                    "Failed to construct " + ctor.getDeclaringClass().getName(), e);
        }
    }
}
