package simplejson;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.List;
import java.util.Objects;
import lombok.Getter;
import org.jspecify.annotations.Nullable;

/**
 * Type-directed conversion between {@link JsonValue} trees and Java values.
 *
 * <p> Decoding is driven by the requested type and fails loudly with a {@link DecodingException} whose
 * {@link DecodingException#getParameter() parameter} locates the failing property from the root object,
 * e.g. {@code my_root_model.model.type} or {@code models[2].type}. Encoding is driven by the runtime type of the
 * value and never fails: anything that cannot be represented becomes JSON null.
 *
 * @author <a href="mailto:llw599502537@gmail.com">Freeman</a>
 */
public final class Json {

    private Json() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Decoding
    // ============================================================

    /**
     * Decode the property {@code key} of {@code object} as {@code type}.
     *
     * <p> Candidates are tried in this order:
     * <ol>
     *   <li>values that already have the requested shape: {@code String}, {@code Boolean}, numbers, {@code Object},
     *       {@link JsonValue} types, and lists or string-keyed maps of those</li>
     *   <li>enums, through their {@link RawRepresentable raw value} or name</li>
     *   <li>{@link JsonDecodable} types, constructed from the nested object</li>
     *   <li>types with a registered {@link ScalarTransform}, such as {@link java.util.Date} and {@link java.net.URL}</li>
     * </ol>
     *
     * <h3>Example</h3>
     * <pre>{@code
     * int id = Json.decode("id", json, int.class);
     * Status status = Json.decode("status", json, Status.class);
     * Model model = Json.decode("model", json, Model.class);
     * }</pre>
     *
     * @param key    property name, not {@code null}
     * @param object object to read from, not {@code null}
     * @param type   target class, not {@code null}
     * @param <T>    result type
     * @return decoded value, {@code null} only for an {@code Object} target holding JSON null
     * @throws DecodingException  if the property is missing or cannot be decoded as {@code type}
     * @throws ConversionException if {@code type} is not a supported decode target
     */
    public static <T> T decode(String key, JsonObject object, Class<T> type) {
        Objects.requireNonNull(type, "type");
        return decode(key, object, Type.of(type));
    }

    /**
     * Decode the property {@code key} of {@code object} as the type described by a {@link Type} token.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * List<String> tags = Json.decode("tags", json, new Json.Type<List<String>>() {});
     * Map<String, Integer> scores = Json.decode("scores", json, new Json.Type<Map<String, Integer>>() {});
     * }</pre>
     *
     * @see #decode(String, JsonObject, Class)
     */
    public static <T> T decode(String key, JsonObject object, Type<T> type) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(object, "object");
        Objects.requireNonNull(type, "type");
        return Decoder.decode(key, object, type.getType());
    }

    /**
     * Decode the property {@code key} of {@code object} as an array of {@link JsonDecodable} objects.
     *
     * <p> A strict decode fails on the first element that cannot be decoded, reporting it as
     * {@code key[index].property}; other exceptions thrown by the element constructor propagate unchanged. A relaxed
     * decode drops every element whose construction throws and keeps the others in source order.
     *
     * @param key    property name, not {@code null}
     * @param object object to read from, not {@code null}
     * @param type   element class, not {@code null}
     * @param strict whether an element failure fails the whole decode
     * @param <T>    element type
     * @return unmodifiable list of decoded elements
     * @throws DecodingException if the property is missing or not an array of objects, or, when strict, if an
     *                           element cannot be decoded
     */
    public static <T extends JsonDecodable> List<T> decodeArray(
            String key, JsonObject object, Class<T> type, boolean strict) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(object, "object");
        Objects.requireNonNull(type, "type");
        return Decoder.decodeArray(key, object, type, strict);
    }

    // ============================================================
    // Encoding
    // ============================================================

    /**
     * Encode any value into a JSON tree.
     *
     * <p> Strings, numbers and booleans become leaves, {@link JsonEncodable} values are replaced by their
     * {@link JsonEncodable#encodableValue() encodable value}, string-keyed maps and collections are encoded element
     * by element. Anything that cannot be represented as JSON, including {@code NaN} and reference cycles, becomes
     * {@link JsonNull}.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * JsonValue json = Json.encode(Map.of("id", 1, "created", new Date()));
     * // -> {"id":1,"created":"2017-05-16T11:44:00Z"}
     * }</pre>
     *
     * @param value any object, may be {@code null}
     * @return non-null JSON tree
     */
    public static JsonValue encode(@Nullable Object value) {
        return new Encoder().encode(value);
    }

    // ============================================================
    // Text
    // ============================================================

    /**
     * Parse JSON text into a tree.
     *
     * @param json JSON text, not {@code null}
     * @return parsed tree
     * @throws SyntaxException if {@code json} is not valid JSON
     */
    public static JsonValue parse(String json) {
        Objects.requireNonNull(json, "json");
        return JsonText.read(json);
    }

    /**
     * Parse JSON text whose top-level value is an object.
     *
     * @param json JSON text, not {@code null}
     * @return parsed object
     * @throws SyntaxException     if {@code json} is not valid JSON
     * @throws ConversionException if the top-level value is not an object
     */
    public static JsonObject parseObject(String json) {
        var value = parse(json);
        if (value instanceof JsonObject o) return o;
        throw new ConversionException(
                "Expected JSON object, but got " + value.getClass().getSimpleName());
    }

    /**
     * Serialize a tree to compact JSON text.
     *
     * @param value tree, not {@code null}
     * @return non-null JSON text
     */
    public static String stringify(JsonValue value) {
        Objects.requireNonNull(value, "value");
        return JsonText.write(value);
    }

    // ============================================================
    // Type token
    // ============================================================

    public abstract static class Type<T> {
        private final java.lang.reflect.Type type;

        protected Type() {
            Class<?> c = findTypeSubclass(getClass());
            var p = (ParameterizedType) c.getGenericSuperclass();
            this.type = p.getActualTypeArguments()[0];
        }

        private Type(java.lang.reflect.Type t) {
            this.type = t;
        }

        public static <T> Type<T> of(Class<T> clazz) {
            return new Type<>(clazz) {};
        }

        public java.lang.reflect.Type getType() {
            return type;
        }

        private static Class<?> findTypeSubclass(Class<?> child) {
            Class<?> parent = child.getSuperclass();
            if (parent == Type.class) return child;
            if (parent == Object.class) throw new IllegalStateException("Expected Json.Type superclass");
            return findTypeSubclass(parent);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Type<?> t && Objects.equals(type, t.type);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(type);
        }

        @Override
        public String toString() {
            return "Type{" + type + '}';
        }
    }

    // ============================================================
    // Type utils
    // ============================================================

    static Class<?> raw(java.lang.reflect.Type t) {
        if (t instanceof Class<?> c) return c;
        if (t instanceof ParameterizedType p) return (Class<?>) p.getRawType();
        if (t instanceof GenericArrayType ga) {
            var comp = raw(ga.getGenericComponentType());
            return Array.newInstance(comp, 0).getClass();
        }
        if (t instanceof TypeVariable<?> tv) return raw(erasureOf(tv));
        if (t instanceof WildcardType w) return raw(erasureOf(w));
        throw new IllegalArgumentException("Unsupported type: " + t);
    }

    static java.lang.reflect.Type canonicalize(java.lang.reflect.Type t) {
        if (t instanceof WildcardType w) return erasureOf(w);
        if (t instanceof TypeVariable<?> tv) return erasureOf(tv);
        return t;
    }

    static java.lang.reflect.Type erasureOf(WildcardType w) {
        var uppers = w.getUpperBounds();
        return uppers.length == 0 ? Object.class : uppers[0];
    }

    static java.lang.reflect.Type erasureOf(TypeVariable<?> tv) {
        var uppers = tv.getBounds();
        return uppers.length == 0 ? Object.class : uppers[0];
    }

    /**
     * @param t      possibly parameterized type
     * @param index  type argument index
     * @return the canonicalized type argument, or {@code Object} for a raw type
     */
    static java.lang.reflect.Type typeArgument(java.lang.reflect.Type t, int index) {
        if (t instanceof ParameterizedType p) return canonicalize(p.getActualTypeArguments()[index]);
        return Object.class;
    }

    static boolean isClassPresent(String name) {
        try {
            Class.forName(name);
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    // ============================================================
    // Exceptions
    // ============================================================

    /**
     * Base exception of this library.
     *
     * @since 0.1.0
     */
    public abstract static class Exception extends RuntimeException {
        public Exception(String message) {
            super(message);
        }

        public Exception(String message, @Nullable Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Exception thrown when a property cannot be decoded.
     *
     * <p> {@link #getCode()} tells whether the property was absent or present but unusable, {@link #getParameter()}
     * is the path of the property from the object the outermost decode call started at.
     *
     * @since 0.1.0
     */
    @Getter
    public static class DecodingException extends Exception {

        public enum Code {
            /**
             * The property was not found on the object being decoded.
             */
            MISSING,
            /**
             * The property was found but could not be decoded as the requested type.
             */
            INVALID
        }

        private final Code code;
        private final String parameter;

        public DecodingException(Code code, String parameter) {
            this(code, parameter, null);
        }

        public DecodingException(Code code, String parameter, @Nullable Throwable cause) {
            super((code == Code.MISSING ? "Missing" : "Invalid") + " parameter '" + parameter + "'", cause);
            this.code = Objects.requireNonNull(code, "code");
            this.parameter = Objects.requireNonNull(parameter, "parameter");
        }

        public static DecodingException missing(String parameter) {
            return new DecodingException(Code.MISSING, parameter);
        }

        public static DecodingException invalid(String parameter) {
            return new DecodingException(Code.INVALID, parameter);
        }

        public static DecodingException invalid(String parameter, Throwable cause) {
            return new DecodingException(Code.INVALID, parameter, cause);
        }

        /**
         * @param key property that held the object this error was raised for
         * @return the same error located at {@code key.parameter}
         */
        public DecodingException nestedIn(String key) {
            return new DecodingException(code, key + "." + parameter, this);
        }

        /**
         * @param key   property that held the array this error was raised for
         * @param index source index of the failing element
         * @return the same error located at {@code key[index].parameter}
         */
        public DecodingException nestedIn(String key, int index) {
            return new DecodingException(code, key + "[" + index + "]." + parameter, this);
        }
    }

    /**
     * Exception thrown when JSON text cannot be parsed.
     *
     * @since 0.1.0
     */
    public static class SyntaxException extends Exception {
        public SyntaxException(String message) {
            super(message);
        }

        public SyntaxException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Exception thrown when a tree cannot be written as JSON text.
     *
     * @since 0.1.0
     */
    public static class WriteException extends Exception {
        public WriteException(String message) {
            super(message);
        }

        public WriteException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Exception thrown when the library is asked for a conversion it does not support, such as decoding into a type
     * that is neither JSON-shaped, an enum, {@link JsonDecodable} nor backed by a {@link ScalarTransform}.
     *
     * <p> Unlike {@link DecodingException} this signals a programming error, not bad input.
     *
     * @since 0.1.0
     */
    public static class ConversionException extends Exception {
        public ConversionException(String message) {
            super(message);
        }

        public ConversionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
