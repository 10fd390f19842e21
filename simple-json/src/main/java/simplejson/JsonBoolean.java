package simplejson;

/**
 *
 *
 * @author Freeman
 * @since 0.1.0
 */
public record JsonBoolean(boolean value) implements JsonValue {

    public static final JsonBoolean TRUE = new JsonBoolean(true);
    public static final JsonBoolean FALSE = new JsonBoolean(false);

    public static JsonBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public Boolean toJava() {
        return value;
    }
}
