package simplejson;

/**
 * An enum backed by a scalar raw value.
 *
 * <p> Decoding reads the raw value as {@code R} and picks the constant whose {@link #rawValue()} equals it.
 * Encoding emits the raw value.
 *
 * <pre>{@code
 * enum Status implements RawRepresentable<Integer> {
 *     UNKNOWN(0), IDLE(1), ACTIVE(2);
 *
 *     private final int rawValue;
 *
 *     Status(int rawValue) { this.rawValue = rawValue; }
 *
 *     public Integer rawValue() { return rawValue; }
 * }
 * }</pre>
 *
 * <p> Enums that do not implement this interface use {@link Enum#name()} as their raw value.
 *
 * @param <R> raw value type, one of the scalar types {@link Json#decode} matches directly
 * @author Freeman
 * @since 0.1.0
 */
public interface RawRepresentable<R> extends JsonEncodable {

    R rawValue();

    @Override
    default Object encodableValue() {
        return rawValue();
    }
}
