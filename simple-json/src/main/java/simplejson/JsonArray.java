package simplejson;

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 *
 *
 * @author Freeman
 * @since 0.1.0
 */
public record JsonArray(List<JsonValue> value) implements JsonValue {

    public JsonArray {
        value = List.copyOf(value);
    }

    public JsonValue get(int index) {
        return value.get(index);
    }

    public int size() {
        return value.size();
    }

    @Override
    public List<@Nullable Object> toJava() {
        var list = new ArrayList<@Nullable Object>(value.size());
        for (var e : value) {
            list.add(e.toJava());
        }
        return list;
    }
}
