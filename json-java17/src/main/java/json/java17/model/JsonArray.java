package json.java17.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/// A JSON array: an ordered sequence of `JsonValue`s.
///
/// @param values the elements. Copied into an unmodifiable list; must not
///        contain `null`.
public record JsonArray(List<JsonValue> values) implements JsonValue {

    public JsonArray {
        Objects.requireNonNull(values, "values must not be null");
        values = List.copyOf(values);
    }

    /// {@return a `JsonArray` holding the given values in order}
    /// @param values the elements. Non-null, no `null` elements.
    public static JsonArray of(List<? extends JsonValue> values) {
        return new JsonArray(List.copyOf(values));
    }

    /// {@return a `JsonArray` holding the given values in order}
    /// @param values the elements. Non-null, no `null` elements.
    public static JsonArray of(JsonValue... values) {
        return new JsonArray(List.of(values));
    }

    /// {@return the number of elements}
    public int size() {
        return values.size();
    }

    /// {@return the element at `index`, or empty if the index is out of bounds}
    /// @param index the zero-based index
    public Optional<JsonValue> element(int index) {
        return index >= 0 && index < values.size() ? Optional.of(values.get(index)) : Optional.empty();
    }

    @Override
    public String toString() {
        return values.stream().map(JsonValue::toString).collect(Collectors.joining(",", "[", "]"));
    }
}
