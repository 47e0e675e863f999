package json.java17.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/// A JSON object: a mapping from unique member names to `JsonValue`s.
///
/// Members keep the order in which they were declared, which is used for
/// display only. Two objects are [equal][#equals(Object)] iff they hold the same
/// mappings, whatever their order.
///
/// ## Example Usage
/// ```java
/// JsonObject obj = JsonObject.of(Map.of(
///     "name", JsonString.of("Alice"),
///     "age", JsonNumber.of(30)
/// ));
/// obj.member("name"); // Optional[JsonString[value=Alice]]
/// ```
///
/// @param members the members. Copied, keeping iteration order; keys and values must
///        not be `null`.
public record JsonObject(Map<String, JsonValue> members) implements JsonValue {

    public JsonObject {
        Objects.requireNonNull(members, "members must not be null");
        final var copy = new LinkedHashMap<String, JsonValue>(members.size());
        members.forEach((k, v) -> copy.put(
                Objects.requireNonNull(k, "member name must not be null"),
                Objects.requireNonNull(v, "member value must not be null")));
        members = Collections.unmodifiableMap(copy);
    }

    /// {@return the `JsonObject` created from the given map} Members occur in the
    /// same order as the map's entries.
    /// @param map the members. Non-null.
    public static JsonObject of(Map<String, ? extends JsonValue> map) {
        return new JsonObject(Collections.unmodifiableMap(map));
    }

    /// {@return the value of the member `name`, or empty if there is no such member}
    /// @param name the member name. Non-null.
    public Optional<JsonValue> member(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(members.get(name));
    }

    @Override
    public String toString() {
        return members.entrySet().stream()
                .map(e -> JsonString.quote(e.getKey()) + ":" + e.getValue())
                .collect(Collectors.joining(",", "{", "}"));
    }
}
