package json.java17.model;

/// The JSON `true` and `false` literals.
///
/// @param value the boolean value
public record JsonBoolean(boolean value) implements JsonValue {

    private static final JsonBoolean TRUE = new JsonBoolean(true);
    private static final JsonBoolean FALSE = new JsonBoolean(false);

    /// {@return the `JsonBoolean` for the given `boolean`}
    /// @param value the boolean value
    public static JsonBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
