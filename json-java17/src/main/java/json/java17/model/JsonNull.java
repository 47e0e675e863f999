package json.java17.model;

/// The JSON `null` literal.
public record JsonNull() implements JsonValue {

    private static final JsonNull NULL = new JsonNull();

    /// {@return the `JsonNull`}
    public static JsonNull of() {
        return NULL;
    }

    @Override
    public String toString() {
        return "null";
    }
}
