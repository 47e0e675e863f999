package json.java17.model;

/// The interface that represents a JSON value.
///
/// The set of variants is closed: every `JsonValue` is exactly one of
/// [JsonNull], [JsonBoolean], [JsonNumber], [JsonString], [JsonArray] or
/// [JsonObject]. Code that dispatches on the variant can rely on that and treat
/// any other type as an internal error.
///
/// Instances of `JsonValue` are immutable and thread safe.
///
/// A `JsonValue` can be produced by [Json#parse(String)] or [Json#fromUntyped(Object)].
public sealed interface JsonValue
        permits JsonNull, JsonBoolean, JsonNumber, JsonString, JsonArray, JsonObject {

    /// {@return the compact String representation of this `JsonValue` that conforms
    /// to the JSON syntax} For a String representation suitable for display,
    /// use [Json#toDisplayString(JsonValue, int)].
    @Override
    String toString();
}
