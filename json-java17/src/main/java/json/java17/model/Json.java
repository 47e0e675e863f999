package json.java17.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// This class provides static methods for producing and displaying a [JsonValue].
///
/// [#parse(String)] produces a `JsonValue` by parsing data adhering to the JSON
/// syntax defined in RFC 8259.
///
/// [#fromUntyped(Object)] converts plain Java maps, lists and scalars.
///
/// [#toDisplayString(JsonValue, int)] is a formatter that produces a
/// representation of the JSON value suitable for display.
///
/// ## Example Usage
/// ```java
/// JsonValue json = Json.parse("{\"name\":\"John\",\"age\":30}");
/// JsonValue fromJava = Json.fromUntyped(Map.of("active", true, "score", 95));
/// System.out.println(Json.toDisplayString(json, 2));
/// ```
///
/// @spec https://datatracker.ietf.org/doc/html/rfc8259 RFC 8259: The JavaScript
///       Object Notation (JSON) Data Interchange Format
public final class Json {

    /// Maximum nesting depth of arrays and objects accepted by [#parse(String)].
    public static final int MAX_DEPTH = 1000;

    /// Parses and creates a `JsonValue` from the given JSON document.
    ///
    /// `JsonObject`s preserve the order of their members declared in the document.
    /// `JsonNumber`s preserve their source text.
    ///
    /// @param in the input JSON document. Non-null.
    /// @return the parsed `JsonValue`
    /// @throws JsonParseException if the input does not conform to the JSON syntax,
    ///         contains an object with duplicate member names, or nests arrays and
    ///         objects deeper than [#MAX_DEPTH]
    /// @throws NullPointerException if `in` is `null`
    public static JsonValue parse(String in) {
        Objects.requireNonNull(in, "in must not be null");
        return new JsonParser(in.toCharArray()).parseRoot();
    }

    /// {@return a `JsonValue` created from the given `src` object}
    ///
    /// | Untyped Object | JsonValue |
    /// |----------------|----------|
    /// | `List<Object>` | `JsonArray` |
    /// | `Boolean` | `JsonBoolean` |
    /// | `null` | `JsonNull` |
    /// | `Byte`, `Short`, `Integer`, `Long`, `BigInteger` | integer `JsonNumber` |
    /// | `Float`, `Double`, `BigDecimal` | `JsonNumber` |
    /// | `Map<String, Object>` | `JsonObject` |
    /// | `String` | `JsonString` |
    ///
    /// If `src` is already a `JsonValue`, it is returned as is.
    ///
    /// @param src the data to produce the `JsonValue` from. May be null.
    /// @throws IllegalArgumentException if `src` cannot be converted, including a
    ///         non-finite `Float` or `Double` and a map key that is not a `String`
    public static JsonValue fromUntyped(Object src) {
        if (src == null) {
            return JsonNull.of();
        }
        if (src instanceof JsonValue jv) {
            return jv;
        }
        if (src instanceof Map<?, ?> map) {
            final var members = new LinkedHashMap<String, JsonValue>(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException(
                            "The key '%s' is not a String".formatted(entry.getKey()));
                }
                members.put(key, fromUntyped(entry.getValue()));
            }
            return new JsonObject(members);
        }
        if (src instanceof List<?> list) {
            final List<JsonValue> values = new ArrayList<>(list.size());
            for (Object o : list) {
                values.add(fromUntyped(o));
            }
            return new JsonArray(values);
        }
        if (src instanceof String str) {
            return JsonString.of(str);
        }
        if (src instanceof Boolean bool) {
            return JsonBoolean.of(bool);
        }
        if (src instanceof Byte || src instanceof Short || src instanceof Integer || src instanceof Long) {
            return JsonNumber.of(((Number) src).longValue());
        }
        if (src instanceof Float || src instanceof Double) {
            return JsonNumber.of(((Number) src).doubleValue());
        }
        if (src instanceof BigInteger bi) {
            return JsonNumber.of(bi);
        }
        if (src instanceof BigDecimal bd) {
            return JsonNumber.of(bd);
        }
        throw new IllegalArgumentException(src.getClass().getSimpleName() + " is not a recognized type");
    }

    /// {@return the String representation of the given `JsonValue` that conforms
    /// to the JSON syntax and is suited for display}
    ///
    /// ## Example
    /// ```java
    /// JsonValue json = Json.parse("{\"name\":\"Alice\",\"scores\":[85,90]}");
    /// System.out.println(Json.toDisplayString(json, 2));
    /// // Output:
    /// // {
    /// //   "name": "Alice",
    /// //   "scores": [
    /// //     85,
    /// //     90
    /// //   ]
    /// // }
    /// ```
    ///
    /// @param value the `JsonValue` to create the display string from. Non-null.
    /// @param indent the number of spaces used for the indentation. Zero or positive.
    /// @throws NullPointerException if `value` is `null`
    /// @throws IllegalArgumentException if `indent` is a negative number
    public static String toDisplayString(JsonValue value, int indent) {
        Objects.requireNonNull(value, "value must not be null");
        if (indent < 0) {
            throw new IllegalArgumentException("indent is negative");
        }
        final var sb = new StringBuilder();
        appendDisplay(sb, value, 0, indent);
        return sb.toString();
    }

    // Appends `jv` assuming the cursor already sits at column `col`.
    private static void appendDisplay(StringBuilder sb, JsonValue jv, int col, int indent) {
        if (jv instanceof JsonObject jo) {
            if (jo.members().isEmpty()) {
                sb.append("{}");
                return;
            }
            sb.append("{\n");
            var first = true;
            for (var member : jo.members().entrySet()) {
                if (!first) {
                    sb.append(",\n");
                }
                first = false;
                sb.append(" ".repeat(col + indent))
                        .append(JsonString.quote(member.getKey()))
                        .append(": ");
                appendDisplay(sb, member.getValue(), col + indent, indent);
            }
            sb.append('\n').append(" ".repeat(col)).append('}');
        } else if (jv instanceof JsonArray ja) {
            if (ja.values().isEmpty()) {
                sb.append("[]");
                return;
            }
            sb.append("[\n");
            var first = true;
            for (var element : ja.values()) {
                if (!first) {
                    sb.append(",\n");
                }
                first = false;
                sb.append(" ".repeat(col + indent));
                appendDisplay(sb, element, col + indent, indent);
            }
            sb.append('\n').append(" ".repeat(col)).append(']');
        } else {
            sb.append(jv);
        }
    }

    // no instantiation is allowed for this class
    private Json() {}
}
