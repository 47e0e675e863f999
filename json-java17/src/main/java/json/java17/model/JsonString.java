package json.java17.model;

import java.util.Objects;

/// A JSON string.
///
/// `toString()` returns the quoted and escaped JSON text, `value()` the
/// unescaped Java `String`.
///
/// @param value the unescaped string value. Non-null.
public record JsonString(String value) implements JsonValue {

    public JsonString {
        Objects.requireNonNull(value, "value must not be null");
    }

    /// {@return a `JsonString` holding the given value}
    /// @param value the unescaped string value. Non-null.
    public static JsonString of(String value) {
        return new JsonString(value);
    }

    @Override
    public String toString() {
        return quote(value);
    }

    /// Quotes and escapes `s` as a JSON string literal.
    static String quote(String s) {
        final var sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append("\\u%04x".formatted((int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
