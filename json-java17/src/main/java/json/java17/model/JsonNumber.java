package json.java17.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;

/// A JSON number, an arbitrary-precision number represented in base 10 using
/// decimal digits.
///
/// A `JsonNumber` keeps the text it was parsed from (or created with) and
/// distinguishes integers from floating-point numbers the way the text is
/// written: a number is floating point iff its text contains `.`, `e` or `E`.
/// So `1` and `1.0` are different numbers for [#sameValue(JsonNumber)] and
/// [#equals(Object)], while [#asDouble()] maps both to the same `double`.
///
/// ## Example Usage
/// ```java
/// JsonNumber.of(1).sameValue(JsonNumber.of("1"));     // true
/// JsonNumber.of(1).sameValue(JsonNumber.of(1.0));     // false
/// JsonNumber.of("1e2").sameValue(JsonNumber.of(100.0)); // true
/// ```
///
/// @spec https://datatracker.ietf.org/doc/html/rfc8259#section-6 RFC 8259:
///      The JavaScript Object Notation (JSON) Data Interchange Format - Numbers
public final class JsonNumber implements JsonValue {

    /// Largest integer magnitude every `double` represents exactly (2^53).
    static final BigInteger MAX_SAFE_INTEGER = BigInteger.ONE.shiftLeft(53);

    private final String text;
    private final boolean floatingPoint;

    JsonNumber(String text) {
        this.text = text;
        this.floatingPoint = text.indexOf('.') >= 0
                || text.indexOf('e') >= 0
                || text.indexOf('E') >= 0;
    }

    /// Creates a JSON number from the given `long` value.
    ///
    /// @param num the given `long` value.
    /// @return a JSON integer
    public static JsonNumber of(long num) {
        return new JsonNumber(Long.toString(num));
    }

    /// Creates a JSON number from the given `double` value.
    /// The text of the number is [Double#toString(double)] of `num`, so the
    /// result is always floating point.
    ///
    /// @param num the given `double` value.
    /// @return a floating-point JSON number
    /// @throws IllegalArgumentException if `num` is not finite
    public static JsonNumber of(double num) {
        if (!Double.isFinite(num)) {
            throw new IllegalArgumentException("Not a valid JSON number: " + num);
        }
        return new JsonNumber(Double.toString(num));
    }

    /// Creates a JSON integer from the given `BigInteger`.
    ///
    /// @param num the value. Non-null.
    /// @return a JSON integer
    public static JsonNumber of(BigInteger num) {
        return new JsonNumber(num.toString()); // Implicit NPE
    }

    /// Creates a JSON number from the given `BigDecimal`.
    ///
    /// @param num the value. Non-null.
    /// @return a JSON number, integral iff `num` has no fraction and no exponent
    public static JsonNumber of(BigDecimal num) {
        return new JsonNumber(num.toString()); // Implicit NPE
    }

    /// Creates a JSON number from its JSON text.
    ///
    /// @param num the JSON text of a number, e.g. `"-1.5e3"`. Non-null.
    /// @return the JSON number
    /// @throws IllegalArgumentException if `num` is not a valid JSON number
    public static JsonNumber of(String num) {
        Objects.requireNonNull(num, "num must not be null");
        try {
            if (Json.parse(num) instanceof JsonNumber jn) {
                return jn;
            }
        } catch (JsonParseException ex) {
            throw new IllegalArgumentException("Not a JSON number: " + num, ex);
        }
        throw new IllegalArgumentException("Not a JSON number: " + num);
    }

    /// {@return `true` if this number is written in floating-point form}
    public boolean isFloatingPoint() {
        return floatingPoint;
    }

    /// Converts this number to a `double` where that is lossless enough to treat
    /// the number as a float.
    ///
    /// The conversion fails for integers whose magnitude exceeds 2^53 and for
    /// floating-point numbers outside the finite `double` range.
    ///
    /// @return the `double` value, or an empty `OptionalDouble` if there is none
    public OptionalDouble asDouble() {
        if (floatingPoint) {
            final double d = Double.parseDouble(text);
            return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
        }
        final var bi = new BigInteger(text);
        if (bi.abs().compareTo(MAX_SAFE_INTEGER) > 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(bi.doubleValue());
    }

    /// {@return this number as a `BigDecimal`}
    /// @throws NumberFormatException if the exponent is outside the `int` range
    public BigDecimal toBigDecimal() {
        return new BigDecimal(text);
    }

    /// Exact value equality.
    ///
    /// Two integers are equal iff their integer values are equal, and two
    /// floating-point numbers are equal iff their decimal values are equal.
    /// An integer never equals a floating-point number.
    ///
    /// @param other the number to compare with. Non-null.
    /// @return `true` if both numbers hold the same value in the same form
    public boolean sameValue(JsonNumber other) {
        Objects.requireNonNull(other, "other must not be null");
        if (floatingPoint != other.floatingPoint) {
            return false;
        }
        if (!floatingPoint) {
            return new BigInteger(text).equals(new BigInteger(other.text));
        }
        try {
            return toBigDecimal().compareTo(other.toBigDecimal()) == 0;
        } catch (NumberFormatException ex) {
            // Exponent too large for BigDecimal: only the literal text is comparable
            return text.equalsIgnoreCase(other.text);
        }
    }

    /// {@return `true` if `obj` is a `JsonNumber` with the [same value][#sameValue(JsonNumber)]}
    @Override
    public boolean equals(Object obj) {
        return this == obj || (obj instanceof JsonNumber other && sameValue(other));
    }

    @Override
    public int hashCode() {
        if (!floatingPoint) {
            return new BigInteger(text).hashCode();
        }
        try {
            return 31 * toBigDecimal().stripTrailingZeros().hashCode() + 1;
        } catch (NumberFormatException ex) {
            return text.toLowerCase(Locale.ROOT).hashCode();
        }
    }

    /// {@return the JSON text of this number}
    ///
    /// A parsed number keeps its source text regardless of its precision or range.
    @Override
    public String toString() {
        return text;
    }
}
