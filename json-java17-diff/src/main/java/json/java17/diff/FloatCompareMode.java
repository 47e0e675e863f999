package json.java17.diff;

/// How two numbers are compared once both are treated as `double`s.
///
/// ```java
/// FloatCompareMode.exact().isEqual(0.1 + 0.2, 0.3);        // false
/// FloatCompareMode.epsilon(1e-9).isEqual(0.1 + 0.2, 0.3);  // true
/// ```
public sealed interface FloatCompareMode permits FloatCompareMode.Exact, FloatCompareMode.Epsilon {

    /// Number of units in the last place within which two doubles always count as equal
    /// under [Epsilon].
    int DEFAULT_ULPS = 4;

    /// {@return `true` if `a` and `b` are equal under this mode}
    /// @param a the lhs value
    /// @param b the rhs value
    boolean isEqual(double a, double b);

    /// {@return the exact mode}
    static FloatCompareMode exact() {
        return Exact.EXACT;
    }

    /// {@return an epsilon mode with the given absolute margin}
    /// @param epsilon the largest absolute difference that still counts as equal.
    ///        Not validated: a negative or NaN epsilon leaves only `==` and the ULPs margin.
    static FloatCompareMode epsilon(double epsilon) {
        return new Epsilon(epsilon);
    }

    /// Doubles are equal iff `a == b`.
    record Exact() implements FloatCompareMode {

        private static final Exact EXACT = new Exact();

        @Override
        public boolean isEqual(double a, double b) {
            return a == b;
        }
    }

    /// Doubles are equal iff `a == b`, `|a - b| <= epsilon`, or they are at most
    /// [#DEFAULT_ULPS] representable doubles apart.
    ///
    /// @param epsilon the absolute margin
    record Epsilon(double epsilon) implements FloatCompareMode {

        @Override
        public boolean isEqual(double a, double b) {
            if (a == b) {
                return true;
            }
            if (Math.abs(a - b) <= epsilon) {
                return true;
            }
            // wrapping subtraction of the bit patterns counts representable doubles in between
            final long ulps = Double.doubleToRawLongBits(a) - Double.doubleToRawLongBits(b);
            final long distance = ulps == Long.MIN_VALUE ? Long.MAX_VALUE : Math.abs(ulps);
            return distance <= DEFAULT_ULPS;
        }
    }
}
