package json.java17.diff;

/// How two JSON numbers are compared.
public enum NumericMode {
    /// Numbers are compared by exact value and form: `1` and `1.0` differ.
    /// Two floating-point numbers are compared with the configured [FloatCompareMode].
    STRICT,
    /// Numbers are always compared as `double`s with the configured
    /// [FloatCompareMode]. A number with no `double` value (an integer beyond
    /// 2^53, say) falls back to exact comparison.
    ASSUME_FLOAT
}
