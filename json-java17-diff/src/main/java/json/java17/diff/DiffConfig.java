package json.java17.diff;

import java.util.Objects;

/// The comparison policy of a diff: four independent choices.
///
/// Instances are immutable. The `with*` methods return a new configuration and
/// leave the receiver unchanged.
///
/// ```java
/// DiffConfig config = DiffConfig.of(CompareMode.INCLUSIVE)
///     .withArraySortingMode(ArraySortingMode.IGNORE)
///     .withNumericMode(NumericMode.ASSUME_FLOAT)
///     .withFloatCompareMode(FloatCompareMode.epsilon(1e-6));
/// ```
///
/// @param compareMode inclusive (subset) or strict (full) comparison
/// @param arraySortingMode whether array order matters
/// @param numericMode how numbers are compared
/// @param floatCompareMode how numbers compared as doubles are matched
public record DiffConfig(
        CompareMode compareMode,
        ArraySortingMode arraySortingMode,
        NumericMode numericMode,
        FloatCompareMode floatCompareMode) {

    public DiffConfig {
        Objects.requireNonNull(compareMode, "compareMode must not be null");
        Objects.requireNonNull(arraySortingMode, "arraySortingMode must not be null");
        Objects.requireNonNull(numericMode, "numericMode must not be null");
        Objects.requireNonNull(floatCompareMode, "floatCompareMode must not be null");
    }

    /// {@return a configuration with the given compare mode}
    /// Arrays are ordered, numbers strict and floats exact.
    /// @param compareMode inclusive or strict
    public static DiffConfig of(CompareMode compareMode) {
        return new DiffConfig(compareMode, ArraySortingMode.EXACT, NumericMode.STRICT, FloatCompareMode.exact());
    }

    /// {@return a copy of this configuration with the given array sorting mode}
    /// @param mode the array sorting mode
    public DiffConfig withArraySortingMode(ArraySortingMode mode) {
        return new DiffConfig(compareMode, mode, numericMode, floatCompareMode);
    }

    /// {@return a copy of this configuration with the given numeric mode}
    /// @param mode the numeric mode
    public DiffConfig withNumericMode(NumericMode mode) {
        return new DiffConfig(compareMode, arraySortingMode, mode, floatCompareMode);
    }

    /// {@return a copy of this configuration with the given float compare mode}
    /// @param mode the float compare mode
    public DiffConfig withFloatCompareMode(FloatCompareMode mode) {
        return new DiffConfig(compareMode, arraySortingMode, numericMode, mode);
    }
}
