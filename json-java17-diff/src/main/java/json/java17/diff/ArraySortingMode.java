package json.java17.diff;

/// Whether the order of array elements matters.
public enum ArraySortingMode {
    /// Elements are compared position by position.
    EXACT,
    /// Arrays are compared as multisets under the same diff relation.
    ///
    /// Every rhs element, counting duplicates, must match at least as many lhs
    /// elements as it matches rhs elements. Under [CompareMode#STRICT] the lengths
    /// must also be equal. A violation is reported once for the whole array.
    ///
    /// Each rhs element is diffed against every other rhs element and against
    /// lhs elements until it has found enough matches. One array pair of sizes
    /// `m` (lhs) and `n` (rhs) costs up to `n * (n - 1 + m)` nested diffs, and each
    /// of those is a full diff of the two elements. The cost therefore multiplies
    /// per nesting level: arrays of width `n` nested `d` deep cost on the order of
    /// `(n * (n - 1 + m))^d` element comparisons. Chains of single-element arrays
    /// stay linear in their depth. Prefer [#EXACT] for large or deeply nested arrays.
    ///
    /// Stack use per nesting level is constant, as with [#EXACT], so any document
    /// up to [json.java17.model.Json#MAX_DEPTH] deep can be diffed.
    IGNORE
}
