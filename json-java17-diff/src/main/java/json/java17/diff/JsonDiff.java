package json.java17.diff;

import json.java17.model.JsonValue;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Structural diff of two JSON documents.
///
/// The lhs is the actual document and the rhs the expected one. [DiffConfig]
/// decides how much of the documents is checked and how arrays and numbers
/// compare:
///
/// - [CompareMode#INCLUSIVE]: the rhs is the expected subset. Only keys and
///   indices present on the rhs are checked.
/// - [CompareMode#STRICT]: every key and index on either side is checked.
/// - [ArraySortingMode#IGNORE]: arrays compare as multisets.
/// - [NumericMode] and [FloatCompareMode]: exact or tolerant number comparison.
///
/// Type mismatches are not errors: they are reported as one [Difference] at the
/// path where the types diverge.
///
/// Usage:
/// ```java
/// JsonValue actual = Json.parse("{\"a\": 1, \"b\": [1, 2]}");
/// JsonValue expected = Json.parse("{\"b\": [1, 3]}");
/// List<Difference> diffs = JsonDiff.diff(actual, expected, DiffConfig.of(CompareMode.INCLUSIVE));
/// diffs.get(0).path(); // .b[1]
/// ```
///
/// Recursion depth equals the nesting depth of the documents, with a fixed number
/// of stack frames per level under both [ArraySortingMode]s. Documents produced
/// by [json.java17.model.Json#parse(String)] are at most
/// [json.java17.model.Json#MAX_DEPTH] deep, which a default thread stack handles;
/// hand-built documents nested thousands of levels deep can exhaust the stack.
/// Running time is linear in the size of the documents except under
/// [ArraySortingMode#IGNORE], whose cost multiplies per level of nested arrays.
public final class JsonDiff {

    private static final Logger LOG = Logger.getLogger(JsonDiff.class.getName());

    private JsonDiff() {
        // Static utility class
    }

    /// Computes the differences between `lhs` and `rhs`.
    ///
    /// @param lhs the actual document
    /// @param rhs the expected document
    /// @param config the comparison policy
    /// @return the differences in depth-first, left-to-right order; empty if the
    ///         documents match. Unmodifiable.
    /// @throws NullPointerException if any argument is null
    public static List<Difference> diff(JsonValue lhs, JsonValue rhs, DiffConfig config) {
        Objects.requireNonNull(lhs, "lhs must not be null");
        Objects.requireNonNull(rhs, "rhs must not be null");
        Objects.requireNonNull(config, "config must not be null");

        LOG.fine(() -> "Diffing with " + config);
        final var differences = new DiffWalker(config).diff(lhs, rhs);
        LOG.fine(() -> "Found " + differences.size() + " difference(s)");
        return Collections.unmodifiableList(differences);
    }
}
