package json.java17.diff;

import json.java17.model.Json;

import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Assertions over JSON documents built on [JsonDiff].
///
/// Arguments are converted with [Json#fromUntyped(Object)], so a `JsonValue`,
/// a parsed document, or plain maps, lists and scalars can be passed directly.
/// Failures throw a plain `AssertionError` whose message lists every
/// difference, separated by a blank line.
///
/// ```java
/// JsonAssertions.assertJsonInclude(
///     Json.parse(responseBody),
///     Map.of("status", "ok", "items", List.of(Map.of("id", 1))));
/// ```
public final class JsonAssertions {

    private static final Logger LOG = Logger.getLogger(JsonAssertions.class.getName());

    private JsonAssertions() {
        // Static utility class
    }

    /// Compares `lhs` with `rhs` without throwing.
    ///
    /// @param lhs the actual document
    /// @param rhs the expected document
    /// @param config the comparison policy
    /// @return empty if the documents match, otherwise the rendered differences
    ///         joined by a blank line
    /// @throws IllegalArgumentException if an argument cannot be converted to JSON
    public static Optional<String> matches(Object lhs, Object rhs, DiffConfig config) {
        final var differences = JsonDiff.diff(Json.fromUntyped(lhs), Json.fromUntyped(rhs), config);
        if (differences.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(differences.stream()
                .map(Difference::toString)
                .collect(Collectors.joining("\n\n")));
    }

    /// Asserts that `lhs` matches `rhs` under `config`.
    ///
    /// @param lhs the actual document
    /// @param rhs the expected document
    /// @param config the comparison policy
    /// @throws AssertionError if the documents differ
    public static void assertJsonMatches(Object lhs, Object rhs, DiffConfig config) {
        final var failure = matches(lhs, rhs, config);
        if (failure.isPresent()) {
            LOG.fine(() -> "JSON assertion failed under " + config);
            throw new AssertionError("\n\n" + failure.get() + "\n\n");
        }
    }

    /// Asserts that `actual` contains everything in `expected`.
    ///
    /// @param actual the actual document; may hold more than `expected`
    /// @param expected the expected subset
    /// @throws AssertionError if `actual` lacks or disagrees with part of `expected`
    public static void assertJsonInclude(Object actual, Object expected) {
        assertJsonMatches(actual, expected, DiffConfig.of(CompareMode.INCLUSIVE));
    }

    /// Asserts that `lhs` and `rhs` are equal.
    ///
    /// @param lhs one document
    /// @param rhs the other document
    /// @throws AssertionError if the documents differ in any way
    public static void assertJsonEq(Object lhs, Object rhs) {
        assertJsonMatches(lhs, rhs, DiffConfig.of(CompareMode.STRICT));
    }
}
