package json.java17.diff;

import json.java17.model.Json;
import json.java17.model.JsonValue;

import java.util.stream.Collectors;

/// Renders a [Difference] as a human-readable message.
///
/// | mode | lhs | rhs | message |
/// |------|-----|-----|---------|
/// | inclusive | some | some | `json atoms at path "P" are not equal:` then `expected:` rhs and `actual:` lhs |
/// | inclusive | none | some | `json atom at path "P" is missing from actual` |
/// | strict | some | some | `json atoms at path "P" are not equal:` then `lhs:` and `rhs:` |
/// | strict | none | some | `json atom at path "P" is missing from lhs` |
/// | strict | some | none | `json atom at path "P" is missing from rhs` |
///
/// Labels are indented by 4 spaces and values, pretty-printed with an indent of 2,
/// by 8. Lines end with `\n`, the message itself has no trailing newline:
/// ```
/// json atoms at path ".a[0]" are not equal:
///     expected:
///         2
///     actual:
///         1
/// ```
final class DifferenceFormatter {

    private static final String LABEL_INDENT = "    ";
    private static final String VALUE_INDENT = "        ";

    private DifferenceFormatter() {}

    static String format(Difference difference) {
        final var path = difference.path();
        final var lhs = difference.lhs().orElse(null);
        final var rhs = difference.rhs().orElse(null);
        final var inclusive = difference.config().compareMode() == CompareMode.INCLUSIVE;

        if (lhs != null && rhs != null) {
            return inclusive
                    ? notEqual(path, "expected", rhs, "actual", lhs)
                    : notEqual(path, "lhs", lhs, "rhs", rhs);
        }
        if (rhs != null) {
            return missing(path, inclusive ? "actual" : "lhs");
        }
        if (lhs != null && !inclusive) {
            return missing(path, "rhs");
        }
        throw new InternalError("no message for a difference at " + path
                + " with lhs " + lhs + " and rhs " + rhs);
    }

    private static String notEqual(DiffPath path, String firstLabel, JsonValue first,
                                   String secondLabel, JsonValue second) {
        return "json atoms at path \"" + path + "\" are not equal:\n"
                + LABEL_INDENT + firstLabel + ":\n"
                + indent(Json.toDisplayString(first, 2)) + "\n"
                + LABEL_INDENT + secondLabel + ":\n"
                + indent(Json.toDisplayString(second, 2));
    }

    private static String missing(DiffPath path, String side) {
        return "json atom at path \"" + path + "\" is missing from " + side;
    }

    private static String indent(String text) {
        return text.lines()
                .map(line -> VALUE_INDENT + line)
                .collect(Collectors.joining("\n"));
    }
}
