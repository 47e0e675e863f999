package json.java17.diff;

import json.java17.model.JsonArray;
import json.java17.model.JsonBoolean;
import json.java17.model.JsonNull;
import json.java17.model.JsonNumber;
import json.java17.model.JsonObject;
import json.java17.model.JsonString;
import json.java17.model.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.logging.Logger;

/// Walks two documents in lock-step and accumulates their [Difference]s.
///
/// Dispatch is on the variant of the lhs. Recursion depth equals the nesting
/// depth of the lhs along matching paths.
final class DiffWalker {

    private static final Logger LOG = Logger.getLogger(DiffWalker.class.getName());

    private final DiffConfig config;
    private final List<Difference> acc = new ArrayList<>();

    DiffWalker(DiffConfig config) {
        this.config = config;
    }

    /// Diffs `lhs` against `rhs` from the root and returns the differences in
    /// depth-first, left-to-right order.
    List<Difference> diff(JsonValue lhs, JsonValue rhs) {
        walk(lhs, rhs, DiffPath.root());
        return acc;
    }

    private void walk(JsonValue lhs, JsonValue rhs, DiffPath path) {
        LOG.finest(() -> "Visiting " + path);
        if (lhs instanceof JsonNull || lhs instanceof JsonBoolean || lhs instanceof JsonString) {
            if (!lhs.equals(rhs)) {
                report(path, lhs, rhs);
            }
        } else if (lhs instanceof JsonNumber number) {
            onNumber(number, rhs, path);
        } else if (lhs instanceof JsonArray array) {
            if (config.arraySortingMode() == ArraySortingMode.IGNORE) {
                onArrayContains(array, rhs, path);
            } else {
                onArray(array, rhs, path);
            }
        } else if (lhs instanceof JsonObject object) {
            onObject(object, rhs, path);
        } else {
            throw new InternalError("unexpected JsonValue type: " + lhs.getClass().getName());
        }
    }

    private void onNumber(JsonNumber lhs, JsonValue rhs, DiffPath path) {
        if (!(rhs instanceof JsonNumber other && numbersEqual(lhs, other))) {
            report(path, lhs, rhs);
        }
    }

    private boolean numbersEqual(JsonNumber lhs, JsonNumber rhs) {
        if (config.numericMode() == NumericMode.STRICT
                && !(lhs.isFloatingPoint() && rhs.isFloatingPoint())) {
            return lhs.sameValue(rhs);
        }
        final var a = lhs.asDouble();
        final var b = rhs.asDouble();
        if (a.isEmpty() || b.isEmpty()) {
            return lhs.sameValue(rhs);
        }
        return config.floatCompareMode().isEqual(a.getAsDouble(), b.getAsDouble());
    }

    private void onArray(JsonArray lhs, JsonValue rhs, DiffPath path) {
        if (!(rhs instanceof JsonArray expected)) {
            report(path, lhs, rhs);
            return;
        }
        switch (config.compareMode()) {
            case INCLUSIVE -> {
                for (int i = 0; i < expected.size(); i++) {
                    final var childPath = path.append(i);
                    final var rhsValue = expected.values().get(i);
                    final var lhsValue = lhs.element(i);
                    if (lhsValue.isPresent()) {
                        walk(lhsValue.get(), rhsValue, childPath);
                    } else {
                        report(childPath, null, rhsValue);
                    }
                }
            }
            case STRICT -> {
                final int union = Math.max(lhs.size(), expected.size());
                for (int i = 0; i < union; i++) {
                    compareBothSides(lhs.element(i).orElse(null), expected.element(i).orElse(null), path.append(i));
                }
            }
        }
    }

    // Multiset containment: every rhs item must match at least as many lhs items
    // as it matches rhs items. An item always matches itself, so the count of rhs
    // matches starts at one and the item is never diffed against itself.
    private void onArrayContains(JsonArray lhs, JsonValue rhs, DiffPath path) {
        if (!(rhs instanceof JsonArray expected)) {
            report(path, lhs, rhs);
            return;
        }
        final var lhsValues = lhs.values();
        final var rhsValues = expected.values();
        if (config.compareMode() == CompareMode.STRICT && lhsValues.size() != rhsValues.size()) {
            report(path, lhs, rhs);
            return;
        }
        for (int i = 0; i < rhsValues.size(); i++) {
            final var rhsItem = rhsValues.get(i);
            int needed = 1;
            for (int j = 0; j < rhsValues.size(); j++) {
                if (j != i && isEqual(rhsItem, rhsValues.get(j))) {
                    needed++;
                }
            }
            int matching = 0;
            for (int k = 0; k < lhsValues.size() && matching < needed; k++) {
                if (isEqual(lhsValues.get(k), rhsItem)) {
                    matching++;
                }
            }
            if (matching < needed) {
                final int found = matching;
                final int wanted = needed;
                LOG.finer(() -> "At %s %d lhs item(s) match %s, %d needed".formatted(path, found, rhsItem, wanted));
                report(path, lhs, rhs);
                return;
            }
        }
    }

    private boolean isEqual(JsonValue lhs, JsonValue rhs) {
        return new DiffWalker(config).diff(lhs, rhs).isEmpty();
    }

    private void onObject(JsonObject lhs, JsonValue rhs, DiffPath path) {
        if (!(rhs instanceof JsonObject expected)) {
            report(path, lhs, rhs);
            return;
        }
        final var lhsMembers = lhs.members();
        final var rhsMembers = expected.members();
        switch (config.compareMode()) {
            case INCLUSIVE -> rhsMembers.forEach((name, rhsValue) -> {
                final var childPath = path.append(name);
                final var lhsValue = lhsMembers.get(name);
                if (lhsValue != null) {
                    walk(lhsValue, rhsValue, childPath);
                } else {
                    report(childPath, null, rhsValue);
                }
            });
            case STRICT -> {
                final var names = new TreeSet<>(rhsMembers.keySet());
                names.addAll(lhsMembers.keySet());
                for (var name : names) {
                    compareBothSides(lhsMembers.get(name), rhsMembers.get(name), path.append(name));
                }
            }
        }
    }

    // One step of a strict union walk: recurse when both sides have the key.
    private void compareBothSides(JsonValue lhs, JsonValue rhs, DiffPath path) {
        if (lhs != null && rhs != null) {
            walk(lhs, rhs, path);
        } else if (lhs != null || rhs != null) {
            report(path, lhs, rhs);
        } else {
            throw new InternalError("at least one side should have a value at " + path);
        }
    }

    private void report(DiffPath path, JsonValue lhs, JsonValue rhs) {
        final var difference = new Difference(path, lhs, rhs, config);
        LOG.finer(() -> "Difference at " + path);
        acc.add(difference);
    }
}
