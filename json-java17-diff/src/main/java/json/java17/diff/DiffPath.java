package json.java17.diff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Location of a value inside the root document, as the sequence of keys that
/// leads to it.
///
/// A path is persistent: [#append(DiffKey)] returns a new path that points at its
/// parent, so sibling branches extend the same parent without copying it and
/// without seeing each other's keys.
///
/// The root renders as `(root)`; any other path as the concatenation of its keys,
/// e.g. `.users[2].name`.
public final class DiffPath {

    private static final DiffPath ROOT = new DiffPath(null, null, 0);

    private final DiffPath parent;
    private final DiffKey key;
    private final int depth;

    private DiffPath(DiffPath parent, DiffKey key, int depth) {
        this.parent = parent;
        this.key = key;
        this.depth = depth;
    }

    /// {@return the root path}
    public static DiffPath root() {
        return ROOT;
    }

    /// {@return a new path that extends this one by `next`}
    /// @param next the key to append. Non-null.
    public DiffPath append(DiffKey next) {
        Objects.requireNonNull(next, "next must not be null");
        return new DiffPath(this, next, depth + 1);
    }

    /// {@return a new path that extends this one by an array index}
    /// @param index the zero-based index
    public DiffPath append(int index) {
        return append(new DiffKey.Index(index));
    }

    /// {@return a new path that extends this one by an object member name}
    /// @param name the member name. Non-null.
    public DiffPath append(String name) {
        return append(new DiffKey.Field(name));
    }

    /// {@return `true` if this is the root path}
    public boolean isRoot() {
        return depth == 0;
    }

    /// {@return the keys from the root down to this location}
    public List<DiffKey> keys() {
        final var keys = new ArrayList<DiffKey>(depth);
        for (var p = this; p.depth > 0; p = p.parent) {
            keys.add(p.key);
        }
        Collections.reverse(keys);
        return Collections.unmodifiableList(keys);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof DiffPath other) || depth != other.depth) {
            return false;
        }
        var a = this;
        var b = other;
        while (a.depth > 0) {
            if (a == b) {
                return true;
            }
            if (!a.key.equals(b.key)) {
                return false;
            }
            a = a.parent;
            b = b.parent;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return keys().hashCode();
    }

    @Override
    public String toString() {
        if (isRoot()) {
            return "(root)";
        }
        final var sb = new StringBuilder();
        for (var k : keys()) {
            sb.append(k);
        }
        return sb.toString();
    }
}
