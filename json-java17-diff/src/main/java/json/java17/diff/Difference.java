package json.java17.diff;

import json.java17.model.JsonValue;

import java.util.Objects;
import java.util.Optional;

/// One located discrepancy found by [JsonDiff#diff].
///
/// A difference holds the path where the two documents disagree, the two
/// conflicting values (either may be absent, never both), and the configuration
/// that produced it. Under [CompareMode#INCLUSIVE] only the lhs can be absent.
///
/// `toString()` renders the human-readable message described on [DifferenceFormatter].
public final class Difference {

    private final DiffPath path;
    private final JsonValue lhs;
    private final JsonValue rhs;
    private final DiffConfig config;

    Difference(DiffPath path, JsonValue lhs, JsonValue rhs, DiffConfig config) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        if (lhs == null && rhs == null) {
            throw new InternalError("lhs and rhs can't both be missing at " + path);
        }
        if (rhs == null && config.compareMode() == CompareMode.INCLUSIVE) {
            throw new InternalError("a value missing from expected can't differ at " + path);
        }
        this.lhs = lhs;
        this.rhs = rhs;
    }

    /// {@return where the documents disagree}
    public DiffPath path() {
        return path;
    }

    /// {@return the lhs (actual) value, or empty if the lhs has no value at the path}
    public Optional<JsonValue> lhs() {
        return Optional.ofNullable(lhs);
    }

    /// {@return the rhs (expected) value, or empty if the rhs has no value at the path}
    ///
    /// When the lhs is absent this is the expected value missing from the lhs at
    /// [#path()], not the container that lacks it.
    public Optional<JsonValue> rhs() {
        return Optional.ofNullable(rhs);
    }

    /// {@return the configuration of the diff that found this difference}
    public DiffConfig config() {
        return config;
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj || (obj instanceof Difference other
                && path.equals(other.path)
                && Objects.equals(lhs, other.lhs)
                && Objects.equals(rhs, other.rhs)
                && config.equals(other.config));
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, lhs, rhs, config);
    }

    @Override
    public String toString() {
        return DifferenceFormatter.format(this);
    }
}
