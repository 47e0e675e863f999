package json.java17.diff;

/// How much of the two documents a diff checks.
public enum CompareMode {
    /// The rhs is the expected subset: only keys and indices present on the rhs
    /// are checked, anything extra on the lhs is ignored.
    INCLUSIVE,
    /// Both sides must match exactly: every key and index on either side is checked.
    STRICT
}
