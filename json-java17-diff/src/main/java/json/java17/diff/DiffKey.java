package json.java17.diff;

import java.util.Objects;

/// A single step in a [DiffPath].
public sealed interface DiffKey permits DiffKey.Index, DiffKey.Field {

    /// Array element step, rendered as `[index]`.
    ///
    /// @param index the zero-based index
    record Index(int index) implements DiffKey {
        public Index {
            if (index < 0) {
                throw new IllegalArgumentException("index must not be negative: " + index);
            }
        }

        @Override
        public String toString() {
            return "[" + index + "]";
        }
    }

    /// Object member step, rendered as `.name`.
    ///
    /// @param name the member name
    record Field(String name) implements DiffKey {
        public Field {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String toString() {
            return "." + name;
        }
    }
}
