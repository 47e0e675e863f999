package json.java17.model;

/// Signals that an error has been detected while parsing a JSON document.
///
/// The message carries the line and position of the offending character.
public final class JsonParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int errorLine;
    private final int errorPosition;

    /// Creates a `JsonParseException` with the given detail message, line number
    /// and position within that line.
    ///
    /// @param message the detail message
    /// @param errorLine the line number (starting at 1) of the offending character
    /// @param errorPosition the position (starting at 0) within that line
    public JsonParseException(String message, int errorLine, int errorPosition) {
        super(message);
        this.errorLine = errorLine;
        this.errorPosition = errorPosition;
    }

    /// {@return the line number (starting at 1) where the error was detected}
    public int getErrorLine() {
        return errorLine;
    }

    /// {@return the position (starting at 0) within the line where the error was detected}
    public int getErrorPosition() {
        return errorPosition;
    }
}
