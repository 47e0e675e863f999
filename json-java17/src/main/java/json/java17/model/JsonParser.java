package json.java17.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.logging.Logger;

/// Recursive descent parser for RFC 8259 JSON text.
///
/// One instance parses one document. Not thread safe.
final class JsonParser {

    private static final Logger LOG = Logger.getLogger(JsonParser.class.getName());

    private final char[] doc;
    private int offset;
    private int line = 1;
    private int lineStart;

    JsonParser(char[] doc) {
        this.doc = doc;
    }

    /// Parses the whole document; anything but whitespace after the root value is an error.
    JsonValue parseRoot() {
        LOG.finest(() -> "Parsing document of " + doc.length + " chars");
        final var root = parseValue(0);
        skipWhitespace();
        if (offset != doc.length) {
            throw failure("Unexpected character(s) after the root value");
        }
        return root;
    }

    private JsonValue parseValue(int depth) {
        skipWhitespace();
        if (offset >= doc.length) {
            throw failure("Missing JSON value");
        }
        return switch (doc[offset]) {
            case '{' -> parseObject(depth + 1);
            case '[' -> parseArray(depth + 1);
            case '"' -> JsonString.of(parseString());
            case 't' -> parseLiteral("true", JsonBoolean.of(true));
            case 'f' -> parseLiteral("false", JsonBoolean.of(false));
            case 'n' -> parseLiteral("null", JsonNull.of());
            default -> {
                final char c = doc[offset];
                if (c == '-' || (c >= '0' && c <= '9')) {
                    yield parseNumber();
                }
                throw failure("Unexpected character '%s'".formatted(c));
            }
        };
    }

    private JsonObject parseObject(int depth) {
        checkDepth(depth);
        offset++; // '{'
        final var members = new LinkedHashMap<String, JsonValue>();
        skipWhitespace();
        if (consume('}')) {
            return new JsonObject(members);
        }
        while (true) {
            skipWhitespace();
            if (offset >= doc.length || doc[offset] != '"') {
                throw failure("Expected a member name");
            }
            final int nameOffset = offset;
            final var name = parseString();
            if (members.containsKey(name)) {
                offset = nameOffset;
                throw failure("Duplicate member name \"%s\"".formatted(name));
            }
            skipWhitespace();
            if (!consume(':')) {
                throw failure("Expected ':' after member name");
            }
            members.put(name, parseValue(depth));
            skipWhitespace();
            if (consume('}')) {
                return new JsonObject(members);
            }
            if (!consume(',')) {
                throw failure("Expected ',' or '}' in object");
            }
        }
    }

    private JsonArray parseArray(int depth) {
        checkDepth(depth);
        offset++; // '['
        final List<JsonValue> values = new ArrayList<>();
        skipWhitespace();
        if (consume(']')) {
            return new JsonArray(values);
        }
        while (true) {
            values.add(parseValue(depth));
            skipWhitespace();
            if (consume(']')) {
                return new JsonArray(values);
            }
            if (!consume(',')) {
                throw failure("Expected ',' or ']' in array");
            }
        }
    }

    private String parseString() {
        offset++; // opening quote
        final var sb = new StringBuilder();
        while (offset < doc.length) {
            final char c = doc[offset++];
            if (c == '"') {
                return sb.toString();
            }
            if (c < 0x20) {
                offset--;
                throw failure("Unescaped control character in string");
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (offset >= doc.length) {
                break;
            }
            final char esc = doc[offset++];
            switch (esc) {
                case '"' -> sb.append('"');
                case '\\' -> sb.append('\\');
                case '/' -> sb.append('/');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'u' -> sb.append(parseUnicodeEscape());
                default -> {
                    offset--;
                    throw failure("Invalid escape sequence '\\%s'".formatted(esc));
                }
            }
        }
        throw failure("Unclosed string");
    }

    private char parseUnicodeEscape() {
        if (offset + 4 > doc.length) {
            throw failure("Incomplete unicode escape");
        }
        int code = 0;
        for (int i = 0; i < 4; i++) {
            final int digit = Character.digit(doc[offset], 16);
            if (digit < 0) {
                throw failure("Invalid unicode escape");
            }
            code = (code << 4) | digit;
            offset++;
        }
        return (char) code;
    }

    private JsonNumber parseNumber() {
        final int start = offset;
        consume('-');
        // a leading zero stands alone
        if (!consume('0') && !digits()) {
            throw failure("Invalid number");
        }
        if (consume('.') && !digits()) {
            throw failure("Expected digits after decimal point");
        }
        if (consume('e') || consume('E')) {
            if (!consume('+')) {
                consume('-');
            }
            if (!digits()) {
                throw failure("Expected digits in exponent");
            }
        }
        return new JsonNumber(new String(doc, start, offset - start));
    }

    private boolean digits() {
        final int start = offset;
        while (offset < doc.length && doc[offset] >= '0' && doc[offset] <= '9') {
            offset++;
        }
        return offset > start;
    }

    private JsonValue parseLiteral(String literal, JsonValue value) {
        if (offset + literal.length() > doc.length
                || !literal.equals(new String(doc, offset, literal.length()))) {
            throw failure("Invalid literal, expected '%s'".formatted(literal));
        }
        offset += literal.length();
        return value;
    }

    private void checkDepth(int depth) {
        if (depth > Json.MAX_DEPTH) {
            throw failure("Nesting depth exceeds " + Json.MAX_DEPTH);
        }
    }

    private boolean consume(char c) {
        if (offset < doc.length && doc[offset] == c) {
            offset++;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (offset < doc.length) {
            final char c = doc[offset];
            if (c == '\n') {
                line++;
                lineStart = offset + 1;
            } else if (c != ' ' && c != '\t' && c != '\r') {
                return;
            }
            offset++;
        }
    }

    private JsonParseException failure(String message) {
        final int position = offset - lineStart;
        LOG.fine(() -> "Parse failure at line %d position %d: %s".formatted(line, position, message));
        return new JsonParseException("%s. Line: %d, Position: %d.".formatted(message, line, position),
                line, position);
    }
}
