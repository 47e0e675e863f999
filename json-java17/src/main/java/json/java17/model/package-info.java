/// Immutable JSON value model for Java 17.
///
/// [json.java17.model.JsonValue] is a sealed interface over the six JSON
/// variants. [json.java17.model.Json] parses documents, converts untyped Java
/// data, and pretty-prints values for display.
///
/// ```java
/// JsonValue doc = Json.parse("""
///     {"id": 7, "tags": ["a", "b"]}
///     """);
/// if (doc instanceof JsonObject obj) {
///     obj.member("tags").ifPresent(System.out::println); // ["a","b"]
/// }
/// ```
package json.java17.model;
