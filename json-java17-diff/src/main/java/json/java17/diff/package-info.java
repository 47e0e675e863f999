/// Structural diff of JSON documents.
///
/// [json.java17.diff.JsonDiff#diff] walks two [json.java17.model.JsonValue]s under a
/// [json.java17.diff.DiffConfig] and returns located
/// [json.java17.diff.Difference]s; [json.java17.diff.JsonAssertions] turns them into
/// assertion failures.
package json.java17.diff;
