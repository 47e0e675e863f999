package json.java17.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

/// Parses the same documents with Jackson and checks both readers build the same tree.
class JsonJacksonCrossCheckTest extends JsonModelLoggingConfig {

    private static final Logger LOG = Logger.getLogger(JsonJacksonCrossCheckTest.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @ParameterizedTest
    @ValueSource(strings = {
        "null",
        "[true, false, null]",
        "{\"a\": 1, \"b\": -2.5, \"c\": 1e3, \"d\": 12345678901234567890}",
        "{\"unicode\": \"\\u00e9\\u4e2d\", \"escapes\": \"tab\\there\\nnewline\"}",
        "[[], {}, [[1]], {\"x\": {\"y\": [\"z\"]}}]",
        "{\"order\": {\"z\": 1, \"y\": 2, \"x\": 3}}"
    })
    void agreesWithJackson(String document) throws Exception {
        LOG.info(() -> "TEST: agreesWithJackson " + document);
        final var ours = Json.parse(document);
        final var jackson = fromJackson(MAPPER.readTree(document));
        assertThat(ours).isEqualTo(jackson);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{\"name\":\"Alice\",\"scores\":[85,90,95]}",
        "{\"a\":\"quote\\\"d\",\"b\":null}"
    })
    void compactTextIsReadableByJackson(String document) throws Exception {
        LOG.info(() -> "TEST: compactTextIsReadableByJackson " + document);
        final var ours = Json.parse(document);
        assertThat(MAPPER.readTree(ours.toString())).isEqualTo(MAPPER.readTree(document));
        assertThat(MAPPER.readTree(Json.toDisplayString(ours, 2))).isEqualTo(MAPPER.readTree(document));
    }

    private static JsonValue fromJackson(JsonNode node) {
        if (node.isObject()) {
            final var members = new LinkedHashMap<String, JsonValue>();
            node.fields().forEachRemaining(e -> members.put(e.getKey(), fromJackson(e.getValue())));
            return new JsonObject(members);
        }
        if (node.isArray()) {
            final List<JsonValue> values = new ArrayList<>();
            node.elements().forEachRemaining(e -> values.add(fromJackson(e)));
            return new JsonArray(values);
        }
        if (node.isTextual()) {
            return JsonString.of(node.textValue());
        }
        if (node.isBoolean()) {
            return JsonBoolean.of(node.booleanValue());
        }
        if (node.isNull()) {
            return JsonNull.of();
        }
        if (node.isIntegralNumber()) {
            return JsonNumber.of(node.bigIntegerValue());
        }
        return JsonNumber.of(node.decimalValue());
    }
}
