package json.java17.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;

class JsonArrayTest extends JsonModelLoggingConfig {

    private static final Logger LOG = Logger.getLogger(JsonArrayTest.class.getName());

    @Test
    void elementIsEmptyOutOfBounds() {
        LOG.info(() -> "TEST: elementIsEmptyOutOfBounds");
        final var array = (JsonArray) Json.parse("[1, \"two\"]");

        assertThat(array.size()).isEqualTo(2);
        assertThat(array.element(0)).contains(JsonNumber.of(1L));
        assertThat(array.element(1)).contains(JsonString.of("two"));
        assertThat(array.element(2)).isEmpty();
        assertThat(array.element(-1)).isEmpty();
        assertThat(JsonArray.of().size()).isZero();
    }

    @Test
    void valuesAreCopied() {
        LOG.info(() -> "TEST: valuesAreCopied");
        final List<JsonValue> source = new ArrayList<>(List.of(JsonBoolean.of(true)));
        final var array = JsonArray.of(source);
        source.add(JsonNull.of());

        assertThat(array.size()).isEqualTo(1);
        assertThatThrownBy(() -> array.values().add(JsonNull.of()))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
