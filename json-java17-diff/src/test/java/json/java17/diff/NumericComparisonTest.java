package json.java17.diff;

import json.java17.model.Json;
import json.java17.model.JsonNumber;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;

/// Number comparison under [NumericMode] and [FloatCompareMode].
class NumericComparisonTest extends JsonDiffLoggingConfig {

    private static final Logger LOG = Logger.getLogger(NumericComparisonTest.class.getName());

    private static final DiffConfig INCLUSIVE = DiffConfig.of(CompareMode.INCLUSIVE);
    private static final DiffConfig ASSUME_FLOAT = INCLUSIVE.withNumericMode(NumericMode.ASSUME_FLOAT);

    private static boolean equal(String lhs, String rhs, DiffConfig config) {
        return JsonDiff.diff(Json.parse(lhs), Json.parse(rhs), config).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
        "1,    1,    true",
        "1.0,  1.0,  true",
        "1,    1.0,  false",
        "1.0,  1,    false",
        "1.5,  1.50, true",
        "1e2,  100.0, true",
        "-0,   0,    true"
    })
    void strictNumericMode(String lhs, String rhs, boolean expected) {
        LOG.info(() -> "TEST: strictNumericMode " + lhs + " vs " + rhs);
        assertThat(equal(lhs, rhs, INCLUSIVE)).isEqualTo(expected);
    }

    @Test
    void assumeFloatIgnoresIntegerForm() {
        LOG.info(() -> "TEST: assumeFloatIgnoresIntegerForm");
        assertThat(equal("1", "1.0", ASSUME_FLOAT)).isTrue();
        assertThat(equal("1.0", "1", ASSUME_FLOAT)).isTrue();
        assertThat(equal("1", "2", ASSUME_FLOAT)).isFalse();
    }

    @Test
    void epsilonBoundary() {
        LOG.info(() -> "TEST: epsilonBoundary");
        final var config = ASSUME_FLOAT.withFloatCompareMode(FloatCompareMode.epsilon(0.2));
        assertThat(equal("1.15", "1", config)).isTrue();
        assertThat(equal("1.25", "1", config)).isFalse();
    }

    @Test
    void epsilonDoesNotApplyToStrictIntegers() {
        LOG.info(() -> "TEST: epsilonDoesNotApplyToStrictIntegers");
        final var config = INCLUSIVE.withFloatCompareMode(FloatCompareMode.epsilon(2.0));
        assertThat(equal("2", "1", config)).isFalse();
        assertThat(equal("2.0", "1.0", config)).isTrue();
    }

    @Test
    void exactFloatModeIsBitExact() {
        LOG.info(() -> "TEST: exactFloatModeIsBitExact");
        final var sum = JsonNumber.of(0.1 + 0.2);
        final var third = JsonNumber.of(0.3);
        assertThat(JsonDiff.diff(sum, third, ASSUME_FLOAT)).hasSize(1);
        assertThat(JsonDiff.diff(sum, third,
                ASSUME_FLOAT.withFloatCompareMode(FloatCompareMode.epsilon(1e-9)))).isEmpty();
    }

    @Test
    void unconvertibleNumbersFallBackToExactValue() {
        LOG.info(() -> "TEST: unconvertibleNumbersFallBackToExactValue");
        final var big = "9007199254740993";
        assertThat(equal(big, big, ASSUME_FLOAT)).isTrue();
        assertThat(equal(big, "9007199254740992", ASSUME_FLOAT)).isFalse();
        assertThat(equal(big, "9007199254740992.0", ASSUME_FLOAT)).isFalse();
        assertThat(equal("1e400", "1e400", INCLUSIVE)).isTrue();
        assertThat(equal("1e400", "1e401", ASSUME_FLOAT)).isFalse();
    }

    @Test
    void numberAgainstOtherTypeDiffers() {
        LOG.info(() -> "TEST: numberAgainstOtherTypeDiffers");
        assertThat(equal("1", "\"1\"", ASSUME_FLOAT)).isFalse();
        assertThat(equal("0", "false", INCLUSIVE)).isFalse();
        assertThat(equal("0", "null", INCLUSIVE)).isFalse();
    }
}
