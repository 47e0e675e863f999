package json.java17.diff;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DiffPathTest extends JsonDiffLoggingConfig {

    @Test
    void rootRendersAsSentinel() {
        assertThat(DiffPath.root().toString()).isEqualTo("(root)");
        assertThat(DiffPath.root().isRoot()).isTrue();
        assertThat(DiffPath.root().keys()).isEmpty();
    }

    @Test
    void keysRenderInAccumulationOrder() {
        final var path = DiffPath.root().append("users").append(2).append("name");
        assertThat(path.toString()).isEqualTo(".users[2].name");
        assertThat(path.keys()).containsExactly(
                new DiffKey.Field("users"), new DiffKey.Index(2), new DiffKey.Field("name"));
        assertThat(path.isRoot()).isFalse();
    }

    @Test
    void appendLeavesTheParentUnchanged() {
        final var parent = DiffPath.root().append("a");
        final var left = parent.append(0);
        final var right = parent.append("b");

        assertThat(parent.toString()).isEqualTo(".a");
        assertThat(left.toString()).isEqualTo(".a[0]");
        assertThat(right.toString()).isEqualTo(".a.b");
    }

    @Test
    void equalityIsStructural() {
        final var one = DiffPath.root().append("a").append(1);
        final var two = DiffPath.root().append(new DiffKey.Field("a")).append(new DiffKey.Index(1));

        assertThat(one).isEqualTo(two).hasSameHashCodeAs(two);
        assertThat(one).isNotEqualTo(DiffPath.root().append("a").append(2));
        assertThat(one).isNotEqualTo(DiffPath.root().append("a"));
        assertThat(DiffPath.root().append("1")).isNotEqualTo(DiffPath.root().append(1));
    }

    @Test
    void keysValidateTheirInput() {
        assertThatThrownBy(() -> new DiffKey.Index(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DiffKey.Field(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> DiffPath.root().append((DiffKey) null)).isInstanceOf(NullPointerException.class);
    }
}
