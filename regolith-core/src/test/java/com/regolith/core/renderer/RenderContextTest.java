package com.regolith.core.renderer;

import com.regolith.core.config.RenderConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RenderContext}.
 */
class RenderContextTest {

    @Test
    void root_startsAtDepthZero() {
        RenderContext context = RenderContext.root(RenderConfig.defaults());

        assertThat(context.depth()).isZero();
        assertThat(context.groupFill()).isEqualTo("none");
    }

    @Test
    void nested_doesNotChangeParent() {
        RenderContext root = RenderContext.root(RenderConfig.defaults());

        RenderContext child = root.nested();

        assertThat(child.depth()).isEqualTo(1);
        assertThat(root.depth()).isZero();
    }

    @Test
    void groupFill_cyclesThroughPalette() {
        RenderConfig config = RenderConfig.builder().subexpColors(List.of("#111", "#222")).build();
        RenderContext context = RenderContext.root(config);

        assertThat(context.nested().groupFill()).isEqualTo("#111");
        assertThat(context.nested().nested().groupFill()).isEqualTo("#222");
        assertThat(context.nested().nested().nested().groupFill()).isEqualTo("#111");
    }

    @Test
    void groupFill_withEmptyPalette_usesOutermostFill() {
        RenderConfig config = RenderConfig.builder().subexpFill("#eee").subexpColors(List.of()).build();

        assertThat(new RenderContext(config, 3).groupFill()).isEqualTo("#eee");
    }

    @Test
    void constructor_withNullConfig_throwsException() {
        assertThatThrownBy(() -> new RenderContext(null, 0))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("config must not be null");
    }

    @Test
    void constructor_withNegativeDepth_throwsException() {
        assertThatThrownBy(() -> new RenderContext(RenderConfig.defaults(), -1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("depth must not be negative");
    }
}
