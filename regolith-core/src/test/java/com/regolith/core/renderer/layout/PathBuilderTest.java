package com.regolith.core.renderer.layout;

import com.regolith.core.config.RenderConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PathBuilder} and {@link TextMetrics}.
 */
class PathBuilderTest {

    @Test
    void build_joinsCommandsWithSpaces() {
        String d = new PathBuilder()
            .moveTo(0, 20)
            .quadraticTo(0, 10, 10, 10)
            .horizontalTo(40.5)
            .verticalTo(0)
            .lineTo(1, 2)
            .build();

        assertThat(d).isEqualTo("M 0 20 Q 0 10 10 10 H 40.5 V 0 L 1 2");
    }

    @Test
    void arcTo_writesFlagsAsDigits() {
        String d = new PathBuilder().arcTo(5, 5, 0, false, true, 10, 0).build();

        assertThat(d).isEqualTo("A 5 5 0 0 1 10 0");
    }

    @Test
    void cubicTo_writesAllControlPoints() {
        String d = new PathBuilder().cubicTo(1, 2, 3, 4, 5, 6).toString();

        assertThat(d).isEqualTo("C 1 2 3 4 5 6");
    }

    @Test
    void isEmpty_untilFirstCommand() {
        PathBuilder builder = new PathBuilder();

        assertThat(builder.isEmpty()).isTrue();
        assertThat(builder.build()).isEmpty();
        assertThat(builder.moveTo(0, 0).isEmpty()).isFalse();
    }

    @Test
    void measure_countsCodePoints() {
        RenderConfig config = RenderConfig.builder().charWidth(10).build();

        assertThat(TextMetrics.measure("abc", config)).isEqualTo(30);
        assertThat(TextMetrics.measure("é😀", config)).isEqualTo(20);
        assertThat(TextMetrics.measure("", config)).isZero();
        assertThat(TextMetrics.measure(null, config)).isZero();
    }
}
