package com.regolith.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RenderConfigLoader}.
 */
class RenderConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_overridesGivenKeys() throws IOException {
        Path styleFile = tempDir.resolve("regolith.yaml");
        Files.writeString(styleFile, """
            padding: 12
            fontSize: 16
            charWidth: 9.6
            literalFill: "#ff0000"
            subexpColors:
              - "#111111"
              - "#222222"
            """);

        RenderConfig config = RenderConfigLoader.load(styleFile);

        assertThat(config.padding()).isEqualTo(12);
        assertThat(config.fontSize()).isEqualTo(16);
        assertThat(config.charWidth()).isEqualTo(9.6);
        assertThat(config.literalFill()).isEqualTo("#ff0000");
        assertThat(config.subexpColors()).containsExactly("#111111", "#222222");
    }

    @Test
    void load_partialYaml_keepsDefaultsForMissingKeys() throws IOException {
        Path styleFile = tempDir.resolve("regolith.yaml");
        Files.writeString(styleFile, """
            lineColor: "#333"
            """);

        RenderConfig config = RenderConfigLoader.load(styleFile);
        RenderConfig defaults = RenderConfig.defaults();

        assertThat(config.lineColor()).isEqualTo("#333");
        assertThat(config.padding()).isEqualTo(defaults.padding());
        assertThat(config.literalFill()).isEqualTo(defaults.literalFill());
        assertThat(config.subexpColors()).isEqualTo(defaults.subexpColors());
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path styleFile = tempDir.resolve("regolith.yaml");
        Files.writeString(styleFile, """
            padding: 4
            theme: dark
            """);

        RenderConfig config = RenderConfigLoader.load(styleFile);

        assertThat(config.padding()).isEqualTo(4);
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        RenderConfig config = RenderConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(RenderConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        RenderConfig config = RenderConfigLoader.load(tempDir);

        assertThat(config).isEqualTo(RenderConfig.defaults());
    }

    @Test
    void load_malformedYaml_returnsDefaults() throws IOException {
        Path styleFile = tempDir.resolve("regolith.yaml");
        Files.writeString(styleFile, """
            padding: [unclosed
            """);

        RenderConfig config = RenderConfigLoader.load(styleFile);

        assertThat(config).isEqualTo(RenderConfig.defaults());
    }

    @Test
    void load_wrongValueType_returnsDefaults() throws IOException {
        Path styleFile = tempDir.resolve("regolith.yaml");
        Files.writeString(styleFile, """
            padding: wide
            """);

        RenderConfig config = RenderConfigLoader.load(styleFile);

        assertThat(config).isEqualTo(RenderConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path styleFile = tempDir.resolve("regolith.yaml");
        Files.writeString(styleFile, "");

        RenderConfig config = RenderConfigLoader.load(styleFile);

        assertThat(config).isEqualTo(RenderConfig.defaults());
    }

    @Test
    void parse_validYaml_returnsConfig() throws IOException {
        RenderConfig config = RenderConfigLoader.parse("anchorFill: \"#000\"\n");

        assertThat(config.anchorFill()).isEqualTo("#000");
    }

    @Test
    void parse_malformedYaml_throwsException() {
        assertThatThrownBy(() -> RenderConfigLoader.parse("padding: [unclosed\n"))
            .isInstanceOf(IOException.class);
    }
}
