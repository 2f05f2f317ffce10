package com.regolith.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading diagram styles from YAML files.
 *
 * <p>Uses Jackson to deserialize a style file into a {@link RenderConfig} through its
 * builder, so keys missing from the file keep their defaults. If the file is missing or
 * invalid, returns {@link RenderConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RenderConfig config = RenderConfigLoader.load(Paths.get("regolith.yaml"));
 * String svg = new DiagramRenderer(config).render(ast);
 * }</pre>
 */
public final class RenderConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(RenderConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private RenderConfigLoader() {
    }

    /**
     * Loads a render configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs the problem and returns
     * {@link RenderConfig#defaults()}.
     *
     * @param configPath path to the style file
     * @return loaded configuration or defaults if unavailable
     */
    public static RenderConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Style file not found: {}. Using default styles.", configPath);
            return RenderConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Style file is not readable: {}. Using default styles.", configPath);
            return RenderConfig.defaults();
        }

        try {
            log.debug("Loading styles from: {}", configPath);
            RenderConfig config = YAML_MAPPER.readValue(configPath.toFile(), RenderConfig.class);
            if (config == null) {
                log.warn("Style file is empty: {}. Using default styles.", configPath);
                return RenderConfig.defaults();
            }
            log.info("Loaded styles from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse style file: {}. Using default styles. Error: {}",
                configPath, e.getMessage());
            return RenderConfig.defaults();
        }
    }

    /**
     * Parses a render configuration from YAML text.
     *
     * @param yaml YAML document
     * @return parsed configuration
     * @throws IOException if the document is malformed
     */
    public static RenderConfig parse(String yaml) throws IOException {
        RenderConfig config = YAML_MAPPER.readValue(yaml, RenderConfig.class);
        return config != null ? config : RenderConfig.defaults();
    }
}
