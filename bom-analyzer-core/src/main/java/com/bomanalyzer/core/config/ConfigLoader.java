package com.bomanalyzer.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link AnalyzerConfig} from {@code bom-analyzer.yaml} with Jackson.
 *
 * <p>A missing, unreadable, empty or invalid file is not an error: a warning is logged and
 * {@link AnalyzerConfig#defaults()} is returned.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalyzerConfig config = ConfigLoader.load(Paths.get("bom-analyzer.yaml"));
 * BomColumns columns = config.input().columns().toBomColumns();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Default configuration file name.
     */
    public static final String DEFAULT_FILE_NAME = "bom-analyzer.yaml";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to the configuration file
     * @return loaded configuration or defaults if unavailable
     */
    public static AnalyzerConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return AnalyzerConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return AnalyzerConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            AnalyzerConfig config = YAML_MAPPER.readValue(configPath.toFile(), AnalyzerConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return AnalyzerConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return AnalyzerConfig.defaults();
        }
    }
}
