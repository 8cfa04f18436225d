package com.codeadapt.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link AdapterConfig} from {@code codeadapt.yml}.
 *
 * <p>A missing, unreadable or invalid file never fails: the problem is logged and
 * {@link AdapterConfig#defaults()} is returned. An empty file yields the defaults as well.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AdapterConfig config = ConfigLoader.load(Paths.get("codeadapt.yml"));
 * ComponentAdapter adapter = new ComponentAdapter(config);
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "codeadapt.yml";

    private ConfigLoader() {
        // Utility class - no instantiation
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code codeadapt.yml}
     * @return loaded configuration or defaults if unavailable
     */
    public static AdapterConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return AdapterConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return AdapterConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            AdapterConfig config = YAML_MAPPER.readValue(configPath.toFile(), AdapterConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return AdapterConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return AdapterConfig.defaults();
        }
    }
}
