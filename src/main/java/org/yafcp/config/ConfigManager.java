package org.yafcp.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Loads {@link AppConfig} from YAML. Lookup order: explicit path, {@code conf/config.yaml}, classpath
 * {@code config.yaml}.
 */
public class ConfigManager {
    private static final Logger LOGGER = Logger.getLogger(ConfigManager.class.getName());

    public static final Path DEFAULT_CONFIG_PATH = Path.of("conf", "config.yaml");
    public static final String CLASSPATH_CONFIG = "config.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ConfigManager() {
    }

    public static AppConfig getConfig() throws IOException {
        return getConfig(null);
    }

    public static AppConfig getConfig(Path explicitPath) throws IOException {
        AppConfig appConfig;
        if (explicitPath != null) {
            if (!Files.isRegularFile(explicitPath)) {
                throw new FileNotFoundException("Config file not found: " + explicitPath.toAbsolutePath());
            }
            LOGGER.info("Loading config from: " + explicitPath.toAbsolutePath());
            appConfig = read(explicitPath);
        } else if (Files.isRegularFile(DEFAULT_CONFIG_PATH)) {
            LOGGER.info("Loading config from: " + DEFAULT_CONFIG_PATH.toAbsolutePath());
            appConfig = read(DEFAULT_CONFIG_PATH);
        } else {
            LOGGER.info("Loading config from classpath resource: " + CLASSPATH_CONFIG);
            appConfig = readClasspath(CLASSPATH_CONFIG);
        }
        return validate(appConfig);
    }

    static AppConfig read(Path path) throws IOException {
        AppConfig config = YAML_MAPPER.readValue(path.toFile(), AppConfig.class);
        return config != null ? config : new AppConfig(null, null, null);
    }

    static AppConfig readClasspath(String resource) throws IOException {
        try (InputStream in = ConfigManager.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new FileNotFoundException("Classpath config not found: " + resource);
            AppConfig config = YAML_MAPPER.readValue(in, AppConfig.class);
            return config != null ? config : new AppConfig(null, null, null);
        }
    }

    /**
     * Rejects configurations the pipeline cannot run with.
     *
     * @throws IllegalArgumentException describing the first offending field
     */
    public static AppConfig validate(AppConfig config) {
        PipelineConfig pipeline = config.pipeline();
        if (pipeline.workerCount() < 1)
            throw new IllegalArgumentException("pipeline.workerCount must be >= 1, was " + pipeline.workerCount());
        if (pipeline.fetchTimeoutMillis() <= 0)
            throw new IllegalArgumentException("pipeline.fetchTimeoutMillis must be > 0, was " + pipeline.fetchTimeoutMillis());
        if (pipeline.processingDelayMillis() < 0)
            throw new IllegalArgumentException("pipeline.processingDelayMillis must be >= 0, was " + pipeline.processingDelayMillis());

        ParsingOptions parsing = config.parsing();
        if (!Charset.isSupported(parsing.encoding()))
            throw new IllegalArgumentException("parsing.encoding is not supported: " + parsing.encoding());
        if (parsing.delimiter().length() != 1)
            throw new IllegalArgumentException("parsing.delimiter must be a single character, was '" + parsing.delimiter() + "'");

        for (int i = 0; i < config.locators().size(); i++) {
            String locator = config.locators().get(i);
            if (locator == null || locator.isBlank())
                throw new IllegalArgumentException("locators[" + i + "] is blank");
        }
        return config;
    }
}
