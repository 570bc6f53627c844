package org.gamma.imgbatch.config;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class ConfigManager {
    private static final Logger APP_LOGGER = Logger.getLogger(ConfigManager.class.getName());
    public static final Path DEFAULT_CONFIG_PATH = Path.of("conf", "config.yaml");

    static {
        System.setProperty("java.util.logging.SimpleFormatter.format", "[%1$tF %1$tT] [%4$-7s] %3$s - %5$s %6$s%n");
    }

    /**
     * Installs the console handler used by the command line runner.
     */
    public static void configureLogging(Level level) {
        ConsoleHandler handler = new ConsoleHandler();
        handler.setFormatter(new SimpleFormatter());
        handler.setLevel(Level.ALL);
        Logger rootLogger = Logger.getLogger("");
        for (java.util.logging.Handler h : rootLogger.getHandlers()) {
            rootLogger.removeHandler(h);
        }
        rootLogger.addHandler(handler);
        rootLogger.setLevel(level);
    }

    /**
     * Reads and validates a YAML configuration file.
     *
     * @throws IOException            when the file cannot be read
     * @throws ConfigurationException when the content cannot be bound or a job is invalid
     */
    public static AppConfig load(Path configPath) throws IOException, ConfigurationException {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigurationException("Couldn't find configuration file at " + configPath);
        }
        AppConfig config;
        try {
            config = newObjectMapper().readValue(configPath.toFile(), AppConfig.class);
        } catch (JacksonException e) {
            throw new ConfigurationException("Couldn't load configuration file " + configPath + ": " + e.getOriginalMessage(), e);
        }
        if (config == null || config.batchJobs() == null) {
            config = new AppConfig(List.of());
        }
        APP_LOGGER.log(Level.INFO, "Loaded {0} batch job(s) from {1}", new Object[]{config.batchJobs().size(), configPath});
        for (BatchJobItem job : config.batchJobs()) {
            APP_LOGGER.log(Level.CONFIG, "Job {0}: {1}", new Object[]{job.displayName(), job});
        }
        return config;
    }

    static ObjectMapper newObjectMapper() {
        return YAMLMapper.builder()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS, true)
                .build();
    }
}
