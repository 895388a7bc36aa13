package com.github.tfilang;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ConfigReader {

    static final String DEFAULT_CONFIG_FILE = "tfi.cfg";

    static Config readConfig() {
        return readConfig(Path.of(DEFAULT_CONFIG_FILE));
    }

    /**
     * Reads the given properties file. A file that does not exist yields the
     * defaults.
     */
    static Config readConfig(Path file) {
        var config = new Config();
        if (!Files.exists(file)) {
            log.debug("no configuration at {}, using defaults", file);
            return config;
        }

        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read configuration " + file, e);
        }

        config.formatOutput = flag(properties, "formatOutput");
        config.addComments = flag(properties, "addComments");
        config.minifyOutput = flag(properties, "minifyOutput");
        config.strictMode = flag(properties, "strictMode");
        log.debug("read configuration {} from {}", config, file);
        return config;
    }

    private static boolean flag(Properties properties, String key) {
        return Boolean.parseBoolean(properties.getProperty(key, "false").trim());
    }

    @ToString
    static class Config {
        boolean formatOutput;
        boolean addComments;
        boolean minifyOutput;
        boolean strictMode;

        public void applyConfig(ConfigTarget ct) {
            ct.setOptions(new CompilationOptions()
                    .formatOutput(formatOutput)
                    .addComments(addComments)
                    .minifyOutput(minifyOutput)
                    .strictMode(strictMode));
        }
    }

    interface ConfigTarget {
        void setOptions(CompilationOptions options);
    }

}
