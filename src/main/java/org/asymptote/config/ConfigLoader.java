package org.asymptote.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration.
 * <p>
 * Load order, highest precedence first: environment variables, system properties, the configuration
 * file, {@code reference.conf} on the classpath. The file is the one given explicitly, else
 * {@code asymptote.conf} in the working directory when it exists.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String CONFIG_FILE_NAME = "asymptote.conf";

    private ConfigLoader() {
    }

    /**
     * Loads the configuration with {@code asymptote.conf} from the working directory, if present.
     * @return The resolved configuration.
     */
    public static Config load() {
        File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.isFile()) {
            LOG.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return load(cwdConfigFile);
        }
        LOG.debug("No '{}' in the current directory, using defaults from the classpath.", CONFIG_FILE_NAME);
        return ConfigFactory.systemEnvironment()
                .withFallback(ConfigFactory.systemProperties())
                .withFallback(ConfigFactory.load())
                .resolve();
    }

    /**
     * @param configFile A HOCON file.
     * @return The resolved configuration with the file layered over the classpath defaults.
     * @throws com.typesafe.config.ConfigException if the file is missing or malformed.
     */
    public static Config load(File configFile) {
        return ConfigFactory.systemEnvironment()
                .withFallback(ConfigFactory.systemProperties())
                .withFallback(ConfigFactory.parseFile(configFile, ConfigParseOptions.defaults().setAllowMissing(false)))
                .withFallback(ConfigFactory.load())
                .resolve();
    }

    /**
     * @return Only the classpath defaults, without any overrides.
     */
    public static Config defaults() {
        return ConfigFactory.defaultReference();
    }
}
