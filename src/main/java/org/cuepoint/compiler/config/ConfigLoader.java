package org.cuepoint.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the compiler configuration (HOCON).
 * <p>
 * Sources, highest precedence first:
 * <ol>
 *   <li>environment variables</li>
 *   <li>JVM system properties ({@code -Dcompiler.emitter.pretty-print=false})</li>
 *   <li>the configuration file, {@code cuepoint.conf} unless {@code -Dcuepoint.config} names another</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    static final String CONFIG_FILE_NAME = "cuepoint.conf";
    static final String CONFIG_FILE_PROPERTY = "cuepoint.config";

    private ConfigLoader() {
    }

    /**
     * @return The merged, resolved configuration.
     */
    public static Config load() {
        return load(new File(System.getProperty(CONFIG_FILE_PROPERTY, CONFIG_FILE_NAME)));
    }

    /**
     * @param configFile The configuration file; a missing file or a directory is skipped.
     * @return The merged, resolved configuration.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Reading compiler configuration {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("No configuration file at {}, using defaults and overrides only", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        return ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }
}
