package org.edgeweave.config;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;

/**
 * Loads the HOCON configuration of a test run.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dedgeweave.tester.reset-port=rst})</li>
 *   <li>Environment variables</li>
 *   <li>User configuration file, see {@link #locate(File)}</li>
 *   <li>Defaults ({@code reference.conf} on the classpath)</li>
 * </ol>
 * Substitutions are resolved only after all layers are composed, so an override of a value that
 * other settings reference propagates to all of them.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** System property naming the user configuration file. */
    public static final String CONFIG_FILE_PROPERTY = "config.file";

    /** User configuration file looked up relative to the working directory. */
    public static final File DEFAULT_CONFIG_FILE = new File("config", "edgeweave.conf");

    private ConfigLoader() {
    }

    /**
     * Loads the configuration, using the user file chosen by {@link #locate(File)} if there is one.
     *
     * @param explicitConfigFile config file chosen by the caller, or {@code null} for discovery.
     * @return the fully resolved {@link Config}.
     * @throws IllegalArgumentException            if a named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config load(File explicitConfigFile) {
        File userFile = locate(explicitConfigFile);
        if (userFile == null) {
            LOG.debug("No {} found, using reference.conf defaults", DEFAULT_CONFIG_FILE.getPath());
            return compose(ConfigFactory.empty());
        }
        LOG.info("Loading tester configuration from {}", userFile.getAbsolutePath());
        return compose(ConfigFactory.parseFile(userFile, ConfigParseOptions.defaults().setAllowMissing(false)));
    }

    /**
     * Picks the user configuration file: the explicit file if given, else the file named by
     * {@code -Dconfig.file}, else {@code config/edgeweave.conf} if it exists.
     *
     * @param explicitConfigFile config file chosen by the caller, or {@code null}.
     * @return the file to load, or {@code null} to use defaults only.
     * @throws IllegalArgumentException if the explicit or the property-named file does not exist.
     */
    static File locate(File explicitConfigFile) {
        if (explicitConfigFile != null) {
            return requireExisting(explicitConfigFile, "Configuration file not found: ");
        }
        String property = System.getProperty(CONFIG_FILE_PROPERTY);
        if (property != null && !property.isBlank()) {
            return requireExisting(new File(property).getAbsoluteFile(),
                    "Configuration file specified via -D" + CONFIG_FILE_PROPERTY + " not found: ");
        }
        return DEFAULT_CONFIG_FILE.isFile() ? DEFAULT_CONFIG_FILE : null;
    }

    private static File requireExisting(File file, String message) {
        if (!file.isFile()) {
            throw new IllegalArgumentException(message + file.getAbsolutePath());
        }
        return file;
    }

    /**
     * Stacks system properties and environment over the user layer and {@code reference.conf},
     * then resolves.
     *
     * @param userConfig the parsed user file, or an empty config.
     * @return the fully resolved {@link Config}.
     */
    static Config compose(Config userConfig) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(userConfig)
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
