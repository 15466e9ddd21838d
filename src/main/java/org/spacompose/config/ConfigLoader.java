package org.spacompose.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Optional;

/**
 * Loads the HOCON configuration that controls module defaults and error reporting.
 * <p>
 * Layers, highest precedence first: system properties ({@code -Dspa.module.synapse=0.05}),
 * environment variables, one override file, {@code reference.conf}. The override file is the
 * first of:
 * <ol>
 *   <li>the file passed to {@link #load(File)}</li>
 *   <li>the file named by {@code -Dconfig.file}</li>
 *   <li>{@code config/spa.conf} relative to the working directory</li>
 * </ol>
 * Substitutions are resolved after the layers are composed, so overrides of values referenced
 * from {@code reference.conf} propagate.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    static final String FILE_PROPERTY = "config.file";
    static final File WORKING_DIRECTORY_FILE = new File("config", "spa.conf");

    private ConfigLoader() {
    }

    /**
     * Loads the configuration, discovering the override file.
     *
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the configuration with {@code overrideFile} as the override layer.
     *
     * @param overrideFile The override file, or {@code null} to discover one.
     * @return The resolved configuration.
     * @throws IllegalArgumentException            if the given file, or the one named by
     *                                             {@code -Dconfig.file}, does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config load(File overrideFile) {
        Config overrides = locate(overrideFile, System.getProperty(FILE_PROPERTY), WORKING_DIRECTORY_FILE)
                .map(ConfigFactory::parseFile)
                .orElseGet(ConfigFactory::empty);
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(overrides)
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * Picks the override file.
     *
     * @param overrideFile         The caller's file, or {@code null}.
     * @param propertyPath         The value of {@code -Dconfig.file}, or {@code null}.
     * @param workingDirectoryFile The file looked for when neither is given.
     * @return The override file, or empty to use {@code reference.conf} alone.
     */
    static Optional<File> locate(File overrideFile, String propertyPath, File workingDirectoryFile) {
        if (overrideFile != null) {
            return Optional.of(requireExisting(overrideFile, "Configuration file"));
        }
        if (propertyPath != null && !propertyPath.isBlank()) {
            return Optional.of(requireExisting(new File(propertyPath).getAbsoluteFile(),
                    "Configuration file given by -D" + FILE_PROPERTY));
        }
        if (workingDirectoryFile.isFile()) {
            LOG.info("Using configuration file {}", workingDirectoryFile.getAbsolutePath());
            return Optional.of(workingDirectoryFile);
        }
        LOG.debug("No {} in the working directory, using reference configuration", workingDirectoryFile);
        return Optional.empty();
    }

    private static File requireExisting(File file, String description) {
        if (!file.isFile()) {
            throw new IllegalArgumentException(description + " not found: " + file.getAbsolutePath());
        }
        LOG.info("Using configuration file {}", file.getAbsolutePath());
        return file;
    }
}
