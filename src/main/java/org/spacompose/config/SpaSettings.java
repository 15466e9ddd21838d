package org.spacompose.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.spacompose.params.IErrorReportingPolicy;
import org.spacompose.params.ParamDefaults;

import java.io.File;
import java.util.HashMap;
import java.util.Map;

/**
 * Settings read from the {@code spa} configuration block.
 *
 * @param simplifiedExceptions Whether field validation failures are reported without their cause chain.
 * @param moduleDefaults       Raw default values for module parameters, keyed by parameter name.
 */
public record SpaSettings(boolean simplifiedExceptions, Map<String, Object> moduleDefaults) {

    private static final String ROOT = "spa";

    private static SpaSettings defaults;

    public SpaSettings {
        moduleDefaults = Map.copyOf(moduleDefaults);
    }

    /**
     * Reads the settings from a resolved configuration.
     *
     * @param config A configuration containing the {@code spa} block.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException.Missing if the {@code spa} block is absent.
     */
    public static SpaSettings fromConfig(Config config) {
        Config spa = config.getConfig(ROOT);
        Map<String, Object> values = new HashMap<>();
        if (spa.hasPath("module")) {
            for (Map.Entry<String, ConfigValue> entry : spa.getConfig("module").entrySet()) {
                values.put(entry.getKey(), entry.getValue().unwrapped());
            }
        }
        return new SpaSettings(spa.getBoolean("exceptions.simplified"), values);
    }

    /**
     * Reads the settings with {@code overrideFile} layered over {@code reference.conf}.
     *
     * @param overrideFile The override file, or {@code null} to discover one.
     * @return The settings.
     * @see ConfigLoader#load(File)
     */
    public static SpaSettings load(File overrideFile) {
        return fromConfig(ConfigLoader.load(overrideFile));
    }

    /**
     * @return Settings from the discovered configuration, loaded once per class loader.
     */
    public static synchronized SpaSettings defaults() {
        if (defaults == null) {
            defaults = load(null);
        }
        return defaults;
    }

    /**
     * @return A fresh {@link ParamDefaults} seeded with {@link #moduleDefaults()}.
     */
    public ParamDefaults paramDefaults() {
        return new ParamDefaults(moduleDefaults);
    }

    public IErrorReportingPolicy errorReportingPolicy() {
        return IErrorReportingPolicy.of(simplifiedExceptions);
    }
}
