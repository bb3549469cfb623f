package org.docsmith.config;

import com.typesafe.config.Config;

import java.util.Set;

/**
 * Typed view of the {@code docsmith.handlers} configuration block.
 *
 * @param loadOrderErrors Whether unresolved forward references are checked and reported.
 * @param maxRetries      How often a missing reference is retried before giving up.
 * @param builtins        Paths of well-known objects that are never reported as missing.
 */
public record HandlerSettings(
        boolean loadOrderErrors,
        int maxRetries,
        Set<String> builtins
) {

    /** Root path of the handler settings. */
    public static final String PATH = "docsmith.handlers";

    public HandlerSettings {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        builtins = Set.copyOf(builtins);
    }

    /**
     * Reads the settings from a loaded configuration.
     * @param config The root configuration.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a setting is missing or has the wrong type.
     */
    public static HandlerSettings fromConfig(Config config) {
        Config handlers = config.getConfig(PATH);
        return new HandlerSettings(
                handlers.getBoolean("load-order-errors"),
                handlers.getInt("load-order.max-retries"),
                Set.copyOf(handlers.getStringList("builtins")));
    }

    /**
     * @return The defaults from {@code reference.conf}.
     */
    public static HandlerSettings defaults() {
        return fromConfig(ConfigLoader.load());
    }

    /**
     * @param path A path.
     * @return {@code true} if the path names a well-known built-in.
     */
    public boolean isBuiltin(String path) {
        return builtins.contains(path);
    }
}
