package net.spookly.gsdk.config;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Picks the configuration source for a process: the file named by {@code GSDK_CONFIG_FILE} when it exists, the
 * environment otherwise.
 */
public final class ConfigurationSources {
    public static final String CONFIG_FILE_ENV = "GSDK_CONFIG_FILE";

    private ConfigurationSources() {
    }

    public static ConfigurationSource resolve() {
        return resolve(System.getenv());
    }

    public static ConfigurationSource resolve(Map<String, String> env) {
        Path configFile = configFile(env);
        if (configFile != null && Files.isRegularFile(configFile)) {
            return FileConfigurationSource.load(configFile);
        }
        return new EnvironmentConfigurationSource(env);
    }

    private static Path configFile(Map<String, String> env) {
        String raw = env == null ? null : env.get(CONFIG_FILE_ENV);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Paths.get(raw.trim());
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid " + CONFIG_FILE_ENV + " value: " + raw, e);
        }
    }
}
