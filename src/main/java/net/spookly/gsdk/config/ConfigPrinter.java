package net.spookly.gsdk.config;

import java.util.Map;
import java.util.TreeMap;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Renders the startup settings for the agent banner.
 */
public final class ConfigPrinter {
    private ConfigPrinter() {
    }

    public static String toYaml(Map<String, String> settings) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Yaml yaml = new Yaml(options);
        return yaml.dump(settings == null ? Map.of() : new TreeMap<>(settings));
    }
}
