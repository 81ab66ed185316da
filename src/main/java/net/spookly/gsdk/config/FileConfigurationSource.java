package net.spookly.gsdk.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.spookly.gsdk.api.GamePort;
import net.spookly.gsdk.api.GameServerConnectionInfo;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads settings from a JSON or YAML file.
 */
public final class FileConfigurationSource implements ConfigurationSource {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path path;
    private final AgentConfigFile config;

    private FileConfigurationSource(Path path, AgentConfigFile config) {
        this.path = path;
        this.config = config;
    }

    /**
     * Load and bind the config file.
     */
    public static FileConfigurationSource load(Path path) {
        if (path == null) {
            throw new ConfigException("Config path is required");
        }
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Config file not found: " + path);
        }
        Object raw;
        Yaml yaml = new Yaml();
        try (Reader reader = Files.newBufferedReader(path)) {
            raw = yaml.load(reader);
        } catch (IOException | YAMLException e) {
            throw new ConfigException("Failed to read config: " + path, e);
        }
        if (raw == null) {
            throw new ConfigException("Config file is empty: " + path);
        }
        AgentConfigFile config;
        try {
            config = MAPPER.convertValue(raw, AgentConfigFile.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Failed to parse config: " + path, e);
        }
        return new FileConfigurationSource(path, config);
    }

    @Override
    public Map<String, String> gameCertificates() {
        return copy(config.gameCertificates);
    }

    @Override
    public Map<String, String> buildMetadata() {
        return copy(config.buildMetadata);
    }

    @Override
    public Map<String, String> gamePorts() {
        return copy(config.gamePorts);
    }

    @Override
    public String heartbeatEndpoint() {
        return config.heartbeatEndpoint;
    }

    @Override
    public String serverId() {
        return config.sessionHostId;
    }

    @Override
    public String logFolder() {
        return config.logFolder;
    }

    @Override
    public String sharedContentFolder() {
        return config.sharedContentFolder;
    }

    @Override
    public String certificateFolder() {
        return config.certificateFolder;
    }

    @Override
    public String titleId() {
        return config.titleId;
    }

    @Override
    public String buildId() {
        return config.buildId;
    }

    @Override
    public String region() {
        return config.region;
    }

    @Override
    public String publicIpV4Address() {
        return config.publicIpV4Address;
    }

    @Override
    public String fullyQualifiedDomainName() {
        return config.fullyQualifiedDomainName;
    }

    @Override
    public GameServerConnectionInfo gameServerConnectionInfo() {
        AgentConfigFile.ConnectionInfoConfig info = config.gameServerConnectionInfo;
        if (info == null) {
            return GameServerConnectionInfo.empty();
        }
        List<GamePort> ports = new ArrayList<>();
        if (info.gamePortsConfiguration != null) {
            for (AgentConfigFile.GamePortConfig port : info.gamePortsConfiguration) {
                if (port == null) {
                    continue;
                }
                ports.add(new GamePort(
                        port.name,
                        port.serverListeningPort == null ? 0 : port.serverListeningPort,
                        port.clientConnectionPort == null ? 0 : port.clientConnectionPort
                ));
            }
        }
        return new GameServerConnectionInfo(info.publicIpV4Address, ports);
    }

    @Override
    public String describe() {
        return path.toString();
    }

    // Blank YAML entries bind as null values and are dropped.
    private static Map<String, String> copy(Map<String, String> values) {
        if (values == null) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : values.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        return Collections.unmodifiableMap(copy);
    }
}
