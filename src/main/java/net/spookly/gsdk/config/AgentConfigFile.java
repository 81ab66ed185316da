package net.spookly.gsdk.config;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Shape of the agent config file (JSON or YAML).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentConfigFile {
    public String heartbeatEndpoint;
    public String sessionHostId;
    public String logFolder;
    public String sharedContentFolder;
    public String certificateFolder;
    public String titleId;
    public String buildId;
    public String region;
    public String publicIpV4Address;
    public String fullyQualifiedDomainName;
    public Map<String, String> gameCertificates;
    public Map<String, String> buildMetadata;
    public Map<String, String> gamePorts;
    public ConnectionInfoConfig gameServerConnectionInfo;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConnectionInfoConfig {
        // The orchestrator has historically written this key misspelled.
        @JsonAlias("publicIpV4Adress")
        public String publicIpV4Address;
        public List<GamePortConfig> gamePortsConfiguration;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GamePortConfig {
        public String name;
        public Integer serverListeningPort;
        @JsonAlias("clientConnectingPort")
        public Integer clientConnectionPort;
    }
}
