package net.spookly.gsdk.config;

import java.util.Map;

import net.spookly.gsdk.api.GameServerConnectionInfo;

/**
 * Reads settings from process environment variables.
 */
public final class EnvironmentConfigurationSource implements ConfigurationSource {
    static final String HEARTBEAT_ENDPOINT = "HEARTBEAT_ENDPOINT";
    static final String SESSION_HOST_ID = "SESSION_HOST_ID";
    static final String LOG_FOLDER = "GSDK_LOG_FOLDER";
    static final String SHARED_CONTENT_FOLDER = "SHARED_CONTENT_FOLDER";
    static final String CERTIFICATE_FOLDER = "CERTIFICATE_FOLDER";
    static final String TITLE_ID = "PF_TITLE_ID";
    static final String BUILD_ID = "PF_BUILD_ID";
    static final String REGION = "PF_REGION";
    static final String PUBLIC_IPV4_ADDRESS = "PUBLIC_IPV4_ADDRESS";
    static final String FULLY_QUALIFIED_DOMAIN_NAME = "FULLY_QUALIFIED_DOMAIN_NAME";

    private final Map<String, String> env;

    public EnvironmentConfigurationSource() {
        this(System.getenv());
    }

    public EnvironmentConfigurationSource(Map<String, String> env) {
        this.env = env == null ? Map.of() : env;
    }

    // Certificates, metadata and ports are only delivered through the config file.
    @Override
    public Map<String, String> gameCertificates() {
        return Map.of();
    }

    @Override
    public Map<String, String> buildMetadata() {
        return Map.of();
    }

    @Override
    public Map<String, String> gamePorts() {
        return Map.of();
    }

    @Override
    public String heartbeatEndpoint() {
        return get(HEARTBEAT_ENDPOINT);
    }

    @Override
    public String serverId() {
        return get(SESSION_HOST_ID);
    }

    @Override
    public String logFolder() {
        return get(LOG_FOLDER);
    }

    @Override
    public String sharedContentFolder() {
        return get(SHARED_CONTENT_FOLDER);
    }

    @Override
    public String certificateFolder() {
        return get(CERTIFICATE_FOLDER);
    }

    @Override
    public String titleId() {
        return get(TITLE_ID);
    }

    @Override
    public String buildId() {
        return get(BUILD_ID);
    }

    @Override
    public String region() {
        return get(REGION);
    }

    @Override
    public String publicIpV4Address() {
        return get(PUBLIC_IPV4_ADDRESS);
    }

    @Override
    public String fullyQualifiedDomainName() {
        return get(FULLY_QUALIFIED_DOMAIN_NAME);
    }

    @Override
    public GameServerConnectionInfo gameServerConnectionInfo() {
        return GameServerConnectionInfo.empty();
    }

    @Override
    public String describe() {
        return "environment";
    }

    private String get(String key) {
        String value = env.get(key);
        return value == null ? "" : value;
    }
}
