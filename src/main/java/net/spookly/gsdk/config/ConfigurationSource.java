package net.spookly.gsdk.config;

import java.util.Map;

import net.spookly.gsdk.api.GameServerConnectionInfo;

/**
 * Supplies the agent's startup settings. Read once while the agent starts, never afterwards.
 */
public interface ConfigurationSource {
    Map<String, String> gameCertificates();

    Map<String, String> buildMetadata();

    Map<String, String> gamePorts();

    String heartbeatEndpoint();

    String serverId();

    String logFolder();

    String sharedContentFolder();

    String certificateFolder();

    String titleId();

    String buildId();

    String region();

    String publicIpV4Address();

    String fullyQualifiedDomainName();

    GameServerConnectionInfo gameServerConnectionInfo();

    /**
     * Whether the agent writes its output log file.
     */
    default boolean shouldLog() {
        return true;
    }

    /**
     * Whether the agent sends heartbeats at all.
     */
    default boolean shouldHeartbeat() {
        return true;
    }

    /**
     * Human readable origin of these settings, printed in the startup banner.
     */
    default String describe() {
        return getClass().getSimpleName();
    }
}
