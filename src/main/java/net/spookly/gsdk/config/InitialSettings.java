package net.spookly.gsdk.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattens a configuration source into the static part of the config settings map.
 */
public final class InitialSettings {
    private InitialSettings() {
    }

    /**
     * Certificates, then build metadata, then ports, then the fixed keys; later entries win.
     */
    public static Map<String, String> from(ConfigurationSource source) {
        if (source == null) {
            throw new ConfigException("Configuration source is required");
        }
        Map<String, String> settings = new LinkedHashMap<>();
        putAll(settings, source.gameCertificates());
        putAll(settings, source.buildMetadata());
        putAll(settings, source.gamePorts());
        settings.put(ConfigKeys.HEARTBEAT_ENDPOINT, nullToEmpty(source.heartbeatEndpoint()));
        settings.put(ConfigKeys.SERVER_ID, nullToEmpty(source.serverId()));
        settings.put(ConfigKeys.LOG_FOLDER, nullToEmpty(source.logFolder()));
        settings.put(ConfigKeys.SHARED_CONTENT_FOLDER, nullToEmpty(source.sharedContentFolder()));
        settings.put(ConfigKeys.CERTIFICATE_FOLDER, nullToEmpty(source.certificateFolder()));
        settings.put(ConfigKeys.TITLE_ID, nullToEmpty(source.titleId()));
        settings.put(ConfigKeys.BUILD_ID, nullToEmpty(source.buildId()));
        settings.put(ConfigKeys.REGION, nullToEmpty(source.region()));
        settings.put(ConfigKeys.PUBLIC_IP_V4_ADDRESS, nullToEmpty(source.publicIpV4Address()));
        settings.put(ConfigKeys.FULLY_QUALIFIED_DOMAIN_NAME, nullToEmpty(source.fullyQualifiedDomainName()));
        return settings;
    }

    private static void putAll(Map<String, String> target, Map<String, String> values) {
        if (values == null) {
            return;
        }
        for (Map.Entry<String, String> entry : values.entrySet()) {
            if (entry.getKey() != null) {
                target.put(entry.getKey(), nullToEmpty(entry.getValue()));
            }
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
