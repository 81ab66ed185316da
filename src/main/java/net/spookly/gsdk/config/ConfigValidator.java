package net.spookly.gsdk.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate the initial settings, throwing ConfigException on any violations.
     */
    public static void validate(Map<String, String> settings) {
        List<String> errors = new ArrayList<>();
        if (settings == null) {
            errors.add("config settings are required");
            throwIfErrors(errors);
            return;
        }
        requireNonBlank(errors, settings.get(ConfigKeys.HEARTBEAT_ENDPOINT), "heartbeat endpoint");
        requireNonBlank(errors, settings.get(ConfigKeys.SERVER_ID), "server id");
        String endpoint = settings.get(ConfigKeys.HEARTBEAT_ENDPOINT);
        String serverId = settings.get(ConfigKeys.SERVER_ID);
        if (!isBlank(endpoint) && endpoint.contains("://")) {
            errors.add("heartbeat endpoint must be host[:port] without a scheme");
        } else if (!isBlank(endpoint) && !isBlank(serverId)) {
            validateHeartbeatUrl(errors, endpoint.trim(), serverId.trim());
        }
        throwIfErrors(errors);
    }

    // Mirrors the url the heartbeat transport builds, so a bad value fails here instead of on the first tick.
    private static void validateHeartbeatUrl(List<String> errors, String endpoint, String serverId) {
        URI uri;
        try {
            uri = new URI("http://" + endpoint + "/v1/sessionHosts/" + serverId);
        } catch (URISyntaxException e) {
            errors.add("heartbeat endpoint and server id must form a valid url: " + e.getMessage());
            return;
        }
        if (uri.getHost() == null) {
            errors.add("heartbeat endpoint must be host[:port]: " + endpoint);
            return;
        }
        int port = uri.getPort();
        if (port != -1 && (port < 1 || port > 65535)) {
            errors.add("heartbeat endpoint port must be between 1 and 65535: " + endpoint);
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String label) {
        if (isBlank(value)) {
            errors.add(label + " is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            throw new ConfigException("Invalid agent config: " + String.join("; ", errors));
        }
    }
}
