package net.spookly.gsdk.protocol;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Fully decoded heartbeat response. Absent fields mean "no update".
 */
@Getter
@Accessors(fluent = true)
public final class HeartbeatResponse {
    /**
     * String entries from the session config and its metadata object; null when the response had no session config.
     */
    private final Map<String, String> sessionConfig;
    /**
     * Players the session was allocated with; null when not present.
     */
    private final List<String> initialPlayers;
    /**
     * Parsed maintenance time; null when not present.
     */
    private final Instant nextScheduledMaintenance;
    /**
     * Decoded operation; null when the response carried none.
     */
    private final Operation operation;
    /**
     * Operation name exactly as received, kept for logging unknown values.
     */
    private final String rawOperation;

    public HeartbeatResponse(Map<String, String> sessionConfig,
                             List<String> initialPlayers,
                             Instant nextScheduledMaintenance,
                             String rawOperation) {
        this.sessionConfig = sessionConfig == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(sessionConfig));
        this.initialPlayers = initialPlayers == null ? null : List.copyOf(initialPlayers);
        this.nextScheduledMaintenance = nextScheduledMaintenance;
        this.rawOperation = rawOperation;
        this.operation = rawOperation == null ? null : Operation.fromWireName(rawOperation);
    }

    public static HeartbeatResponse empty() {
        return new HeartbeatResponse(null, null, null, null);
    }
}
