package net.spookly.gsdk;

import java.time.Duration;
import java.util.Objects;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Runtime tuning for the agent that does not come from the configuration source.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AgentOptions {
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Longest wait between two heartbeats.
     */
    private final Duration heartbeatInterval;
    /**
     * Connect and response timeout for one heartbeat exchange.
     */
    private final Duration requestTimeout;
    /**
     * Write early wake-ups and state/operation pairs to the agent log file.
     */
    private final boolean debug;

    public static AgentOptions defaults() {
        return new AgentOptions(DEFAULT_HEARTBEAT_INTERVAL, DEFAULT_REQUEST_TIMEOUT, false);
    }

    public AgentOptions withHeartbeatInterval(Duration heartbeatInterval) {
        return new AgentOptions(Objects.requireNonNull(heartbeatInterval, "heartbeatInterval"), requestTimeout, debug);
    }

    public AgentOptions withRequestTimeout(Duration requestTimeout) {
        return new AgentOptions(heartbeatInterval, Objects.requireNonNull(requestTimeout, "requestTimeout"), debug);
    }

    public AgentOptions withDebug(boolean debug) {
        return new AgentOptions(heartbeatInterval, requestTimeout, debug);
    }
}
