package net.spookly.gsdk.heartbeat;

import java.io.IOException;

/**
 * Sends one encoded heartbeat and returns the orchestrator's reply. Only the heartbeat thread calls it.
 */
public interface HeartbeatTransport extends AutoCloseable {
    TransportResponse send(String requestBody) throws IOException, InterruptedException;

    @Override
    default void close() {
    }
}
