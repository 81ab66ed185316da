package net.spookly.gsdk.protocol;

import java.util.List;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Snapshot of the local state sent with one heartbeat.
 */
@Getter
@Accessors(fluent = true)
public final class HeartbeatRequest {
    private final GameState currentState;
    private final boolean healthy;
    private final List<ConnectedPlayer> players;

    public HeartbeatRequest(GameState currentState, boolean healthy, List<ConnectedPlayer> players) {
        this.currentState = currentState == null ? GameState.INVALID : currentState;
        this.healthy = healthy;
        this.players = players == null ? List.of() : List.copyOf(players);
    }
}
