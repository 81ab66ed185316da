package net.spookly.gsdk.protocol;

import lombok.NonNull;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Player currently connected to the game server.
 */
@Value
@Accessors(fluent = true)
public class ConnectedPlayer {
    @NonNull
    String playerId;
}
