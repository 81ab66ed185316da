package net.spookly.gsdk.api;

import java.util.List;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Public address and ports clients use to reach this server.
 */
@Getter
@Accessors(fluent = true)
public final class GameServerConnectionInfo {
    private static final GameServerConnectionInfo EMPTY = new GameServerConnectionInfo("", List.of());

    private final String publicIpV4Address;
    private final List<GamePort> gamePorts;

    public GameServerConnectionInfo(String publicIpV4Address, List<GamePort> gamePorts) {
        this.publicIpV4Address = publicIpV4Address == null ? "" : publicIpV4Address;
        this.gamePorts = gamePorts == null ? List.of() : List.copyOf(gamePorts);
    }

    public static GameServerConnectionInfo empty() {
        return EMPTY;
    }
}
