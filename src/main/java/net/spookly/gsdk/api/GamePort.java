package net.spookly.gsdk.api;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Port mapping between the server listener and what clients connect to.
 */
@Value
@Accessors(fluent = true)
public class GamePort {
    String name;
    int serverListeningPort;
    int clientConnectionPort;
}
