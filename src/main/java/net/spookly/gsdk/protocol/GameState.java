package net.spookly.gsdk.protocol;

/**
 * Lifecycle states reported to the orchestrator in each heartbeat.
 */
public enum GameState {
    /** Sentinel for a state that could not be determined. */
    INVALID("Invalid"),
    /** Server process is starting and not yet ready for players. */
    INITIALIZING("Initializing"),
    /** Server is idle and waiting for an activation. */
    STANDING_BY("StandingBy"),
    /** Server has been allocated and is hosting a session. */
    ACTIVE("Active"),
    /** Server has been told to shut down. */
    TERMINATING("Terminating");

    private final String wireName;

    GameState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
