package net.spookly.gsdk.heartbeat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import net.spookly.gsdk.protocol.ConnectedPlayer;
import net.spookly.gsdk.protocol.GameState;
import net.spookly.gsdk.protocol.HeartbeatRequest;
import net.spookly.gsdk.protocol.HeartbeatResponse;
import org.junit.jupiter.api.Test;

class HeartbeatStateTest {
    @Test
    void startsInitializing() {
        assertEquals(GameState.INITIALIZING, new HeartbeatState().currentState());
    }

    @Test
    void signalsOncePerActualChange() throws InterruptedException {
        HeartbeatState state = new HeartbeatState();

        assertTrue(state.setState(GameState.STANDING_BY));
        assertFalse(state.setState(GameState.STANDING_BY));
        assertFalse(state.setState(GameState.STANDING_BY));
        assertTrue(state.setState(GameState.ACTIVE));

        assertEquals(GameState.ACTIVE, state.currentState());
        assertEquals(2, state.stateChangeSignals());
        assertTrue(state.awaitHeartbeatRequest(0, TimeUnit.MILLISECONDS));
        assertFalse(state.awaitHeartbeatRequest(0, TimeUnit.MILLISECONDS));
    }

    @Test
    void heartbeatWaitTimesOutWithoutSignal() throws InterruptedException {
        HeartbeatState state = new HeartbeatState();

        long started = System.nanoTime();
        assertFalse(state.awaitHeartbeatRequest(50, TimeUnit.MILLISECONDS));
        assertTrue(System.nanoTime() - started >= TimeUnit.MILLISECONDS.toNanos(40));
    }

    @Test
    void standingByIsNotReenteredOnceActive() {
        HeartbeatState state = new HeartbeatState();
        state.setState(GameState.ACTIVE);

        state.enterStandingBy();

        assertEquals(GameState.ACTIVE, state.currentState());
    }

    @Test
    void snapshotUsesLatestRosterAndHealth() {
        HeartbeatState state = new HeartbeatState();
        state.setConnectedPlayers(List.of(new ConnectedPlayer("a")));
        state.setConnectedPlayers(List.of(new ConnectedPlayer("b"), new ConnectedPlayer("c")));
        state.recordHealth(false);

        HeartbeatRequest request = state.snapshotRequest();

        assertEquals(List.of(new ConnectedPlayer("b"), new ConnectedPlayer("c")), request.players());
        assertFalse(request.healthy());
        assertEquals(GameState.INITIALIZING, request.currentState());
    }

    @Test
    void sessionConfigOverwritesStaticSettingsAndMergeIsIdempotent() {
        HeartbeatState state = new HeartbeatState(Map.of("region", "EastUs", "titleId", "T1"));
        HeartbeatResponse update = new HeartbeatResponse(Map.of("region", "WestEu", "sessionId", "s-1"), null, null, null);

        state.mergeResponse(update, false);
        Map<String, String> once = state.configSettings();
        state.mergeResponse(update, false);

        assertEquals(once, state.configSettings());
        assertEquals("WestEu", once.get("region"));
        assertEquals("s-1", once.get("sessionId"));
        assertEquals("T1", once.get("titleId"));
    }

    @Test
    void initialPlayersAreWrittenOnce() {
        HeartbeatState state = new HeartbeatState();

        state.mergeResponse(new HeartbeatResponse(Map.of(), List.of(), null, null), false);
        assertTrue(state.initialPlayers().isEmpty());

        state.mergeResponse(new HeartbeatResponse(Map.of(), List.of("p1", "p2"), null, null), false);
        state.mergeResponse(new HeartbeatResponse(Map.of(), List.of("p3"), null, null), false);

        assertEquals(List.of("p1", "p2"), state.initialPlayers());
    }

    @Test
    void maintenanceIsReportedOncePerDistinctTime() {
        HeartbeatState state = new HeartbeatState();
        Instant first = Instant.parse("2030-01-01T00:00:00Z");
        Instant second = Instant.parse("2030-01-02T00:00:00Z");

        assertEquals(first, state.mergeResponse(maintenance(first), true));
        assertNull(state.mergeResponse(maintenance(first), true));
        assertNull(state.mergeResponse(maintenance(first), true));
        assertEquals(second, state.mergeResponse(maintenance(second), true));
        assertNull(state.mergeResponse(maintenance(second), true));
    }

    @Test
    void maintenanceCacheWaitsForAListener() {
        HeartbeatState state = new HeartbeatState();
        Instant time = Instant.parse("2030-01-01T00:00:00Z");

        assertNull(state.mergeResponse(maintenance(time), false));
        assertNull(state.cachedMaintenance());
        assertEquals(time, state.mergeResponse(maintenance(time), true));
    }

    private static HeartbeatResponse maintenance(Instant time) {
        return new HeartbeatResponse(null, null, time, null);
    }
}
