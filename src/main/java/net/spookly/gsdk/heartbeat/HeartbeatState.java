package net.spookly.gsdk.heartbeat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import net.spookly.gsdk.protocol.ConnectedPlayer;
import net.spookly.gsdk.protocol.GameState;
import net.spookly.gsdk.protocol.HeartbeatRequest;
import net.spookly.gsdk.protocol.HeartbeatResponse;
import net.spookly.gsdk.protocol.MaintenanceTimes;

/**
 * Mutable state shared between the hosting game, the heartbeat thread and the shutdown thread.
 *
 * <p>Three independent locks guard it: the state lock (game state, health, heartbeat wake-up and activation
 * signals), the players lock (connected roster) and the config lock (config settings, initial players and the
 * maintenance cache). No method holds more than one of them at a time.
 */
public final class HeartbeatState {
    private final ReentrantLock stateLock = new ReentrantLock();
    private final Condition heartbeatRequested = stateLock.newCondition();
    private final Condition activationChanged = stateLock.newCondition();
    private final Object playersLock = new Object();
    private final Object configLock = new Object();

    // Guarded by stateLock.
    private GameState currentState = GameState.INITIALIZING;
    private boolean healthy = true;
    private boolean heartbeatPending;
    private boolean activationReleased;
    private long stateChangeSignals;

    // Guarded by playersLock.
    private List<ConnectedPlayer> connectedPlayers = List.of();

    // Guarded by configLock.
    private final Map<String, String> configSettings = new LinkedHashMap<>();
    private List<String> initialPlayers = List.of();
    private Instant cachedMaintenance;

    public HeartbeatState() {
        this(Map.of());
    }

    public HeartbeatState(Map<String, String> initialSettings) {
        if (initialSettings != null) {
            configSettings.putAll(initialSettings);
        }
    }

    public GameState currentState() {
        stateLock.lock();
        try {
            return currentState;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Set the game state and wake the heartbeat thread when the value actually changed.
     *
     * @return whether the state changed
     */
    public boolean setState(GameState state) {
        return transitionTo(state, false);
    }

    /**
     * Move to {@code target}; a no-op when already there. When {@code releaseActivation} is set, threads blocked in
     * {@link #awaitActivation()} are released along with the change.
     */
    boolean transitionTo(GameState target, boolean releaseActivation) {
        if (target == null) {
            throw new IllegalArgumentException("state is required");
        }
        stateLock.lock();
        try {
            if (currentState == target) {
                return false;
            }
            currentState = target;
            stateChangeSignals++;
            requestHeartbeatLocked();
            if (releaseActivation) {
                activationReleased = true;
                activationChanged.signalAll();
            }
            return true;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Enter StandingBy unless the server has already been activated or told to terminate.
     */
    public void enterStandingBy() {
        stateLock.lock();
        try {
            if (currentState == GameState.ACTIVE || currentState == GameState.TERMINATING) {
                return;
            }
            if (currentState != GameState.STANDING_BY) {
                currentState = GameState.STANDING_BY;
                stateChangeSignals++;
                requestHeartbeatLocked();
            }
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Block until an activation or termination releases waiters, then report whether the server is active.
     */
    public boolean awaitActivation() throws InterruptedException {
        stateLock.lock();
        try {
            while (!activationReleased) {
                activationChanged.await();
            }
            return currentState == GameState.ACTIVE;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Release activation waiters without changing state. Used during teardown.
     */
    public void releaseActivationWaiters() {
        stateLock.lock();
        try {
            activationReleased = true;
            activationChanged.signalAll();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Ask the heartbeat thread to wake early. Signals while one is already pending collapse into it.
     */
    void requestHeartbeat() {
        stateLock.lock();
        try {
            requestHeartbeatLocked();
        } finally {
            stateLock.unlock();
        }
    }

    private void requestHeartbeatLocked() {
        heartbeatPending = true;
        heartbeatRequested.signalAll();
    }

    /**
     * Wait up to {@code timeout} for a heartbeat request and consume it.
     *
     * @return true when woken by a request, false on timeout
     */
    boolean awaitHeartbeatRequest(long timeout, TimeUnit unit) throws InterruptedException {
        stateLock.lock();
        try {
            long remaining = unit.toNanos(timeout);
            while (!heartbeatPending && remaining > 0) {
                remaining = heartbeatRequested.awaitNanos(remaining);
            }
            boolean signaled = heartbeatPending;
            heartbeatPending = false;
            return signaled;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Number of state changes that raised a heartbeat wake-up.
     */
    long stateChangeSignals() {
        stateLock.lock();
        try {
            return stateChangeSignals;
        } finally {
            stateLock.unlock();
        }
    }

    void recordHealth(boolean healthy) {
        stateLock.lock();
        try {
            this.healthy = healthy;
        } finally {
            stateLock.unlock();
        }
    }

    boolean lastHealth() {
        stateLock.lock();
        try {
            return healthy;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Build the request for the next heartbeat from the current state and roster.
     */
    HeartbeatRequest snapshotRequest() {
        GameState state;
        boolean health;
        stateLock.lock();
        try {
            state = currentState;
            health = healthy;
        } finally {
            stateLock.unlock();
        }
        return new HeartbeatRequest(state, health, connectedPlayers());
    }

    /**
     * Replace the roster wholesale.
     */
    public void setConnectedPlayers(List<ConnectedPlayer> players) {
        List<ConnectedPlayer> snapshot = players == null ? List.of() : List.copyOf(players);
        synchronized (playersLock) {
            connectedPlayers = snapshot;
        }
    }

    public List<ConnectedPlayer> connectedPlayers() {
        synchronized (playersLock) {
            return connectedPlayers;
        }
    }

    public Map<String, String> configSettings() {
        synchronized (configLock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(configSettings));
        }
    }

    public String configValue(String key) {
        synchronized (configLock) {
            return configSettings.get(key);
        }
    }

    public List<String> initialPlayers() {
        synchronized (configLock) {
            return initialPlayers;
        }
    }

    /**
     * Merge the non-operation parts of a decoded response under the config lock.
     *
     * <p>Session config entries overwrite existing keys. Initial players are stored only while none are stored yet.
     * A maintenance time is reported back when it differs from the last notified one; the cache only moves when a
     * listener is present to receive it.
     *
     * @return the maintenance time to notify, or null
     */
    Instant mergeResponse(HeartbeatResponse response, boolean maintenanceListenerPresent) {
        synchronized (configLock) {
            if (response.sessionConfig() != null) {
                configSettings.putAll(response.sessionConfig());
            }
            if (initialPlayers.isEmpty() && response.initialPlayers() != null && !response.initialPlayers().isEmpty()) {
                initialPlayers = Collections.unmodifiableList(new ArrayList<>(response.initialPlayers()));
            }
            Instant next = response.nextScheduledMaintenance();
            if (next == null || !maintenanceListenerPresent) {
                return null;
            }
            if (cachedMaintenance != null && MaintenanceTimes.sameSecond(cachedMaintenance, next)) {
                return null;
            }
            cachedMaintenance = next;
            return next;
        }
    }

    Instant cachedMaintenance() {
        synchronized (configLock) {
            return cachedMaintenance;
        }
    }
}
