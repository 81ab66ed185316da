package net.spookly.gsdk;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

import net.spookly.gsdk.api.GameServerConnectionInfo;
import net.spookly.gsdk.api.HealthCallback;
import net.spookly.gsdk.api.MaintenanceCallback;
import net.spookly.gsdk.api.ShutdownCallback;
import net.spookly.gsdk.config.ConfigException;
import net.spookly.gsdk.config.ConfigKeys;
import net.spookly.gsdk.config.ConfigPrinter;
import net.spookly.gsdk.config.ConfigValidator;
import net.spookly.gsdk.config.ConfigurationSource;
import net.spookly.gsdk.config.InitialSettings;
import net.spookly.gsdk.heartbeat.AgentCallbacks;
import net.spookly.gsdk.heartbeat.HeartbeatScheduler;
import net.spookly.gsdk.heartbeat.HeartbeatState;
import net.spookly.gsdk.heartbeat.HeartbeatTransport;
import net.spookly.gsdk.heartbeat.HttpHeartbeatTransport;
import net.spookly.gsdk.heartbeat.OperationDispatcher;
import net.spookly.gsdk.log.AgentLogFile;
import net.spookly.gsdk.protocol.ConnectedPlayer;
import net.spookly.gsdk.protocol.GameState;
import net.spookly.gsdk.protocol.HeartbeatCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Agent embedded in a game server process. Reports lifecycle state to the orchestrator through periodic heartbeats
 * and reacts to the operations it sends back.
 *
 * <p>Construct one per process with {@link #start(ConfigurationSource, AgentOptions)} and {@link #stop()} it during
 * teardown. All methods are thread-safe.
 */
public final class GsdkAgent implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(GsdkAgent.class);

    private final HeartbeatState state;
    private final AgentCallbacks callbacks;
    private final HeartbeatScheduler scheduler;
    private final GameServerConnectionInfo connectionInfo;
    private final AgentLogFile logFile;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private GsdkAgent(Map<String, String> settings,
                      GameServerConnectionInfo connectionInfo,
                      HeartbeatTransport transport,
                      Executor shutdownExecutor,
                      AgentLogFile logFile,
                      AgentOptions options) {
        this.state = new HeartbeatState(settings);
        this.callbacks = new AgentCallbacks();
        this.connectionInfo = connectionInfo == null ? GameServerConnectionInfo.empty() : connectionInfo;
        this.logFile = logFile;
        OperationDispatcher dispatcher = new OperationDispatcher(
                state,
                callbacks,
                shutdownExecutor,
                this::stopHeartbeats,
                logFile,
                options.debug()
        );
        this.scheduler = new HeartbeatScheduler(
                state,
                new HeartbeatCodec(),
                transport,
                dispatcher,
                callbacks,
                options.heartbeatInterval(),
                logFile,
                options.debug()
        );
    }

    /**
     * Start an agent with default options.
     */
    public static GsdkAgent start(ConfigurationSource source) {
        return start(source, AgentOptions.defaults());
    }

    /**
     * Read the configuration source, validate it and start heartbeating.
     *
     * @throws ConfigException when the heartbeat endpoint or server id is missing or malformed
     */
    public static GsdkAgent start(ConfigurationSource source, AgentOptions options) {
        Map<String, String> settings = InitialSettings.from(source);
        ConfigValidator.validate(settings);
        HeartbeatTransport transport;
        try {
            transport = new HttpHeartbeatTransport(
                    settings.get(ConfigKeys.HEARTBEAT_ENDPOINT),
                    settings.get(ConfigKeys.SERVER_ID),
                    options.requestTimeout()
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid agent config: " + e.getMessage(), e);
        }
        return start(source, options, settings, transport, OperationDispatcher.dedicatedShutdownThread());
    }

    static GsdkAgent start(ConfigurationSource source,
                           AgentOptions options,
                           HeartbeatTransport transport,
                           Executor shutdownExecutor) {
        Map<String, String> settings = InitialSettings.from(source);
        ConfigValidator.validate(settings);
        return start(source, options, settings, transport, shutdownExecutor);
    }

    private static GsdkAgent start(ConfigurationSource source,
                                   AgentOptions options,
                                   Map<String, String> settings,
                                   HeartbeatTransport transport,
                                   Executor shutdownExecutor) {
        LOGGER.info("GSDK config source: {}\n{}", source.describe(), ConfigPrinter.toYaml(settings));
        AgentLogFile logFile = source.shouldLog()
                ? AgentLogFile.open(settings.get(ConfigKeys.LOG_FOLDER))
                : AgentLogFile.disabled();
        logFile.log("VM Agent Endpoint: " + settings.get(ConfigKeys.HEARTBEAT_ENDPOINT));
        logFile.log("Instance Id: " + settings.get(ConfigKeys.SERVER_ID));
        GsdkAgent agent = new GsdkAgent(
                settings,
                source.gameServerConnectionInfo(),
                transport,
                shutdownExecutor,
                logFile,
                options
        );
        if (source.shouldHeartbeat()) {
            agent.scheduler.start();
        } else {
            LOGGER.info("Heartbeats disabled by configuration");
        }
        return agent;
    }

    /**
     * Mark the server as standing by and block until the orchestrator activates it. There is no timeout.
     *
     * @return true when the server is now active, false when it was told to terminate or the agent stopped
     */
    public boolean readyForPlayers() {
        if (stopped.get()) {
            return false;
        }
        if (state.currentState() == GameState.ACTIVE) {
            return true;
        }
        state.enterStandingBy();
        try {
            return state.awaitActivation();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public GameState currentState() {
        return state.currentState();
    }

    public GameServerConnectionInfo gameServerConnectionInfo() {
        return connectionInfo;
    }

    /**
     * Snapshot of static settings merged with the session config pushed by the orchestrator.
     */
    public Map<String, String> configSettings() {
        return state.configSettings();
    }

    public void updateConnectedPlayers(List<ConnectedPlayer> players) {
        state.setConnectedPlayers(players);
    }

    /**
     * Convenience overload taking raw player ids.
     */
    public void updateConnectedPlayerIds(List<String> playerIds) {
        List<ConnectedPlayer> players = new ArrayList<>();
        if (playerIds != null) {
            for (String playerId : playerIds) {
                players.add(new ConnectedPlayer(playerId));
            }
        }
        state.setConnectedPlayers(players);
    }

    public List<ConnectedPlayer> connectedPlayers() {
        return state.connectedPlayers();
    }

    public void registerShutdownCallback(ShutdownCallback callback) {
        callbacks.registerShutdown(callback);
    }

    public void registerHealthCallback(HealthCallback callback) {
        callbacks.registerHealth(callback);
    }

    public void registerMaintenanceCallback(MaintenanceCallback callback) {
        callbacks.registerMaintenance(callback);
    }

    public String logsDirectory() {
        return valueOrEmpty(ConfigKeys.LOG_FOLDER);
    }

    public String sharedContentDirectory() {
        return valueOrEmpty(ConfigKeys.SHARED_CONTENT_FOLDER);
    }

    /**
     * Players the session was allocated with; empty until the orchestrator sends them.
     */
    public List<String> initialPlayers() {
        return state.initialPlayers();
    }

    /**
     * Append one line to the agent output log.
     */
    public void logMessage(String message) {
        logFile.log(message);
    }

    /**
     * Whether heartbeats are still being sent.
     */
    public boolean isHeartbeating() {
        return scheduler.isRunning();
    }

    /**
     * Stop heartbeating, wait for the heartbeat thread to exit and close the log. Threads blocked in
     * {@link #readyForPlayers()} return false.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        scheduler.stop();
        state.releaseActivationWaiters();
        logFile.close();
    }

    @Override
    public void close() {
        stop();
    }

    private void stopHeartbeats() {
        scheduler.requestStop();
    }

    private String valueOrEmpty(String key) {
        String value = state.configValue(key);
        return value == null ? "" : value;
    }
}
