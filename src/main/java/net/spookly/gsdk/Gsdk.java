package net.spookly.gsdk;

import java.util.List;
import java.util.Map;

import net.spookly.gsdk.api.GameServerConnectionInfo;
import net.spookly.gsdk.api.HealthCallback;
import net.spookly.gsdk.api.MaintenanceCallback;
import net.spookly.gsdk.api.ShutdownCallback;
import net.spookly.gsdk.config.ConfigException;
import net.spookly.gsdk.config.ConfigurationSource;
import net.spookly.gsdk.config.ConfigurationSources;
import net.spookly.gsdk.protocol.ConnectedPlayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide access to a single {@link GsdkAgent}.
 *
 * <p>Every query is safe before {@link #start()} succeeds and after {@link #stop()}: it returns an empty value, false
 * or does nothing.
 */
public final class Gsdk {
    private static final Logger LOGGER = LoggerFactory.getLogger(Gsdk.class);
    private static final Object LIFECYCLE_LOCK = new Object();

    private static volatile GsdkAgent agent;

    private Gsdk() {
    }

    public static boolean start() {
        return start(false);
    }

    /**
     * Start the process agent from {@code GSDK_CONFIG_FILE} or the environment.
     *
     * @return true when an agent is running after the call
     */
    public static boolean start(boolean debugLogs) {
        synchronized (LIFECYCLE_LOCK) {
            if (agent != null) {
                return true;
            }
            try {
                return start(ConfigurationSources.resolve(), AgentOptions.defaults().withDebug(debugLogs));
            } catch (ConfigException e) {
                LOGGER.error("Failed to start agent: {}", e.getMessage());
                return false;
            }
        }
    }

    /**
     * Start the process agent from an explicit configuration source.
     */
    public static boolean start(ConfigurationSource source, AgentOptions options) {
        synchronized (LIFECYCLE_LOCK) {
            if (agent != null) {
                return true;
            }
            try {
                agent = GsdkAgent.start(source, options);
            } catch (ConfigException e) {
                LOGGER.error("Failed to start agent: {}", e.getMessage());
                return false;
            }
            return true;
        }
    }

    /**
     * Stop and discard the process agent. Safe to call at any time.
     */
    public static void stop() {
        GsdkAgent current;
        synchronized (LIFECYCLE_LOCK) {
            current = agent;
            agent = null;
        }
        if (current != null) {
            current.stop();
        }
    }

    public static boolean isStarted() {
        return agent != null;
    }

    public static boolean readyForPlayers() {
        GsdkAgent current = agent;
        return current != null && current.readyForPlayers();
    }

    public static GameServerConnectionInfo getGameServerConnectionInfo() {
        GsdkAgent current = agent;
        return current == null ? GameServerConnectionInfo.empty() : current.gameServerConnectionInfo();
    }

    public static Map<String, String> getConfigSettings() {
        GsdkAgent current = agent;
        return current == null ? Map.of() : current.configSettings();
    }

    public static void updateConnectedPlayers(List<ConnectedPlayer> players) {
        GsdkAgent current = agent;
        if (current != null) {
            current.updateConnectedPlayers(players);
        }
    }

    public static void registerShutdownCallback(ShutdownCallback callback) {
        GsdkAgent current = agent;
        if (current != null) {
            current.registerShutdownCallback(callback);
        }
    }

    public static void registerHealthCallback(HealthCallback callback) {
        GsdkAgent current = agent;
        if (current != null) {
            current.registerHealthCallback(callback);
        }
    }

    public static void registerMaintenanceCallback(MaintenanceCallback callback) {
        GsdkAgent current = agent;
        if (current != null) {
            current.registerMaintenanceCallback(callback);
        }
    }

    public static String getLogsDirectory() {
        GsdkAgent current = agent;
        return current == null ? "" : current.logsDirectory();
    }

    public static String getSharedContentDirectory() {
        GsdkAgent current = agent;
        return current == null ? "" : current.sharedContentDirectory();
    }

    public static List<String> getInitialPlayers() {
        GsdkAgent current = agent;
        return current == null ? List.of() : current.initialPlayers();
    }

    public static void logMessage(String message) {
        GsdkAgent current = agent;
        if (current != null) {
            current.logMessage(message);
        }
    }
}
