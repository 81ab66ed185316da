package net.spookly.gsdk.heartbeat;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executor;

import net.spookly.gsdk.api.MaintenanceCallback;
import net.spookly.gsdk.api.ShutdownCallback;
import net.spookly.gsdk.log.AgentLogFile;
import net.spookly.gsdk.protocol.GameState;
import net.spookly.gsdk.protocol.HeartbeatResponse;
import net.spookly.gsdk.protocol.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies decoded heartbeat responses: merges session updates, notifies maintenance and drives the lifecycle state
 * machine from the orchestrator's operation.
 *
 * <pre>
 * any != Active      + Active    -> Active       release activation waiters
 * any != Terminating + Terminate -> Terminating  release activation waiters, run shutdown callback, stop heartbeats
 * any                + Continue  -> unchanged
 * any                + Unknown   -> unchanged    logged
 * </pre>
 */
public final class OperationDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(OperationDispatcher.class);

    private final HeartbeatState state;
    private final AgentCallbacks callbacks;
    private final Executor shutdownExecutor;
    private final Runnable stopHeartbeats;
    private final AgentLogFile log;
    private final boolean debug;

    public OperationDispatcher(HeartbeatState state,
                               AgentCallbacks callbacks,
                               Executor shutdownExecutor,
                               Runnable stopHeartbeats,
                               AgentLogFile log,
                               boolean debug) {
        this.state = Objects.requireNonNull(state, "state");
        this.callbacks = Objects.requireNonNull(callbacks, "callbacks");
        this.shutdownExecutor = Objects.requireNonNull(shutdownExecutor, "shutdownExecutor");
        this.stopHeartbeats = Objects.requireNonNull(stopHeartbeats, "stopHeartbeats");
        this.log = log == null ? AgentLogFile.disabled() : log;
        this.debug = debug;
    }

    /**
     * Executor that runs each shutdown on its own thread.
     */
    public static Executor dedicatedShutdownThread() {
        return runnable -> {
            Thread thread = new Thread(runnable, "gsdk-shutdown");
            thread.setDaemon(false);
            thread.start();
        };
    }

    public void dispatch(HeartbeatResponse response) {
        if (response == null) {
            return;
        }
        MaintenanceCallback maintenanceCallback = callbacks.maintenance();
        Instant maintenance = state.mergeResponse(response, maintenanceCallback != null);
        if (maintenance != null) {
            notifyMaintenance(maintenanceCallback, maintenance);
        }
        if (response.operation() != null) {
            applyOperation(response.operation(), response.rawOperation());
        }
    }

    private void applyOperation(Operation operation, String rawOperation) {
        if (debug) {
            log.log("Heartbeat request: { state = " + state.currentState().wireName() + " }"
                    + " response: { operation = " + rawOperation + " }");
        }
        switch (operation) {
            case CONTINUE:
                break;
            case ACTIVE:
                if (state.transitionTo(GameState.ACTIVE, true)) {
                    LOGGER.info("Server activated by orchestrator");
                }
                break;
            case TERMINATE:
                if (state.transitionTo(GameState.TERMINATING, true)) {
                    LOGGER.info("Server termination requested by orchestrator");
                    shutdownExecutor.execute(this::runShutdown);
                }
                break;
            default:
                LOGGER.warn("Unknown operation received: {}", rawOperation);
                log.log("Unknown operation received: " + rawOperation);
                break;
        }
    }

    private void runShutdown() {
        ShutdownCallback callback = callbacks.shutdown();
        try {
            callback.onShutdown();
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            LOGGER.error("Shutdown callback failed", e);
            log.log("Shutdown callback failed: " + e);
        } finally {
            stopHeartbeats.run();
        }
    }

    private void notifyMaintenance(MaintenanceCallback callback, Instant nextMaintenance) {
        try {
            callback.onMaintenanceScheduled(nextMaintenance);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            LOGGER.error("Maintenance callback failed", e);
            log.log("Maintenance callback failed: " + e);
        }
    }
}
