package net.spookly.gsdk.api;

/**
 * Invoked once when the orchestrator tells this server to terminate. Runs on a dedicated thread, never on the
 * heartbeat thread.
 */
@FunctionalInterface
public interface ShutdownCallback {
    ShutdownCallback NOOP = () -> {
    };

    void onShutdown();
}
