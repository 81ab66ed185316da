package net.spookly.gsdk.heartbeat;

import java.util.concurrent.atomic.AtomicReference;

import net.spookly.gsdk.api.HealthCallback;
import net.spookly.gsdk.api.MaintenanceCallback;
import net.spookly.gsdk.api.ShutdownCallback;

/**
 * Single-slot callback registrations; the last registration wins. Callers copy a slot out and invoke it without
 * holding any state lock.
 */
public final class AgentCallbacks {
    private final AtomicReference<ShutdownCallback> shutdown = new AtomicReference<>(ShutdownCallback.NOOP);
    private final AtomicReference<HealthCallback> health = new AtomicReference<>();
    private final AtomicReference<MaintenanceCallback> maintenance = new AtomicReference<>();

    /**
     * Replace the shutdown callback; null restores {@link ShutdownCallback#NOOP}.
     */
    public void registerShutdown(ShutdownCallback callback) {
        shutdown.set(callback == null ? ShutdownCallback.NOOP : callback);
    }

    public void registerHealth(HealthCallback callback) {
        health.set(callback);
    }

    public void registerMaintenance(MaintenanceCallback callback) {
        maintenance.set(callback);
    }

    public ShutdownCallback shutdown() {
        return shutdown.get();
    }

    public HealthCallback health() {
        return health.get();
    }

    public MaintenanceCallback maintenance() {
        return maintenance.get();
    }
}
