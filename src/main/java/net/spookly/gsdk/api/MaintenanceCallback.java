package net.spookly.gsdk.api;

import java.time.Instant;

/**
 * Notified once per distinct scheduled maintenance announcement.
 */
@FunctionalInterface
public interface MaintenanceCallback {
    void onMaintenanceScheduled(Instant nextMaintenanceUtc);
}
