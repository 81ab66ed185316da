package net.spookly.gsdk.api;

/**
 * Queried right before each heartbeat is encoded.
 */
@FunctionalInterface
public interface HealthCallback {
    boolean isHealthy();
}
