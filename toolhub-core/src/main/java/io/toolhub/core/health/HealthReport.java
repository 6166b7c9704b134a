package io.toolhub.core.health;

/// Connected versus disconnected server counts.
///
/// @param healthy connection instances that are connected
/// @param unhealthy connection instances that are not connected
/// @param total sum of both
public record HealthReport(int healthy, int unhealthy, int total) {

    public HealthReport {
        if (healthy < 0 || unhealthy < 0) {
            throw new IllegalArgumentException("counts must not be negative");
        }
        if (healthy + unhealthy != total) {
            throw new IllegalArgumentException(
                    "total " + total + " != healthy " + healthy + " + unhealthy " + unhealthy);
        }
    }

    public static HealthReport of(int healthy, int unhealthy) {
        return new HealthReport(healthy, unhealthy, healthy + unhealthy);
    }

    public boolean allHealthy() {
        return unhealthy == 0;
    }
}
