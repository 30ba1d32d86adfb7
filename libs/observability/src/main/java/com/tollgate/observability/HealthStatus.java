package com.tollgate.observability;

/**
 * Health of one component or of the whole service.
 */
public enum HealthStatus {

    /** Working normally. */
    HEALTHY,

    /** Impaired but still answering, e.g. serving a stale cached secret. */
    DEGRADED,

    /** Cannot answer correctly. */
    UNHEALTHY;

    /**
     * Returns the worse of the two statuses.
     */
    public HealthStatus worst(HealthStatus other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
