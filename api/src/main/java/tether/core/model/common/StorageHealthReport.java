package tether.core.model.common;

/**
 * Combined health of the cache and durable layers.
 */
public record StorageHealthReport(StorageHealth cache, StorageHealth persistent) {

    public boolean healthy() {
        return cache.healthy() && persistent.healthy();
    }

    /**
     * {@code healthy} when both layers respond, {@code degraded} otherwise.
     */
    public String overall() {
        return healthy() ? "healthy" : "degraded";
    }
}
