package tether.core.port.out;

import io.smallrye.mutiny.Uni;

import tether.core.model.common.StorageHealth;

/**
 * Port for checking the health of a storage layer.
 */
@FunctionalInterface
public interface StorageHealthIndicator {

    Uni<StorageHealth> check();
}
