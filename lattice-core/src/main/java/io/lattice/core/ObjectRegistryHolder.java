package io.lattice.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write-once cell holding a {@link SharedObjectRegistry}.
 * <p>
 * {@link #init()} is idempotent; once set, the registry is never replaced or torn down.
 * Reads before initialization fail with {@link ObjectError#REGISTRY_NOT_INITIALIZED}.
 */
public final class ObjectRegistryHolder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ObjectRegistryHolder.class);

    private volatile SharedObjectRegistry registry;

    public SharedObjectRegistry init() {
        return init(LatticeConfiguration.defaults());
    }

    /**
     * Create the registry if absent.
     *
     * @param configuration used only by the call that actually creates the registry
     * @return the live registry
     */
    public SharedObjectRegistry init(LatticeConfiguration configuration) {
        SharedObjectRegistry current = registry;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (registry == null) {
                registry = new SharedObjectRegistry(configuration);
                LOGGER.debug("Object registry initialized with {}", configuration);
            }
            return registry;
        }
    }

    /**
     * Install an externally built registry if none is set yet.
     *
     * @return the live registry, which is {@code candidate} only if the holder was empty
     */
    public SharedObjectRegistry install(SharedObjectRegistry candidate) {
        if (candidate == null) {
            throw new IllegalArgumentException("registry required");
        }
        synchronized (this) {
            if (registry == null) {
                registry = candidate;
                LOGGER.debug("Object registry installed");
            }
            return registry;
        }
    }

    /**
     * @throws ObjectException {@link ObjectError#REGISTRY_NOT_INITIALIZED} before {@link #init()}
     */
    public SharedObjectRegistry get() {
        SharedObjectRegistry current = registry;
        if (current == null) {
            throw ObjectException.registryNotInitialized();
        }
        return current;
    }

    public boolean isInitialized() {
        return registry != null;
    }
}
