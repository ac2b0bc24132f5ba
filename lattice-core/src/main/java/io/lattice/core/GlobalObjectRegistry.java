package io.lattice.core;

/**
 * Process-wide registry for code that has no injection point.
 * <p>
 * Prefer passing a {@link SharedObjectRegistry} explicitly; this holder exists
 * for the object-base convenience constructor and lives for the whole process.
 */
public final class GlobalObjectRegistry {

    private static final ObjectRegistryHolder HOLDER = new ObjectRegistryHolder();

    private GlobalObjectRegistry() {
    }

    public static SharedObjectRegistry init() {
        return HOLDER.init();
    }

    public static SharedObjectRegistry init(LatticeConfiguration configuration) {
        return HOLDER.init(configuration);
    }

    public static SharedObjectRegistry install(SharedObjectRegistry registry) {
        return HOLDER.install(registry);
    }

    /**
     * @throws ObjectException {@link ObjectError#REGISTRY_NOT_INITIALIZED} before {@link #init()}
     */
    public static SharedObjectRegistry get() {
        return HOLDER.get();
    }

    public static boolean isInitialized() {
        return HOLDER.isInitialized();
    }

    static ObjectRegistryHolder holder() {
        return HOLDER;
    }
}
