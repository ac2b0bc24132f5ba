package io.lattice.core;

import io.lattice.kernel.ObjectId;

import java.util.Optional;

/**
 * Contract of every concrete object type that lives in the registry.
 * <p>
 * Implementations hold only their identifier; name, parent, children and
 * properties are owned by the registry.
 */
public interface LatticeObject {

    ObjectId objectId();

    /**
     * Checked downcast of an object reference.
     *
     * @param object the object, may be null
     * @param type   the requested concrete type
     * @return the object as {@code type}, or empty if it is of another type
     */
    static <T extends LatticeObject> Optional<T> cast(LatticeObject object, Class<T> type) {
        if (type.isInstance(object)) {
            return Optional.of(type.cast(object));
        }
        return Optional.empty();
    }
}
