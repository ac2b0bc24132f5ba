package io.lattice.core;

/**
 * Failure kinds reported by the object registry.
 */
public enum ObjectError {
    /** The identifier was never registered, was destroyed, or is stale. Also reported for non-siblings. */
    INVALID_OBJECT_ID("Invalid or destroyed object ID"),
    /** A reparenting would make an object its own ancestor. */
    CIRCULAR_PARENTAGE("Cannot set an object as its own parent or ancestor"),
    PROPERTY_NOT_FOUND("Property not found"),
    PROPERTY_TYPE_MISMATCH("Property type mismatch"),
    /** Reserved for read-only properties. */
    PROPERTY_READ_ONLY("Property is read-only"),
    REGISTRY_NOT_INITIALIZED("Object registry not initialized");

    private final String description;

    ObjectError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
