package io.lattice.core;

import io.lattice.kernel.ObjectId;

/**
 * Raised by registry operations that cannot complete.
 * <p>
 * The registry validates before it mutates, so a thrown {@code ObjectException}
 * always leaves the object graph unchanged.
 */
public class ObjectException extends RuntimeException {

    private final ObjectError error;
    private final String expectedType;
    private final String actualType;

    public ObjectException(ObjectError error) {
        this(error, error.description());
    }

    public ObjectException(ObjectError error, String message) {
        this(error, message, null, null);
    }

    private ObjectException(ObjectError error, String message, String expectedType, String actualType) {
        super(message);
        this.error = error;
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public static ObjectException invalidObjectId(ObjectId id) {
        return new ObjectException(ObjectError.INVALID_OBJECT_ID,
                ObjectError.INVALID_OBJECT_ID.description() + ": " + id);
    }

    public static ObjectException circularParentage(ObjectId id, ObjectId parent) {
        return new ObjectException(ObjectError.CIRCULAR_PARENTAGE,
                ObjectError.CIRCULAR_PARENTAGE.description() + ": " + parent + " is " + id + " or one of its descendants");
    }

    public static ObjectException propertyNotFound(String key) {
        return new ObjectException(ObjectError.PROPERTY_NOT_FOUND,
                ObjectError.PROPERTY_NOT_FOUND.description() + ": " + key);
    }

    public static ObjectException propertyTypeMismatch(String key, Class<?> expected, Class<?> actual) {
        return new ObjectException(ObjectError.PROPERTY_TYPE_MISMATCH,
                ObjectError.PROPERTY_TYPE_MISMATCH.description() + " for " + key
                        + ": expected " + expected.getName() + ", got " + actual.getName(),
                expected.getName(), actual.getName());
    }

    public static ObjectException registryNotInitialized() {
        return new ObjectException(ObjectError.REGISTRY_NOT_INITIALIZED);
    }

    public ObjectError error() {
        return error;
    }

    /**
     * Expected type name, set only for {@link ObjectError#PROPERTY_TYPE_MISMATCH}.
     */
    public String expectedType() {
        return expectedType;
    }

    /**
     * Stored type name, set only for {@link ObjectError#PROPERTY_TYPE_MISMATCH}.
     */
    public String actualType() {
        return actualType;
    }
}
