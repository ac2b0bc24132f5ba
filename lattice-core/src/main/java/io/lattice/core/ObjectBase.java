package io.lattice.core;

import io.lattice.kernel.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registration handle embedded by concrete object types.
 * <p>
 * Construction registers the object; {@link #close()} destroys it and its
 * subtree exactly once. Getter helpers are best-effort and fall back to
 * defaults when the object is gone; mutators propagate {@link ObjectException}.
 * <pre>
 * final class Button implements LatticeObject, AutoCloseable {
 *     private final ObjectBase base;
 *
 *     Button(SharedObjectRegistry registry) {
 *         this.base = new ObjectBase(registry, Button.class);
 *     }
 *
 *     public ObjectId objectId() { return base.id(); }
 *     public void close() { base.close(); }
 * }
 * </pre>
 */
public final class ObjectBase implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ObjectBase.class);

    private final SharedObjectRegistry registry;
    private final ObjectId id;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ObjectBase(SharedObjectRegistry registry, Class<? extends LatticeObject> type) {
        if (registry == null) {
            throw new IllegalArgumentException("registry required");
        }
        this.registry = registry;
        this.id = registry.register(type);
    }

    /**
     * Register against the process-wide registry.
     *
     * @throws IllegalStateException if {@link GlobalObjectRegistry#init()} has not run;
     *                               this is a programming error, not a runtime condition
     */
    public static ObjectBase create(Class<? extends LatticeObject> type) {
        return create(GlobalObjectRegistry.holder(), type);
    }

    static ObjectBase create(ObjectRegistryHolder holder, Class<? extends LatticeObject> type) {
        SharedObjectRegistry shared;
        try {
            shared = holder.get();
        } catch (ObjectException e) {
            throw new IllegalStateException("Object registry not initialized", e);
        }
        return new ObjectBase(shared, type);
    }

    public ObjectId id() {
        return id;
    }

    public SharedObjectRegistry registry() {
        return registry;
    }

    public boolean isAlive() {
        return registry.contains(id);
    }

    public String name() {
        return query(() -> registry.objectName(id), "");
    }

    public void setName(String name) {
        try {
            registry.setObjectName(id, name);
        } catch (ObjectException e) {
            LOGGER.debug("Ignoring rename of {}: {}", id, e.getMessage());
        }
    }

    public Optional<ObjectId> parent() {
        return query(() -> registry.parent(id), Optional.empty());
    }

    public void setParent(ObjectId parent) {
        registry.setParent(id, parent);
    }

    public List<ObjectId> children() {
        return query(() -> registry.children(id), List.of());
    }

    public Optional<ObjectId> findChildByName(String name) {
        return query(() -> registry.findChildByName(id, name), Optional.empty());
    }

    public void setProperty(String key, Object value) {
        registry.setDynamicProperty(id, key, value);
    }

    public <T> Optional<T> property(String key, Class<T> type) {
        return query(() -> registry.dynamicProperty(id, key, type), Optional.empty());
    }

    // z-order

    public OptionalInt siblingIndex() {
        return query(() -> registry.siblingIndex(id), OptionalInt.empty());
    }

    public Optional<ObjectId> nextSibling() {
        return query(() -> registry.nextSibling(id), Optional.empty());
    }

    public Optional<ObjectId> previousSibling() {
        return query(() -> registry.previousSibling(id), Optional.empty());
    }

    public List<ObjectId> siblings() {
        return query(() -> registry.siblings(id), List.of());
    }

    public void raise() {
        registry.raise(id);
    }

    public void lower() {
        registry.lower(id);
    }

    public void stackUnder(ObjectId sibling) {
        registry.stackUnder(id, sibling);
    }

    public void stackAbove(ObjectId sibling) {
        registry.stackAbove(id, sibling);
    }

    // traversal

    public List<ObjectId> ancestors() {
        return query(() -> registry.ancestors(id), List.of());
    }

    public List<ObjectId> depthFirstPreorder() {
        return query(() -> registry.depthFirstPreorder(id), List.of());
    }

    public List<ObjectId> depthFirstPostorder() {
        return query(() -> registry.depthFirstPostorder(id), List.of());
    }

    public List<ObjectId> breadthFirst() {
        return query(() -> registry.breadthFirst(id), List.of());
    }

    /**
     * Destroy the object and its subtree. Later calls do nothing, and so does
     * the first one if an ancestor's destruction already took the object.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            registry.destroy(id);
        } catch (ObjectException e) {
            LOGGER.debug("{} was already destroyed", id);
        }
    }

    private <R> R query(java.util.function.Supplier<R> lookup, R fallback) {
        try {
            return lookup.get();
        } catch (ObjectException e) {
            return fallback;
        }
    }

    @Override
    public String toString() {
        return "ObjectBase{" + id + "}";
    }
}
