package io.lattice.core;

import io.lattice.kernel.ObjectId;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Thread-safe façade over one {@link ObjectRegistry}.
 * <p>
 * Mutations hold the write lock for their whole duration, queries hold the read
 * lock, so mutations appear in a single total order and a {@link #destroy(ObjectId)}
 * is never observed half done. All returned collections are snapshots.
 * <p>
 * Multi-step logic that must be atomic goes through {@link #withRead(Function)}
 * or {@link #withWrite(Function)}.
 */
public final class SharedObjectRegistry {

    private final ObjectRegistry registry;
    private final ReentrantReadWriteLock lock;

    public SharedObjectRegistry() {
        this(LatticeConfiguration.defaults());
    }

    public SharedObjectRegistry(LatticeConfiguration configuration) {
        this.registry = new ObjectRegistry(configuration);
        this.lock = new ReentrantReadWriteLock(configuration.fairLocking());
    }

    /**
     * Run {@code action} against a read-only view of the registry under the read lock.
     * <p>
     * The read lock cannot be upgraded: calling {@link #withWrite(Function)} or any
     * mutator of this façade from inside {@code action} fails with
     * {@link IllegalStateException}. The view must not escape the callback.
     */
    public <R> R withRead(Function<ObjectRegistryView, R> action) {
        var readLock = lock.readLock();
        readLock.lock();
        try {
            return action.apply(registry);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Run {@code action} against the registry under the write lock.
     * The registry reference must not escape the callback.
     *
     * @throws IllegalStateException if the calling thread holds the read lock
     */
    public <R> R withWrite(Function<ObjectRegistry, R> action) {
        if (lock.getReadHoldCount() > 0) {
            throw new IllegalStateException("Cannot mutate the object registry while holding its read lock");
        }
        var writeLock = lock.writeLock();
        writeLock.lock();
        try {
            return action.apply(registry);
        } finally {
            writeLock.unlock();
        }
    }

    // Lifecycle

    public <T extends LatticeObject> ObjectId register(Class<T> type) {
        return withWrite(r -> r.register(type));
    }

    public void destroy(ObjectId id) {
        write(() -> registry.destroy(id));
    }

    public boolean contains(ObjectId id) {
        return withRead(r -> r.contains(id));
    }

    public int objectCount() {
        return withRead(ObjectRegistryView::objectCount);
    }

    // Tree mutation

    public void setParent(ObjectId id, ObjectId newParent) {
        write(() -> registry.setParent(id, newParent));
    }

    public void raise(ObjectId id) {
        write(() -> registry.raise(id));
    }

    public void lower(ObjectId id) {
        write(() -> registry.lower(id));
    }

    public void stackUnder(ObjectId id, ObjectId sibling) {
        write(() -> registry.stackUnder(id, sibling));
    }

    public void stackAbove(ObjectId id, ObjectId sibling) {
        write(() -> registry.stackAbove(id, sibling));
    }

    // Tree query

    public Optional<ObjectId> parent(ObjectId id) {
        return withRead(r -> r.parent(id));
    }

    public List<ObjectId> children(ObjectId id) {
        return withRead(r -> r.children(id));
    }

    public List<ObjectId> siblings(ObjectId id) {
        return withRead(r -> r.siblings(id));
    }

    public OptionalInt siblingIndex(ObjectId id) {
        return withRead(r -> r.siblingIndex(id));
    }

    public Optional<ObjectId> nextSibling(ObjectId id) {
        return withRead(r -> r.nextSibling(id));
    }

    public Optional<ObjectId> previousSibling(ObjectId id) {
        return withRead(r -> r.previousSibling(id));
    }

    public List<ObjectId> ancestors(ObjectId id) {
        return withRead(r -> r.ancestors(id));
    }

    public boolean isAncestorOf(ObjectId candidate, ObjectId id) {
        return withRead(r -> r.isAncestorOf(candidate, id));
    }

    public List<ObjectId> depthFirstPreorder(ObjectId root) {
        return withRead(r -> r.depthFirstPreorder(root));
    }

    public List<ObjectId> depthFirstPostorder(ObjectId root) {
        return withRead(r -> r.depthFirstPostorder(root));
    }

    public List<ObjectId> breadthFirst(ObjectId root) {
        return withRead(r -> r.breadthFirst(root));
    }

    public List<ObjectId> rootObjects() {
        return withRead(ObjectRegistryView::rootObjects);
    }

    // Naming and lookup

    public String objectName(ObjectId id) {
        return withRead(r -> r.objectName(id));
    }

    public void setObjectName(ObjectId id, String name) {
        write(() -> registry.setObjectName(id, name));
    }

    public Optional<ObjectId> findChildByName(ObjectId id, String name) {
        return withRead(r -> r.findChildByName(id, name));
    }

    public Optional<ObjectId> findChild(ObjectId id, String name, Class<? extends LatticeObject> type) {
        return withRead(r -> r.findChild(id, name, type));
    }

    public List<ObjectId> findChildrenByType(ObjectId id, Class<? extends LatticeObject> type) {
        return withRead(r -> r.findChildrenByType(id, type));
    }

    public List<ObjectId> findDescendantsByName(ObjectId id, String name) {
        return withRead(r -> r.findDescendantsByName(id, name));
    }

    public Class<? extends LatticeObject> typeId(ObjectId id) {
        return withRead(r -> r.typeId(id));
    }

    public String typeName(ObjectId id) {
        return withRead(r -> r.typeName(id));
    }

    // Dynamic properties

    public void setDynamicProperty(ObjectId id, String key, Object value) {
        write(() -> registry.setDynamicProperty(id, key, value));
    }

    public <T> Optional<T> dynamicProperty(ObjectId id, String key, Class<T> type) {
        return withRead(r -> r.dynamicProperty(id, key, type));
    }

    public <T> T requireDynamicProperty(ObjectId id, String key, Class<T> type) {
        return withRead(r -> r.requireDynamicProperty(id, key, type));
    }

    public Optional<Object> removeDynamicProperty(ObjectId id, String key) {
        return withWrite(r -> r.removeDynamicProperty(id, key));
    }

    public List<String> dynamicPropertyNames(ObjectId id) {
        return withRead(r -> r.dynamicPropertyNames(id));
    }

    // Widget state

    public void initWidgetState(ObjectId id, boolean visible, boolean enabled) {
        write(() -> registry.initWidgetState(id, visible, enabled));
    }

    public void setWidgetVisible(ObjectId id, boolean visible) {
        write(() -> registry.setWidgetVisible(id, visible));
    }

    public void setWidgetEnabled(ObjectId id, boolean enabled) {
        write(() -> registry.setWidgetEnabled(id, enabled));
    }

    public void clearWidgetState(ObjectId id) {
        write(() -> registry.clearWidgetState(id));
    }

    public Optional<WidgetState> widgetState(ObjectId id) {
        return withRead(r -> r.widgetState(id));
    }

    public Optional<Boolean> isEffectivelyVisible(ObjectId id) {
        return withRead(r -> r.isEffectivelyVisible(id));
    }

    public Optional<Boolean> isEffectivelyEnabled(ObjectId id) {
        return withRead(r -> r.isEffectivelyEnabled(id));
    }

    public Optional<Boolean> isVisibleTo(ObjectId id, ObjectId ancestor) {
        return withRead(r -> r.isVisibleTo(id, ancestor));
    }

    // Diagnostics

    public String dumpObjectTree(ObjectId root) {
        return withRead(r -> r.dumpObjectTree(root));
    }

    private void write(Runnable mutation) {
        withWrite(r -> {
            mutation.run();
            return null;
        });
    }
}
