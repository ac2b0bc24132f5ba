package io.lattice.core;

import io.lattice.kernel.ObjectId;
import io.lattice.storage.SlotArena;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Ownership graph of live objects.
 * <p>
 * Every object is a record in a {@link SlotArena}, addressed by its {@link ObjectId}.
 * A record has at most one parent and an ordered list of children whose order is
 * the z-order (index 0 is the back, the last entry is the front).
 * <p>
 * <b>Invariants</b> after every public call:
 * <ul>
 *   <li>parent and children links are symmetric, and a child appears in exactly one list;</li>
 *   <li>no object is its own ancestor;</li>
 *   <li>destroying an object destroys its whole subtree, and no identifier of it resolves again;</li>
 *   <li>a children list is only reordered by an operation on that list.</li>
 * </ul>
 * Every failing call throws {@link ObjectException} before mutating anything.
 * <p>
 * Not thread-safe. Use {@link SharedObjectRegistry} for concurrent access.
 */
public final class ObjectRegistry implements ObjectRegistryView {

    private static final Logger LOGGER = LoggerFactory.getLogger(ObjectRegistry.class);

    private final SlotArena<ObjectRecord> objects;
    private final int treeDumpIndent;

    public ObjectRegistry() {
        this(LatticeConfiguration.defaults());
    }

    public ObjectRegistry(LatticeConfiguration configuration) {
        this.objects = new SlotArena<>(configuration.initialCapacity());
        this.treeDumpIndent = configuration.treeDumpIndent();
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Register a new unparented, unnamed object of the given type.
     *
     * @param type the concrete object type
     * @return the new object's identifier
     */
    public <T extends LatticeObject> ObjectId register(Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type required");
        }
        ObjectId id = objects.insert(new ObjectRecord(type));
        LOGGER.trace("Registered {} as {}", type.getName(), id);
        return id;
    }

    /**
     * Destroy an object and its entire subtree.
     * <p>
     * The subtree is collected in post-order before anything is removed, so an
     * invalid identifier fails without side effects.
     *
     * @param id the object to destroy
     * @throws ObjectException {@link ObjectError#INVALID_OBJECT_ID} if {@code id} does not resolve
     */
    public void destroy(ObjectId id) {
        ObjectRecord record = require(id);
        List<ObjectId> doomed = depthFirstPostorder(id);

        if (record.parent != null) {
            ObjectRecord parentRecord = objects.get(record.parent);
            if (parentRecord != null) {
                parentRecord.children.remove(id);
            }
        }

        // post-order ends with id itself
        for (ObjectId victim : doomed) {
            objects.remove(victim);
        }
        LOGGER.debug("Destroyed {} with {} descendant(s)", id, doomed.size() - 1);
    }

    @Override
    public boolean contains(ObjectId id) {
        return objects.contains(id);
    }

    @Override
    public int objectCount() {
        return objects.size();
    }

    // ========================================================================
    // Parenting
    // ========================================================================

    /**
     * Move an object under a new parent, or make it a root object.
     * <p>
     * The object is appended to the end (front-most z-order) of the new parent's
     * children. Its own subtree is untouched.
     *
     * @param id        the object to move
     * @param newParent the new parent, or null to detach
     * @throws ObjectException {@link ObjectError#INVALID_OBJECT_ID} if either identifier does not resolve,
     *                         {@link ObjectError#CIRCULAR_PARENTAGE} if {@code newParent} is {@code id}
     *                         or one of its descendants
     */
    public void setParent(ObjectId id, ObjectId newParent) {
        ObjectRecord record = require(id);
        ObjectRecord parentRecord = null;
        if (newParent != null) {
            parentRecord = require(newParent);
            if (isAncestorOf(id, newParent)) {
                throw ObjectException.circularParentage(id, newParent);
            }
        }

        if (record.parent != null) {
            ObjectRecord oldParentRecord = objects.get(record.parent);
            if (oldParentRecord != null) {
                oldParentRecord.children.remove(id);
            }
        }
        record.parent = newParent;
        if (parentRecord != null) {
            parentRecord.children.add(id);
        }
        LOGGER.trace("Reparented {} under {}", id, newParent);
    }

    /**
     * Check whether {@code candidate} is {@code id} itself or one of its ancestors.
     * Walks the parent chain of {@code id}, O(depth).
     *
     * @throws ObjectException {@link ObjectError#INVALID_OBJECT_ID} if either identifier does not resolve
     */
    @Override
    public boolean isAncestorOf(ObjectId candidate, ObjectId id) {
        require(candidate);
        require(id);
        ObjectId current = id;
        while (current != null) {
            if (current.equals(candidate)) {
                return true;
            }
            ObjectRecord record = objects.get(current);
            current = record == null ? null : record.parent;
        }
        return false;
    }

    @Override
    public Optional<ObjectId> parent(ObjectId id) {
        return Optional.ofNullable(require(id).parent);
    }

    /**
     * Get the children of an object in z-order.
     *
     * @return an immutable snapshot
     */
    @Override
    public List<ObjectId> children(ObjectId id) {
        return List.copyOf(require(id).children);
    }

    /**
     * Get the ancestors of an object from its immediate parent up to the root.
     */
    @Override
    public List<ObjectId> ancestors(ObjectId id) {
        ObjectRecord record = require(id);
        List<ObjectId> result = new ArrayList<>();
        ObjectId current = record.parent;
        while (current != null) {
            result.add(current);
            current = objects.get(current).parent;
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Get every object that has no parent, in slot order.
     */
    @Override
    public List<ObjectId> rootObjects() {
        List<ObjectId> roots = new ArrayList<>();
        objects.forEach((id, record) -> {
            if (record.parent == null) {
                roots.add(id);
            }
        });
        return Collections.unmodifiableList(roots);
    }

    // ========================================================================
    // Sibling order (z-order)
    // ========================================================================

    /**
     * Get the position of an object in its parent's children list.
     *
     * @return the index, or empty for a root object
     */
    @Override
    public OptionalInt siblingIndex(ObjectId id) {
        ObjectRecord record = require(id);
        if (record.parent == null) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(objects.get(record.parent).children.indexOf(id));
    }

    /**
     * Get the sibling directly in front of an object.
     */
    @Override
    public Optional<ObjectId> nextSibling(ObjectId id) {
        return siblingAt(id, 1);
    }

    /**
     * Get the sibling directly behind an object.
     */
    @Override
    public Optional<ObjectId> previousSibling(ObjectId id) {
        return siblingAt(id, -1);
    }

    /**
     * Get the other children of an object's parent, in z-order.
     *
     * @return the siblings, empty for a root object
     */
    @Override
    public List<ObjectId> siblings(ObjectId id) {
        ObjectRecord record = require(id);
        if (record.parent == null) {
            return List.of();
        }
        List<ObjectId> result = new ArrayList<>(objects.get(record.parent).children);
        result.remove(id);
        return Collections.unmodifiableList(result);
    }

    /**
     * Move an object to the front of its siblings. No-op for a root object.
     */
    public void raise(ObjectId id) {
        ObjectRecord record = require(id);
        if (record.parent == null) {
            return;
        }
        List<ObjectId> siblings = objects.get(record.parent).children;
        siblings.remove(id);
        siblings.add(id);
        LOGGER.trace("Raised {}", id);
    }

    /**
     * Move an object to the back of its siblings. No-op for a root object.
     */
    public void lower(ObjectId id) {
        ObjectRecord record = require(id);
        if (record.parent == null) {
            return;
        }
        List<ObjectId> siblings = objects.get(record.parent).children;
        siblings.remove(id);
        siblings.add(0, id);
        LOGGER.trace("Lowered {}", id);
    }

    /**
     * Place an object directly behind a sibling.
     *
     * @throws ObjectException {@link ObjectError#INVALID_OBJECT_ID} if either identifier does not
     *                         resolve or the two do not share a parent
     */
    public void stackUnder(ObjectId id, ObjectId sibling) {
        restack(id, sibling, 0);
        LOGGER.trace("Stacked {} under {}", id, sibling);
    }

    /**
     * Place an object directly in front of a sibling.
     *
     * @throws ObjectException {@link ObjectError#INVALID_OBJECT_ID} if either identifier does not
     *                         resolve or the two do not share a parent
     */
    public void stackAbove(ObjectId id, ObjectId sibling) {
        restack(id, sibling, 1);
        LOGGER.trace("Stacked {} above {}", id, sibling);
    }

    private void restack(ObjectId id, ObjectId sibling, int offset) {
        ObjectRecord record = require(id);
        ObjectRecord siblingRecord = require(sibling);
        if (record.parent == null || !record.parent.equals(siblingRecord.parent)) {
            throw ObjectException.invalidObjectId(sibling);
        }
        if (id.equals(sibling)) {
            return;
        }
        List<ObjectId> siblings = objects.get(record.parent).children;
        siblings.remove(id);
        siblings.add(siblings.indexOf(sibling) + offset, id);
    }

    private Optional<ObjectId> siblingAt(ObjectId id, int delta) {
        ObjectRecord record = require(id);
        if (record.parent == null) {
            return Optional.empty();
        }
        List<ObjectId> siblings = objects.get(record.parent).children;
        int target = siblings.indexOf(id) + delta;
        if (target < 0 || target >= siblings.size()) {
            return Optional.empty();
        }
        return Optional.of(siblings.get(target));
    }

    // ========================================================================
    // Traversal
    // ========================================================================

    /**
     * Snapshot of a subtree in depth-first pre-order: the root, then each child's subtree in z-order.
     */
    @Override
    public List<ObjectId> depthFirstPreorder(ObjectId root) {
        require(root);
        List<ObjectId> result = new ArrayList<>();
        Deque<ObjectId> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            ObjectId current = stack.pop();
            result.add(current);
            List<ObjectId> children = objects.get(current).children;
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Snapshot of a subtree in depth-first post-order: each child's subtree in z-order, then the root.
     */
    @Override
    public List<ObjectId> depthFirstPostorder(ObjectId root) {
        require(root);
        List<ObjectId> result = new ArrayList<>();
        Deque<Iterator<ObjectId>> pending = new ArrayDeque<>();
        Deque<ObjectId> path = new ArrayDeque<>();
        path.push(root);
        pending.push(objects.get(root).children.iterator());
        while (!pending.isEmpty()) {
            Iterator<ObjectId> next = pending.peek();
            if (next.hasNext()) {
                ObjectId child = next.next();
                path.push(child);
                pending.push(objects.get(child).children.iterator());
            } else {
                pending.pop();
                result.add(path.pop());
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Snapshot of a subtree in breadth-first order: every node at depth N precedes every node at depth N+1.
     */
    @Override
    public List<ObjectId> breadthFirst(ObjectId root) {
        require(root);
        List<ObjectId> result = new ArrayList<>();
        Deque<ObjectId> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            ObjectId current = queue.poll();
            result.add(current);
            queue.addAll(objects.get(current).children);
        }
        return Collections.unmodifiableList(result);
    }

    // ========================================================================
    // Naming and lookup
    // ========================================================================

    @Override
    public String objectName(ObjectId id) {
        return require(id).name;
    }

    public void setObjectName(ObjectId id, String name) {
        require(id).name = name == null ? "" : name;
    }

    /**
     * Find the first direct child with the given name.
     */
    @Override
    public Optional<ObjectId> findChildByName(ObjectId id, String name) {
        for (ObjectId child : require(id).children) {
            if (objects.get(child).name.equals(name)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /**
     * Find the first direct child with the given name and exact type.
     */
    @Override
    public Optional<ObjectId> findChild(ObjectId id, String name, Class<? extends LatticeObject> type) {
        for (ObjectId child : require(id).children) {
            ObjectRecord record = objects.get(child);
            if (record.type == type && record.name.equals(name)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /**
     * Find all direct children of the exact given type, in z-order.
     */
    @Override
    public List<ObjectId> findChildrenByType(ObjectId id, Class<? extends LatticeObject> type) {
        List<ObjectId> result = new ArrayList<>();
        for (ObjectId child : require(id).children) {
            if (objects.get(child).type == type) {
                result.add(child);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Find every descendant (not only direct children) with the given name, depth-first.
     */
    @Override
    public List<ObjectId> findDescendantsByName(ObjectId id, String name) {
        List<ObjectId> result = new ArrayList<>();
        for (ObjectId candidate : depthFirstPreorder(id)) {
            if (!candidate.equals(id) && objects.get(candidate).name.equals(name)) {
                result.add(candidate);
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public Class<? extends LatticeObject> typeId(ObjectId id) {
        return require(id).type;
    }

    @Override
    public String typeName(ObjectId id) {
        return require(id).type.getName();
    }

    // ========================================================================
    // Dynamic properties
    // ========================================================================

    /**
     * Store a value under {@code key}, replacing any prior value of any type.
     */
    public void setDynamicProperty(ObjectId id, String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
        require(id).properties.put(key, value);
    }

    /**
     * Read a property as {@code type}.
     * <p>
     * The stored value's concrete class must be exactly {@code type}; a supertype such
     * as {@code Number} does not match a stored {@code Integer}.
     *
     * @return the value, or empty if the key is absent or holds a value of another type
     */
    @Override
    public <T> Optional<T> dynamicProperty(ObjectId id, String key, Class<T> type) {
        Object value = require(id).properties.get(key);
        if (value != null && value.getClass() == type) {
            return Optional.of(type.cast(value));
        }
        return Optional.empty();
    }

    /**
     * Read a property as {@code type}, distinguishing absence from a type mismatch.
     *
     * @throws ObjectException {@link ObjectError#PROPERTY_NOT_FOUND} or {@link ObjectError#PROPERTY_TYPE_MISMATCH}
     */
    @Override
    public <T> T requireDynamicProperty(ObjectId id, String key, Class<T> type) {
        Object value = require(id).properties.get(key);
        if (value == null) {
            throw ObjectException.propertyNotFound(key);
        }
        if (value.getClass() != type) {
            throw ObjectException.propertyTypeMismatch(key, type, value.getClass());
        }
        return type.cast(value);
    }

    public Optional<Object> removeDynamicProperty(ObjectId id, String key) {
        return Optional.ofNullable(require(id).properties.remove(key));
    }

    /**
     * Property keys in insertion order.
     */
    @Override
    public List<String> dynamicPropertyNames(ObjectId id) {
        return List.copyOf(require(id).properties.keySet());
    }

    // ========================================================================
    // Widget state
    // ========================================================================

    public void initWidgetState(ObjectId id, boolean visible, boolean enabled) {
        require(id).widgetState = new WidgetState(visible, enabled);
    }

    /**
     * Set the object's own visible flag, creating its widget state if it has none.
     */
    public void setWidgetVisible(ObjectId id, boolean visible) {
        ObjectRecord record = require(id);
        WidgetState current = record.widgetState == null ? WidgetState.DEFAULT : record.widgetState;
        record.widgetState = current.withVisible(visible);
    }

    /**
     * Set the object's own enabled flag, creating its widget state if it has none.
     */
    public void setWidgetEnabled(ObjectId id, boolean enabled) {
        ObjectRecord record = require(id);
        WidgetState current = record.widgetState == null ? WidgetState.DEFAULT : record.widgetState;
        record.widgetState = current.withEnabled(enabled);
    }

    /**
     * Drop the object's widget state so ancestors' propagation skips it.
     */
    public void clearWidgetState(ObjectId id) {
        require(id).widgetState = null;
    }

    @Override
    public Optional<WidgetState> widgetState(ObjectId id) {
        return Optional.ofNullable(require(id).widgetState);
    }

    /**
     * Visibility combined with every ancestor that carries widget state.
     *
     * @return empty if the object has no widget state of its own
     */
    @Override
    public Optional<Boolean> isEffectivelyVisible(ObjectId id) {
        return effectiveFlag(id, null, true);
    }

    /**
     * Enabled flag combined with every ancestor that carries widget state.
     *
     * @return empty if the object has no widget state of its own
     */
    @Override
    public Optional<Boolean> isEffectivelyEnabled(ObjectId id) {
        return effectiveFlag(id, null, false);
    }

    /**
     * Visibility combined with the ancestors strictly below {@code ancestor}.
     *
     * @param ancestor where to stop walking up, or null to walk to the root
     * @return empty if the object has no widget state of its own
     */
    @Override
    public Optional<Boolean> isVisibleTo(ObjectId id, ObjectId ancestor) {
        if (ancestor != null) {
            require(ancestor);
        }
        return effectiveFlag(id, ancestor, true);
    }

    private Optional<Boolean> effectiveFlag(ObjectId id, ObjectId stopAt, boolean visibility) {
        ObjectRecord record = require(id);
        if (record.widgetState == null) {
            return Optional.empty();
        }
        if (!flag(record.widgetState, visibility)) {
            return Optional.of(false);
        }
        ObjectId current = record.parent;
        while (current != null && !current.equals(stopAt)) {
            ObjectRecord ancestor = objects.get(current);
            if (ancestor.widgetState != null && !flag(ancestor.widgetState, visibility)) {
                return Optional.of(false);
            }
            current = ancestor.parent;
        }
        return Optional.of(true);
    }

    private static boolean flag(WidgetState state, boolean visibility) {
        return visibility ? state.visible() : state.enabled();
    }

    // ========================================================================
    // Diagnostics
    // ========================================================================

    /**
     * Render a subtree as indented text, one object per line. The format is for humans only.
     */
    @Override
    public String dumpObjectTree(ObjectId root) {
        require(root);
        StringBuilder output = new StringBuilder();
        Deque<ObjectId> stack = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        stack.push(root);
        depths.push(0);
        while (!stack.isEmpty()) {
            ObjectId current = stack.pop();
            int depth = depths.pop();
            ObjectRecord record = objects.get(current);
            output.append(" ".repeat(depth * treeDumpIndent))
                    .append('[').append(current).append("] ")
                    .append(record.name.isEmpty() ? "(unnamed)" : record.name)
                    .append(" (").append(record.type.getName()).append(")\n");
            for (int i = record.children.size() - 1; i >= 0; i--) {
                stack.push(record.children.get(i));
                depths.push(depth + 1);
            }
        }
        return output.toString();
    }

    private ObjectRecord require(ObjectId id) {
        if (id == null) {
            throw new IllegalArgumentException("id required");
        }
        ObjectRecord record = objects.get(id);
        if (record == null) {
            throw ObjectException.invalidObjectId(id);
        }
        return record;
    }
}
