package io.lattice.core;

import io.lattice.kernel.ObjectId;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Query-only side of an {@link ObjectRegistry}.
 * <p>
 * Handed to {@link SharedObjectRegistry#withRead(java.util.function.Function)} callbacks,
 * which run under the shared read lock and therefore must not mutate the graph.
 * Every method throws {@link ObjectException} with {@link ObjectError#INVALID_OBJECT_ID}
 * when an identifier does not resolve.
 */
public interface ObjectRegistryView {

    boolean contains(ObjectId id);

    int objectCount();

    boolean isAncestorOf(ObjectId candidate, ObjectId id);

    Optional<ObjectId> parent(ObjectId id);

    List<ObjectId> children(ObjectId id);

    List<ObjectId> ancestors(ObjectId id);

    List<ObjectId> rootObjects();

    OptionalInt siblingIndex(ObjectId id);

    Optional<ObjectId> nextSibling(ObjectId id);

    Optional<ObjectId> previousSibling(ObjectId id);

    List<ObjectId> siblings(ObjectId id);

    List<ObjectId> depthFirstPreorder(ObjectId root);

    List<ObjectId> depthFirstPostorder(ObjectId root);

    List<ObjectId> breadthFirst(ObjectId root);

    String objectName(ObjectId id);

    Optional<ObjectId> findChildByName(ObjectId id, String name);

    Optional<ObjectId> findChild(ObjectId id, String name, Class<? extends LatticeObject> type);

    List<ObjectId> findChildrenByType(ObjectId id, Class<? extends LatticeObject> type);

    List<ObjectId> findDescendantsByName(ObjectId id, String name);

    Class<? extends LatticeObject> typeId(ObjectId id);

    String typeName(ObjectId id);

    <T> Optional<T> dynamicProperty(ObjectId id, String key, Class<T> type);

    <T> T requireDynamicProperty(ObjectId id, String key, Class<T> type);

    List<String> dynamicPropertyNames(ObjectId id);

    Optional<WidgetState> widgetState(ObjectId id);

    Optional<Boolean> isEffectivelyVisible(ObjectId id);

    Optional<Boolean> isEffectivelyEnabled(ObjectId id);

    Optional<Boolean> isVisibleTo(ObjectId id, ObjectId ancestor);

    String dumpObjectTree(ObjectId root);
}
