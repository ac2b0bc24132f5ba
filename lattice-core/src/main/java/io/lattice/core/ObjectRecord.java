package io.lattice.core;

import io.lattice.kernel.ObjectId;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry-owned state of one live object. Never handed out.
 */
final class ObjectRecord {
    final Class<? extends LatticeObject> type;
    String name = "";
    ObjectId parent;
    final List<ObjectId> children = new ArrayList<>();
    final Map<String, Object> properties = new LinkedHashMap<>();
    WidgetState widgetState;

    ObjectRecord(Class<? extends LatticeObject> type) {
        this.type = type;
    }
}
