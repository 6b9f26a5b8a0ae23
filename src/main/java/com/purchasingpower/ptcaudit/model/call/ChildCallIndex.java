package com.purchasingpower.ptcaudit.model.call;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Insertion-ordered grouping of pass-through calls by parent agent call id.
 *
 * <p>{@link #childrenOf(String)} never creates a key: an unknown parent simply
 * yields an empty list.
 */
public final class ChildCallIndex {

    private final Map<String, List<ClassifiedCall>> byParent = new LinkedHashMap<>();

    /**
     * Append {@code child} to the children of {@code parentId}, creating the
     * group on first use.
     */
    public void append(String parentId, ClassifiedCall child) {
        byParent.computeIfAbsent(parentId, k -> new ArrayList<>()).add(child);
    }

    /**
     * @return children of the parent in append order, empty if none
     */
    public List<ClassifiedCall> childrenOf(String parentId) {
        List<ClassifiedCall> children = byParent.get(parentId);
        return children != null ? List.copyOf(children) : List.of();
    }

    public int size() {
        return byParent.values().stream().mapToInt(List::size).sum();
    }
}
