package com.queryplatform.core.dependency;

import com.queryplatform.core.model.QueryKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Parent/child graph between queries. Each child has at most one parent; the graph is kept
 * acyclic by rejecting any edge whose parent is already the child or one of its descendants.
 */
public class DependencyManager {

    private static final Logger log = LoggerFactory.getLogger(DependencyManager.class);

    private final Map<QueryKey, Set<QueryKey>> children = new HashMap<>();
    private final Map<QueryKey, QueryKey> parents = new HashMap<>();

    /**
     * Makes {@code child} depend on {@code parent}, moving it off any previous parent.
     *
     * @throws IllegalArgumentException on self-dependency or when the edge would close a cycle
     */
    public synchronized void registerDependency(QueryKey child, QueryKey parent) {
        if (child.equals(parent)) {
            throw new IllegalArgumentException("Query cannot depend on itself: " + child);
        }
        // walking up from parent must never reach child
        for (QueryKey cursor = parent; cursor != null; cursor = parents.get(cursor)) {
            if (cursor.equals(child)) {
                throw new IllegalArgumentException(
                    "Dependency " + child + " -> " + parent + " would create a cycle");
            }
        }
        QueryKey previous = parents.put(child, parent);
        if (previous != null && !previous.equals(parent)) {
            detachChild(previous, child);
        }
        children.computeIfAbsent(parent, k -> new LinkedHashSet<>()).add(child);
        log.debug("DEPENDENCY_REGISTERED child={} parent={} previousParent={}", child, parent, previous);
    }

    public synchronized Set<QueryKey> getChildren(QueryKey parent) {
        return Set.copyOf(children.getOrDefault(parent, Set.of()));
    }

    public synchronized Optional<QueryKey> getParent(QueryKey child) {
        return Optional.ofNullable(parents.get(child));
    }

    /**
     * Transitive closure below {@code node}, breadth first. Does not include {@code node}.
     */
    public synchronized Set<QueryKey> getAllDescendants(QueryKey node) {
        Set<QueryKey> result = new LinkedHashSet<>();
        Deque<QueryKey> queue = new ArrayDeque<>(children.getOrDefault(node, Set.of()));
        while (!queue.isEmpty()) {
            QueryKey next = queue.removeFirst();
            if (result.add(next)) {
                queue.addAll(children.getOrDefault(next, Set.of()));
            }
        }
        return result;
    }

    /**
     * Invokes {@code onChild} for each direct child of {@code parent}. The callback runs outside
     * the manager's monitor, so it may call back into the manager.
     */
    public void notifyParentDisposed(QueryKey parent, Consumer<QueryKey> onChild) {
        List<QueryKey> direct;
        synchronized (this) {
            direct = List.copyOf(children.getOrDefault(parent, Set.of()));
        }
        for (QueryKey child : direct) {
            try {
                onChild.accept(child);
            } catch (RuntimeException e) {
                log.warn("DEPENDENCY_NOTIFY_FAILED parent={} child={}: {}", parent, child, e.getMessage(), e);
            }
        }
    }

    /**
     * Removes {@code node} as both parent and child. Its former children are orphaned.
     */
    public synchronized void unregister(QueryKey node) {
        QueryKey parent = parents.remove(node);
        if (parent != null) {
            detachChild(parent, node);
        }
        Set<QueryKey> orphans = children.remove(node);
        if (orphans != null) {
            orphans.forEach(parents::remove);
        }
    }

    public synchronized int relationshipCount() {
        return parents.size();
    }

    public synchronized void clear() {
        children.clear();
        parents.clear();
    }

    private void detachChild(QueryKey parent, QueryKey child) {
        Set<QueryKey> siblings = children.get(parent);
        if (siblings != null) {
            siblings.remove(child);
            if (siblings.isEmpty()) {
                children.remove(parent);
            }
        }
    }
}
