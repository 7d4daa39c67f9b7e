package com.queryplatform.core.dependency;

import com.queryplatform.core.model.QueryKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyManagerTest {

    private static final QueryKey USER  = QueryKey.of("user", 1);
    private static final QueryKey POSTS = QueryKey.of("user", 1, "posts");
    private static final QueryKey POST  = QueryKey.of("post", 7);
    private static final QueryKey TEAM  = QueryKey.of("team", 3);

    private DependencyManager manager;

    @BeforeEach
    void setUp() {
        manager = new DependencyManager();
    }

    @Test
    @DisplayName("self-dependency → IllegalArgumentException")
    void selfDependency_rejected() {
        assertThrows(IllegalArgumentException.class, () -> manager.registerDependency(USER, USER));
    }

    @Test
    @DisplayName("A→B then B→A → cycle rejected, graph unchanged")
    void directCycle_rejected() {
        manager.registerDependency(POSTS, USER);

        assertThrows(IllegalArgumentException.class, () -> manager.registerDependency(USER, POSTS));
        assertEquals(Optional.empty(), manager.getParent(USER));
        assertEquals(1, manager.relationshipCount());
    }

    @Test
    @DisplayName("3-node chain closed into a loop → rejected")
    void transitiveCycle_rejected() {
        manager.registerDependency(POSTS, USER);
        manager.registerDependency(POST, POSTS);

        assertThrows(IllegalArgumentException.class, () -> manager.registerDependency(USER, POST));
    }

    @Test
    @DisplayName("re-register with new parent → moved off the old one")
    void reRegister_movesChild() {
        manager.registerDependency(POST, USER);
        manager.registerDependency(POST, TEAM);

        assertEquals(Set.of(), manager.getChildren(USER));
        assertEquals(Set.of(POST), manager.getChildren(TEAM));
        assertEquals(Optional.of(TEAM), manager.getParent(POST));
    }

    @Test
    @DisplayName("descendants → whole subtree, node itself excluded")
    void descendants_transitive() {
        manager.registerDependency(POSTS, USER);
        manager.registerDependency(POST, POSTS);
        manager.registerDependency(TEAM, USER);

        assertEquals(Set.of(POSTS, POST, TEAM), manager.getAllDescendants(USER));
    }

    @Test
    @DisplayName("notifyParentDisposed → direct children only")
    void notify_directChildrenOnly() {
        manager.registerDependency(POSTS, USER);
        manager.registerDependency(POST, POSTS);
        List<QueryKey> notified = new ArrayList<>();

        manager.notifyParentDisposed(USER, notified::add);

        assertEquals(List.of(POSTS), notified);
    }

    @Test
    @DisplayName("throwing callback → remaining children still notified")
    void notify_callbackFailureContained() {
        manager.registerDependency(POSTS, USER);
        manager.registerDependency(TEAM, USER);
        List<QueryKey> notified = new ArrayList<>();

        manager.notifyParentDisposed(USER, child -> {
            notified.add(child);
            throw new IllegalStateException("boom");
        });

        assertEquals(2, notified.size());
    }

    @Test
    @DisplayName("unregister → edges both ways removed, children orphaned")
    void unregister_orphansChildren() {
        manager.registerDependency(USER, TEAM);
        manager.registerDependency(POSTS, USER);

        manager.unregister(USER);

        assertEquals(Set.of(), manager.getChildren(TEAM));
        assertEquals(Optional.empty(), manager.getParent(POSTS));
        assertEquals(0, manager.relationshipCount());
    }
}
