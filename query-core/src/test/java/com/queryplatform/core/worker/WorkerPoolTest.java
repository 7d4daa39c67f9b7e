package com.queryplatform.core.worker;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        pool = new WorkerPool(2);
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    @DisplayName("task → runs on a pool thread")
    void execute_onWorkerThread() {
        String thread = pool.execute(input -> Thread.currentThread().getName(), "ignored").block(TIMEOUT);

        assertTrue(thread.startsWith("query-worker-"));
    }

    @Test
    @DisplayName("throwing task → WorkerExecutionException with original cause")
    void execute_wrapsFailure() {
        StepVerifier.create(pool.execute(input -> {
                throw new IllegalArgumentException("bad payload: " + input);
            }, "x"))
            .expectErrorSatisfies(e -> {
                assertTrue(e instanceof WorkerExecutionException);
                assertTrue(e.getCause() instanceof IllegalArgumentException);
            })
            .verify(TIMEOUT);
    }

    @Test
    @DisplayName("lazy → nothing pending until subscribed")
    void execute_lazy() {
        pool.execute(String::length, "abc");

        assertEquals(0, pool.pendingTasks());
    }

    @Test
    @DisplayName("close → shut down")
    void close_shutsDown() {
        pool.close();

        assertTrue(pool.isShutdown());
    }

    @Test
    @DisplayName("size 0 → IllegalArgumentException")
    void invalidSize() {
        assertThrows(IllegalArgumentException.class, () -> new WorkerPool(0));
    }
}
