package me.golemcore.guard.domain.service;

import me.golemcore.guard.domain.model.ProfileKey;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class UserModerationCoordinatorTest {

    private static final ProfileKey ALICE = ProfileKey.of("guild-1", "alice");
    private static final ProfileKey BOB = ProfileKey.of("guild-1", "bob");

    private GuardProperties properties;
    private ExecutorService executor;
    private UserModerationCoordinator coordinator;

    @BeforeEach
    void setUp() {
        properties = new GuardProperties();
        executor = Executors.newFixedThreadPool(4);
        coordinator = new UserModerationCoordinator(executor, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void tasksForOneUserRunInSubmissionOrderWithoutOverlap() {
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        List<CompletableFuture<Integer>> futures = new ArrayList<>();

        for (int i = 0; i < 50; i++) {
            int index = i;
            futures.add(coordinator.submit(ALICE, () -> {
                maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
                order.add(index);
                concurrent.decrementAndGet();
                return index;
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<Integer> expected = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            expected.add(i);
        }
        assertEquals(expected, order);
        assertEquals(1, maxConcurrent.get());
    }

    @Test
    void differentUsersRunInParallel() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);

        CompletableFuture<Boolean> alice = coordinator.submit(ALICE, () -> awaitLatch(bothStarted));
        CompletableFuture<Boolean> bob = coordinator.submit(BOB, () -> awaitLatch(bothStarted));

        assertTrue(alice.get(5, TimeUnit.SECONDS));
        assertTrue(bob.get(5, TimeUnit.SECONDS));
    }

    @Test
    void failingTaskDoesNotBlockQueue() {
        CompletableFuture<Integer> failing = coordinator.submit(ALICE, () -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<Integer> next = coordinator.submit(ALICE, () -> 7);

        CompletionException error = assertThrows(CompletionException.class, failing::join);
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals(7, next.join());
    }

    @Test
    void queueOverflowDropsOldestPendingTask() throws Exception {
        properties.getConcurrency().setMaxQueuedPerUser(2);
        coordinator = new UserModerationCoordinator(executor, properties);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Boolean> running = coordinator.submit(ALICE, () -> blockOn(release));
        CompletableFuture<Integer> first = coordinator.submit(ALICE, () -> 1);
        CompletableFuture<Integer> second = coordinator.submit(ALICE, () -> 2);
        CompletableFuture<Integer> third = coordinator.submit(ALICE, () -> 3);
        release.countDown();

        assertTrue(running.get(5, TimeUnit.SECONDS));
        CompletionException error = assertThrows(CompletionException.class, first::join);
        assertInstanceOf(RejectedExecutionException.class, error.getCause());
        assertEquals(2, second.join());
        assertEquals(3, third.join());
    }

    @Test
    void idleRunnersAreReleased() throws Exception {
        coordinator.submit(ALICE, () -> 1).get(5, TimeUnit.SECONDS);
        coordinator.submit(BOB, () -> 2).get(5, TimeUnit.SECONDS);

        long deadline = System.currentTimeMillis() + 5000;
        while (coordinator.activeRunners() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(0, coordinator.activeRunners());
    }

    private static boolean awaitLatch(CountDownLatch latch) {
        latch.countDown();
        return blockOn(latch);
    }

    private static boolean blockOn(CountDownLatch latch) {
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
