package me.golemcore.guard.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.guard.domain.model.ProfileKey;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Serializes moderation work per user.
 *
 * <p>
 * Each {@link ProfileKey} gets a runner with a FIFO queue; at most one task per
 * key runs at a time on the shared moderation executor, while different keys
 * run in parallel without a shared lock. A runner removes itself once idle.
 * When a queue holds {@code guard.concurrency.max-queued-per-user} tasks the
 * oldest waiting task is rejected.
 */
@Service
@Slf4j
public class UserModerationCoordinator {

    private final Executor moderationExecutor;
    private final int maxQueuedPerUser;

    private final Map<ProfileKey, UserRunner> runners = new ConcurrentHashMap<>();

    public UserModerationCoordinator(@Qualifier("moderationExecutor") Executor moderationExecutor,
            GuardProperties properties) {
        this.moderationExecutor = moderationExecutor;
        this.maxQueuedPerUser = properties.getConcurrency().getMaxQueuedPerUser();
    }

    public <T> CompletableFuture<T> submit(ProfileKey key, Supplier<T> work) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(work, "work");
        QueuedTask<T> task = new QueuedTask<>(work);
        while (true) {
            UserRunner runner = runners.computeIfAbsent(key, UserRunner::new);
            if (runner.enqueue(task)) {
                return task.future;
            }
        }
    }

    int activeRunners() {
        return runners.size();
    }

    private final class UserRunner {

        private final ProfileKey key;
        private final Object lock = new Object();
        private final Deque<QueuedTask<?>> queue = new ArrayDeque<>();

        private boolean running;
        private boolean retired;

        private UserRunner(ProfileKey key) {
            this.key = key;
        }

        boolean enqueue(QueuedTask<?> task) {
            QueuedTask<?> dropped = null;
            boolean startNow = false;
            synchronized (lock) {
                if (retired) {
                    return false;
                }
                if (running) {
                    if (queue.size() >= maxQueuedPerUser) {
                        dropped = queue.removeFirst();
                    }
                    queue.addLast(task);
                } else {
                    running = true;
                    startNow = true;
                }
            }
            if (dropped != null) {
                log.warn("[Moderation] Queue limit reached ({}) for {}, dropped oldest pending task",
                        maxQueuedPerUser, key);
                dropped.future.completeExceptionally(new RejectedExecutionException(
                        "Moderation queue full for " + key));
            }
            if (startNow) {
                start(task);
            }
            return true;
        }

        private void start(QueuedTask<?> task) {
            try {
                moderationExecutor.execute(() -> runAndContinue(task));
            } catch (RejectedExecutionException e) {
                task.future.completeExceptionally(e);
                onTaskComplete();
            }
        }

        private void runAndContinue(QueuedTask<?> task) {
            try {
                task.run();
            } finally {
                onTaskComplete();
            }
        }

        private void onTaskComplete() {
            QueuedTask<?> next;
            synchronized (lock) {
                next = queue.pollFirst();
                if (next == null) {
                    running = false;
                    retired = true;
                }
            }
            if (next != null) {
                start(next);
                return;
            }
            if (runners.remove(key, this)) {
                log.trace("[Moderation] Evicted idle runner for {}", key);
            }
        }
    }

    private static final class QueuedTask<T> {

        private final Supplier<T> work;
        private final CompletableFuture<T> future = new CompletableFuture<>();

        private QueuedTask(Supplier<T> work) {
            this.work = work;
        }

        void run() {
            if (future.isDone()) {
                return;
            }
            try {
                future.complete(work.get());
            } catch (Exception e) { // NOSONAR - must not kill executor thread
                log.error("[Moderation] Task failed: {}", e.getMessage(), e);
                future.completeExceptionally(e);
            }
        }
    }
}
