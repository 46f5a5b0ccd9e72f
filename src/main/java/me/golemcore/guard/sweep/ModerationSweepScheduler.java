package me.golemcore.guard.sweep;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.guard.domain.service.ModerationSweepService;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs {@link ModerationSweepService#sweep} on a fixed interval
 * ({@code guard.sweep.interval}).
 *
 * <p>
 * Ticks do not overlap: if a sweep is still running, the next tick is skipped.
 */
@Component
@Slf4j
public class ModerationSweepScheduler {

    private final ModerationSweepService sweepService;
    private final GuardProperties properties;
    private final Clock clock;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public ModerationSweepScheduler(ModerationSweepService sweepService, GuardProperties properties, Clock clock) {
        this.sweepService = sweepService;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (!properties.getSweep().isEnabled()) {
            log.info("[Sweep] Periodic sweep disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "guard-sweep");
            t.setDaemon(true);
            return t;
        });

        long intervalMillis = properties.getSweep().getInterval().toMillis();
        tickTask = scheduler.scheduleAtFixedRate(this::tick, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("[Sweep] Started with interval: {}", properties.getSweep().getInterval());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Sweep] Shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Sweep] Tick skipped: previous sweep still in progress");
            return;
        }
        try {
            sweepService.sweep(clock.instant());
        } catch (Exception e) { // NOSONAR - must not kill scheduler thread
            log.error("[Sweep] Sweep failed", e);
        } finally {
            executing.set(false);
        }
    }

    boolean isRunning() {
        return tickTask != null && !tickTask.isCancelled();
    }
}
