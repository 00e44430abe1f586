/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */
package dev.mars.pgtransport.db.maintenance;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Random;

/**
 * Jittered cadence of the maintenance loop.
 *
 * <p>Each interval is its base plus a random jitter in {@code [0, base / 10)} so that
 * cooperating instances drift apart instead of running maintenance at the same moment.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class MaintenanceSchedule {

    private final Duration maintenanceInterval;
    private final Duration queueCleanupInterval;
    private final Clock clock;
    private final Random random;

    private Instant lastPurgeTime;
    private Duration cleanupInterval;

    public MaintenanceSchedule(Duration maintenanceInterval, Duration queueCleanupInterval) {
        this(maintenanceInterval, queueCleanupInterval, Clock.systemUTC(), new Random());
    }

    public MaintenanceSchedule(Duration maintenanceInterval, Duration queueCleanupInterval, Clock clock, Random random) {
        this.maintenanceInterval = Objects.requireNonNull(maintenanceInterval, "maintenanceInterval cannot be null");
        this.queueCleanupInterval = Objects.requireNonNull(queueCleanupInterval, "queueCleanupInterval cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.random = Objects.requireNonNull(random, "random cannot be null");
        this.cleanupInterval = withJitter(queueCleanupInterval, random);
    }

    /**
     * @return the delay before the next maintenance cycle
     */
    public synchronized Duration nextMaintenanceInterval() {
        return withJitter(maintenanceInterval, random);
    }

    /**
     * @return true if no purge has run yet or the current cleanup interval has elapsed since the last one
     */
    public synchronized boolean isPurgeDue() {
        if (lastPurgeTime == null) {
            return true;
        }
        return Duration.between(lastPurgeTime, clock.instant()).compareTo(cleanupInterval) >= 0;
    }

    /**
     * Records a completed purge and draws the interval until the next one.
     */
    public synchronized void recordPurge() {
        lastPurgeTime = clock.instant();
        cleanupInterval = withJitter(queueCleanupInterval, random);
    }

    public synchronized boolean hasPurged() {
        return lastPurgeTime != null;
    }

    public synchronized Instant getLastPurgeTime() {
        return lastPurgeTime;
    }

    public synchronized Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * @return {@code base} plus a jitter in {@code [0, base / 10)} milliseconds; no jitter when that bound is zero
     */
    static Duration withJitter(Duration base, Random random) {
        long bound = base.toMillis() / 10;
        if (bound <= 0) {
            return base;
        }
        return base.plusMillis((long) (random.nextDouble() * bound));
    }
}
