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

import dev.mars.pgtransport.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MaintenanceSchedule}, driving a simulated clock.
 */
@Tag(TestCategories.CORE)
class MaintenanceScheduleTest {

    private static final Duration MAINTENANCE = Duration.ofSeconds(60);
    private static final Duration CLEANUP = Duration.ofMinutes(10);

    @Test
    void twentyMinuteRunKeepsJitteredCadence() {
        MutableClock clock = new MutableClock(Instant.parse("2025-07-13T00:00:00Z"));
        MaintenanceSchedule schedule = new MaintenanceSchedule(MAINTENANCE, CLEANUP, clock, new Random(17));
        Instant end = clock.instant().plus(Duration.ofMinutes(20));

        List<Instant> purges = new ArrayList<>();
        int cycles = 0;
        while (true) {
            Duration interval = schedule.nextMaintenanceInterval();
            assertTrue(interval.compareTo(MAINTENANCE) >= 0, "interval below base: " + interval);
            assertTrue(interval.compareTo(Duration.ofSeconds(66)) < 0, "interval above jitter bound: " + interval);

            clock.advance(interval);
            if (clock.instant().isAfter(end)) {
                break;
            }
            cycles++;

            if (schedule.isPurgeDue()) {
                Duration cleanupBefore = schedule.getCleanupInterval();
                Instant previous = schedule.getLastPurgeTime();
                schedule.recordPurge();

                if (previous != null) {
                    assertTrue(schedule.getLastPurgeTime().isAfter(previous));
                    assertTrue(Duration.between(previous, schedule.getLastPurgeTime()).compareTo(cleanupBefore) >= 0);
                }
                purges.add(schedule.getLastPurgeTime());
            }
        }

        assertTrue(cycles >= 18 && cycles <= 20, "unexpected cycle count " + cycles);
        // First cycle purges, then roughly every ten minutes
        assertTrue(purges.size() >= 2 && purges.size() <= 3, "unexpected purge count " + purges.size());
        for (int i = 1; i < purges.size(); i++) {
            assertTrue(Duration.between(purges.get(i - 1), purges.get(i)).compareTo(CLEANUP) >= 0);
        }
    }

    @Test
    void firstCheckIsAlwaysDue() {
        MaintenanceSchedule schedule = new MaintenanceSchedule(MAINTENANCE, CLEANUP);

        assertFalse(schedule.hasPurged());
        assertTrue(schedule.isPurgeDue());

        schedule.recordPurge();

        assertTrue(schedule.hasPurged());
        assertFalse(schedule.isPurgeDue());
    }

    @Test
    void cleanupIntervalIsRedrawnAfterEachPurge() {
        MutableClock clock = new MutableClock(Instant.EPOCH);
        MaintenanceSchedule schedule = new MaintenanceSchedule(MAINTENANCE, CLEANUP, clock, new Random(3));

        for (int i = 0; i < 50; i++) {
            schedule.recordPurge();
            Duration cleanup = schedule.getCleanupInterval();
            assertTrue(cleanup.compareTo(CLEANUP) >= 0);
            assertTrue(cleanup.compareTo(Duration.ofMinutes(11)) < 0);
            clock.advance(Duration.ofSeconds(1));
        }
    }

    @Test
    void tinyIntervalsHaveNoJitter() {
        Duration base = Duration.ofMillis(5);
        assertEquals(base, MaintenanceSchedule.withJitter(base, new Random()));
        assertEquals(Duration.ZERO, MaintenanceSchedule.withJitter(Duration.ZERO, new Random()));
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
