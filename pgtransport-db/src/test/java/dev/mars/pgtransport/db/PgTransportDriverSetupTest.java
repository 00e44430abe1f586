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
package dev.mars.pgtransport.db;

import dev.mars.pgtransport.test.categories.TestCategories;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class PgTransportDriverSetupTest {

    @Test
    void initializationIsIdempotent() {
        PgTransportDriverSetup.initialize();

        assertFalse(PgTransportDriverSetup.initialize());
        assertTrue(PgTransportDriverSetup.isInitialized());
    }

    @Test
    void javaTimeValuesEncodeAsIsoStrings() {
        PgTransportDriverSetup.initialize();

        JsonObject json = JsonObject.mapFrom(new Stamp(Instant.parse("2025-07-13T10:15:30Z")));

        assertEquals("2025-07-13T10:15:30Z", json.getString("at"));
    }

    public static class Stamp {
        private final Instant at;

        public Stamp(Instant at) {
            this.at = at;
        }

        public Instant getAt() {
            return at;
        }
    }
}
