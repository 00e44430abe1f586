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

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.vertx.core.json.jackson.DatabindCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide, one-time configuration of the database driver.
 *
 * <p>Registers {@code java.time} support on the Vert.x JSON codec so that JSON and JSONB
 * columns decode timestamps consistently. Called by the owning host setup; repeated calls
 * are no-ops.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public final class PgTransportDriverSetup {
    private static final Logger logger = LoggerFactory.getLogger(PgTransportDriverSetup.class);

    private static final AtomicBoolean initialized = new AtomicBoolean(false);

    private PgTransportDriverSetup() {
        // Prevent instantiation
    }

    /**
     * Applies the driver configuration once per process.
     *
     * @return true if this call applied the configuration, false if it was already applied
     */
    public static boolean initialize() {
        if (!initialized.compareAndSet(false, true)) {
            logger.debug("Driver setup already applied, skipping");
            return false;
        }

        DatabindCodec.mapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

        logger.info("Applied PostgreSQL transport driver setup (JavaTimeModule registered on Vert.x codec)");
        return true;
    }

    public static boolean isInitialized() {
        return initialized.get();
    }
}
