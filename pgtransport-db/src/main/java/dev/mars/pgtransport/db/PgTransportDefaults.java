package dev.mars.pgtransport.db;

import dev.mars.pgtransport.api.connection.IsolationLevel;

import java.time.Duration;

/**
 * Default constants for the PostgreSQL transport.
 *
 * <p>Internal defaults used when a setting is not configured. External code should
 * read effective values from {@link dev.mars.pgtransport.db.config.PostgresHostSettings}
 * rather than from these constants.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-05
 * @version 1.0
 */
public final class PgTransportDefaults {

    public static final String DEFAULT_SCHEMA = "transport";

    public static final IsolationLevel DEFAULT_ISOLATION_LEVEL = IsolationLevel.REPEATABLE_READ;

    public static final Duration DEFAULT_MAINTENANCE_INTERVAL = Duration.ofMinutes(1);

    public static final Duration DEFAULT_QUEUE_CLEANUP_INTERVAL = Duration.ofMinutes(10);

    public static final int DEFAULT_MAINTENANCE_BATCH_SIZE = 10_000;

    /**
     * Attempts made for an operation failing with transient errors, the first one included.
     */
    public static final int DEFAULT_RETRY_ATTEMPTS = 10;

    public static final long LISTEN_RECONNECT_INITIAL_BACKOFF_MS = 1_000;

    public static final long LISTEN_RECONNECT_MAX_BACKOFF_MS = 30_000;

    /**
     * Upper bound on the final metrics and purge calls made when maintenance stops.
     */
    public static final Duration MAINTENANCE_FLUSH_TIMEOUT = Duration.ofSeconds(30);

    private PgTransportDefaults() {
        // Prevent instantiation
    }
}
