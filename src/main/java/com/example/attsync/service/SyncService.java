package com.example.attsync.service;

import com.example.attsync.client.AccessConnectionFactory;
import com.example.attsync.client.AccessEventReader;
import com.example.attsync.client.EventReader;
import com.example.attsync.client.LegacyStoreException;
import com.example.attsync.config.ApplicationConfig;
import com.example.attsync.config.SinkConfig;
import com.example.attsync.config.SyncConfig;
import com.example.attsync.lock.LockHandle;
import com.example.attsync.lock.LockManager;
import com.example.attsync.lock.LockTimeoutException;
import com.example.attsync.model.NormalizedRecord;
import com.example.attsync.model.RawAttendanceEvent;
import com.example.attsync.model.RunOutcome;
import com.example.attsync.model.RunResult;
import com.example.attsync.model.WriteResult;
import com.example.attsync.util.ConnectionFactory;
import com.example.attsync.util.Watermarks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Runs one forwarding pass: takes the store lock, reads punches after the watermark,
 * normalizes them and writes them to the sink, then releases the lock.
 *
 * <p>A row that fails to insert is logged and counted and the batch carries on; the run
 * then ends as {@link RunOutcome#PARTIAL_FAILURE}. Connection and query failures end the
 * run as {@link RunOutcome#ABORTED}. A busy lock ends it as {@link RunOutcome#SKIPPED_BUSY}
 * without any work. The lock and both connections are released on every path.
 */
public class SyncService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SyncService.class);
    private static final int SINK_VALIDATION_TIMEOUT_SECONDS = 5;

    private final SyncConfig config;
    private final Path lockPath;
    private final LockManager lockManager;
    private final ConnectionFactory legacyConnections;
    private final Function<Connection, EventReader> readerFactory;
    private final ConnectionFactory sinkConnections;
    private final Function<Connection, SinkWriter> writerFactory;
    private final EventTransformer transformer;
    private final Clock clock;
    private volatile RunState state = RunState.IDLE;

    public SyncService(SyncConfig config,
                       Path lockPath,
                       LockManager lockManager,
                       ConnectionFactory legacyConnections,
                       Function<Connection, EventReader> readerFactory,
                       ConnectionFactory sinkConnections,
                       Function<Connection, SinkWriter> writerFactory,
                       Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.lockPath = Objects.requireNonNull(lockPath, "lockPath");
        this.lockManager = Objects.requireNonNull(lockManager, "lockManager");
        this.legacyConnections = Objects.requireNonNull(legacyConnections, "legacyConnections");
        this.readerFactory = Objects.requireNonNull(readerFactory, "readerFactory");
        this.sinkConnections = sinkConnections;
        this.writerFactory = Objects.requireNonNull(writerFactory, "writerFactory");
        this.transformer = new EventTransformer(config.clockSkew(), config.getSourceMarker());
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Wires the production collaborators from the application configuration.
     */
    public static SyncService create(ApplicationConfig config) {
        SinkConfig sink = config.getSink();
        ConnectionFactory sinkConnections = sink.getUrl() == null || sink.getUrl().trim().isEmpty()
            ? null
            : ConnectionFactory.forUrl(sink.getUrl().trim(), sink.getUsername(), sink.getPassword());
        return new SyncService(
            config.getSync(),
            config.getLegacy().resolveLockPath(),
            new LockManager(),
            new AccessConnectionFactory(config.getLegacy()),
            AccessEventReader::new,
            sinkConnections,
            connection -> new JdbcSinkWriter(connection, sink.getTable(), sink.isSkipExisting()),
            Clock.systemDefaultZone());
    }

    public RunState getState() {
        return state;
    }

    /**
     * Runs with the configured lookback window and dry-run flag.
     */
    public RunResult run() {
        return run(Watermarks.fromLookback(clock, config.getLookbackDays()), config.isDryRun());
    }

    public RunResult run(LocalDate watermark, boolean dryRun) {
        Objects.requireNonNull(watermark, "watermark");
        Counters counters = new Counters();
        RunResult.Builder result = RunResult.builder()
            .watermark(watermark)
            .dryRun(dryRun)
            .startedAt(clock.instant());
        state = RunState.IDLE;
        LOGGER.info("Starting run after watermark {}{}", watermark, dryRun ? " (dry run)" : "");
        Connection sinkConnection = null;
        try {
            if (!dryRun) {
                sinkConnection = openSink();
            }
            transition(RunState.LOCK_REQUESTED);
            LockHandle handle;
            try {
                handle = lockManager.acquire(lockPath, config.lockTimeout(), config.staleLockAge());
            } catch (LockTimeoutException ex) {
                LOGGER.warn("Access store is busy, skipping this run: {}", ex.getMessage());
                return finish(result, counters, RunOutcome.SKIPPED_BUSY, ex.getMessage());
            }
            try {
                forward(watermark, dryRun, sinkConnection, counters);
            } finally {
                lockManager.release(handle);
            }
            RunOutcome outcome = counters.failed > 0 ? RunOutcome.PARTIAL_FAILURE : RunOutcome.SUCCESS;
            return finish(result, counters, outcome, null);
        } catch (LegacyStoreException | SinkUnavailableException ex) {
            LOGGER.error("Run aborted: {}", ex.getMessage(), ex);
            return finish(result, counters, RunOutcome.ABORTED, ex.getMessage());
        } catch (IOException ex) {
            LOGGER.error("Run aborted, lock {} unusable", lockPath, ex);
            return finish(result, counters, RunOutcome.ABORTED, "Lock directory error: " + ex.getMessage());
        } catch (RuntimeException ex) {
            LOGGER.error("Run aborted by unexpected error", ex);
            return finish(result, counters, RunOutcome.ABORTED, "Unexpected error: " + ex);
        } finally {
            closeQuietly(sinkConnection, "sink");
            state = RunState.RELEASED;
        }
    }

    private void forward(LocalDate watermark, boolean dryRun, Connection sinkConnection, Counters counters) {
        transition(RunState.LOCKED_READING);
        Connection legacy = openLegacy();
        try (Stream<RawAttendanceEvent> events = readerFactory.apply(legacy).fetchSince(watermark);
             SinkWriter writer = dryRun ? new PreviewSinkWriter() : writerFactory.apply(sinkConnection)) {
            transition(RunState.LOCKED_WRITING);
            Iterator<RawAttendanceEvent> iterator = events.iterator();
            while (iterator.hasNext()) {
                RawAttendanceEvent raw = iterator.next();
                counters.read++;
                Optional<NormalizedRecord> record = transformer.normalize(raw);
                if (record.isEmpty()) {
                    counters.dropped++;
                    LOGGER.debug("Dropped punch with badge '{}' from {}", raw.getBadgeId(), raw.getTerminalSerial());
                    continue;
                }
                count(writer.write(record.get()), counters);
            }
        } finally {
            closeQuietly(legacy, "legacy store");
        }
    }

    private void count(WriteResult written, Counters counters) {
        switch (written.getOutcome()) {
            case OK:
                counters.written++;
                break;
            case DUPLICATE:
                counters.skippedExisting++;
                break;
            default:
                counters.failed++;
                LOGGER.warn("Failed to write {}: {}", written.getRecord(), written.getErrorMessage().orElse(""));
                break;
        }
    }

    private Connection openSink() {
        if (sinkConnections == null) {
            throw new SinkUnavailableException("Sink connection is not configured (sink.url)", null);
        }
        Connection connection = null;
        try {
            connection = sinkConnections.open();
            if (!connection.isValid(SINK_VALIDATION_TIMEOUT_SECONDS)) {
                throw new SQLException("Connection is not valid", "08000");
            }
            connection.setAutoCommit(true);
            return connection;
        } catch (SQLException ex) {
            closeQuietly(connection, "sink");
            throw new SinkUnavailableException("Sink unreachable: " + ex.getMessage(), ex);
        }
    }

    private Connection openLegacy() {
        try {
            return legacyConnections.open();
        } catch (SQLException ex) {
            throw new LegacyStoreException(LegacyStoreException.Kind.CONNECTION,
                "Legacy store connection failed: " + ex.getMessage(), ex);
        }
    }

    private void transition(RunState next) {
        LOGGER.debug("{} -> {}", state, next);
        state = next;
    }

    private RunResult finish(RunResult.Builder result, Counters counters, RunOutcome outcome, String errorMessage) {
        return result.outcome(outcome)
            .read(counters.read)
            .dropped(counters.dropped)
            .written(counters.written)
            .failed(counters.failed)
            .skippedExisting(counters.skippedExisting)
            .finishedAt(Instant.now(clock))
            .errorMessage(errorMessage)
            .build();
    }

    private static void closeQuietly(Connection connection, String name) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException ex) {
            LOGGER.warn("Error while closing {} connection", name, ex);
        }
    }

    private static final class Counters {
        private int read;
        private int dropped;
        private int written;
        private int failed;
        private int skippedExisting;
    }
}
