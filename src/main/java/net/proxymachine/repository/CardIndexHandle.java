package net.proxymachine.repository;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.proxymachine.exception.DatabaseUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Owns the connection pool over the live index file and coordinates readers with the
 * single rebuild writer. Readers run under the read lock; a rebuild swaps a fully built
 * staging file into place under the write lock, so a query sees either the old or the new
 * index, never a mix.
 * <p>
 * The pool opens lazily on first read and is reopened after every swap.
 */
public class CardIndexHandle implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CardIndexHandle.class);

    private static final String STAGING_SUFFIX = ".staging";
    private static final List<String> SQLITE_SIDECAR_SUFFIXES = List.of("-journal", "-wal", "-shm");

    private final Path databasePath;
    private final int readerPoolSize;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final Object openMonitor = new Object();
    private volatile Generation generation;
    private final AtomicLong swaps = new AtomicLong();

    public CardIndexHandle(Path databasePath, int readerPoolSize) {
        this.databasePath = databasePath.toAbsolutePath().normalize();
        this.readerPoolSize = readerPoolSize;
    }

    /**
     * Runs read-only work against the current index generation.
     *
     * @throws DatabaseUnavailableException when the index is missing, has an incompatible
     *         schema, or fails while being read
     */
    public <T> T read(Function<IndexSession, T> work) {
        lock.readLock().lock();
        try {
            Generation current = currentGeneration();
            try {
                return work.apply(current.session());
            } catch (DataAccessException ex) {
                throw new DatabaseUnavailableException(databasePath, "query failed: " + ex.getMostSpecificCause().getMessage(), ex);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Whether the index can currently be opened and read.
     */
    public boolean isAvailable() {
        try {
            return read(session -> Boolean.TRUE);
        } catch (DatabaseUnavailableException ex) {
            log.debug("Card index not available: {}", ex.getMessage());
            return false;
        }
    }

    /**
     * Location where a rebuild writes the next generation before it is swapped in.
     */
    public Path stagingPath() {
        return databasePath.resolveSibling(databasePath.getFileName() + STAGING_SUFFIX);
    }

    /**
     * Counts completed swaps. It is bumped under the write lock, so a reader that sees
     * {@code n} reads generation {@code n} or a later one.
     */
    public long generationNumber() {
        return swaps.get();
    }

    public Path databasePath() {
        return databasePath;
    }

    /**
     * Atomically replaces the live index with a fully built staging file. Waits for
     * in-flight readers to finish; new readers block until the swap completes.
     */
    public void replaceWith(Path stagedDatabase) {
        lock.writeLock().lock();
        try {
            closeGeneration();
            Path parent = databasePath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            for (String suffix : SQLITE_SIDECAR_SUFFIXES) {
                Files.deleteIfExists(databasePath.resolveSibling(databasePath.getFileName() + suffix));
            }
            try {
                Files.move(stagedDatabase, databasePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                log.warn("Atomic move unsupported for {}, falling back to replace", databasePath);
                Files.move(stagedDatabase, databasePath, StandardCopyOption.REPLACE_EXISTING);
            }
            long number = swaps.incrementAndGet();
            log.info("Swapped card index generation {} into {}", number, databasePath);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to swap staged index " + stagedDatabase + " into " + databasePath, ex);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            closeGeneration();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Generation currentGeneration() {
        Generation current = generation;
        if (current != null) {
            return current;
        }
        synchronized (openMonitor) {
            if (generation == null) {
                generation = openGeneration();
            }
            return generation;
        }
    }

    private Generation openGeneration() {
        if (!Files.isRegularFile(databasePath)) {
            throw new DatabaseUnavailableException(databasePath, "index file not found");
        }

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:sqlite:" + databasePath);
        config.setPoolName("card-index-reader");
        config.setMaximumPoolSize(readerPoolSize);
        config.setMinimumIdle(1);

        HikariDataSource dataSource = null;
        try {
            dataSource = new HikariDataSource(config);
            JdbcTemplate jdbc = new JdbcTemplate(dataSource);
            String version = jdbc.queryForObject(
                "SELECT value FROM metadata WHERE key = ?", String.class, CardIndexSchema.META_SCHEMA_VERSION);
            if (!String.valueOf(CardIndexSchema.SCHEMA_VERSION).equals(version)) {
                throw new DatabaseUnavailableException(databasePath,
                    "schema version " + version + " does not match expected " + CardIndexSchema.SCHEMA_VERSION);
            }
            Integer ftsTables = jdbc.queryForObject(
                "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = ?", Integer.class, CardIndexSchema.FTS_TABLE);
            boolean ftsEnabled = ftsTables != null && ftsTables > 0;
            log.info("Opened card index {} (schema={}, fts={})", databasePath, version, ftsEnabled);
            return new Generation(dataSource, new IndexSession(jdbc, ftsEnabled));
        } catch (DatabaseUnavailableException ex) {
            closeQuietly(dataSource);
            throw ex;
        } catch (RuntimeException ex) {
            closeQuietly(dataSource);
            throw new DatabaseUnavailableException(databasePath, "index unreadable: " + ex.getMessage(), ex);
        }
    }

    private void closeGeneration() {
        synchronized (openMonitor) {
            Generation current = generation;
            generation = null;
            if (current != null) {
                closeQuietly(current.dataSource());
                log.debug("Closed card index pool for {}", databasePath);
            }
        }
    }

    private static void closeQuietly(HikariDataSource dataSource) {
        if (dataSource == null) {
            return;
        }
        try {
            dataSource.close();
        } catch (RuntimeException ex) {
            log.warn("Failed to close card index pool: {}", ex.getMessage());
        }
    }

    private record Generation(HikariDataSource dataSource, IndexSession session) {
    }
}
