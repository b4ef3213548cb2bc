package com.smurthy.ai.insights.session;

import com.smurthy.ai.insights.exception.SessionNotFoundException;
import com.smurthy.ai.insights.exception.SessionStoreLockedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;

/**
 * Base for SQLite-backed cookie stores.
 *
 * The browser keeps its database open while running, so the file (plus its WAL, if any) is copied
 * to a temporary directory and the copy is queried. The original is only ever read.
 */
public abstract class SqliteCookieStoreReader implements CookieStoreReader {

    private static final Logger log = LoggerFactory.getLogger(SqliteCookieStoreReader.class);

    @Override
    public final List<CookieRecord> read(BrowserProfile profile, Path store, String domain) {
        if (!Files.isRegularFile(store)) {
            throw new SessionNotFoundException(profile.displayName() + " cookie store not found at " + store);
        }

        Path snapshotDir = null;
        SingleConnectionDataSource dataSource = null;
        try {
            snapshotDir = Files.createTempDirectory("insights-cookies-");
            Path snapshot = snapshot(store, snapshotDir);

            dataSource = new SingleConnectionDataSource("jdbc:sqlite:" + snapshot.toAbsolutePath(), true);
            JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);

            List<CookieRecord> cookies = query(jdbcTemplate, profile, domain);
            log.debug("Read {} cookies for {} from {} store", cookies.size(), domain, profile.displayName());
            return cookies;

        } catch (NoSuchFileException e) {
            throw new SessionNotFoundException(profile.displayName() + " cookie store disappeared: " + e.getMessage(), e);
        } catch (AccessDeniedException e) {
            throw new SessionNotFoundException(
                    "Permission denied reading " + profile.displayName() + " cookie store " + e.getFile()
                            + ". On macOS, grant Full Disk Access to the terminal or IDE running this server.", e);
        } catch (FileSystemException e) {
            throw new SessionStoreLockedException(
                    profile.displayName() + " cookie store is locked by another process: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new SessionNotFoundException(
                    "Failed to read " + profile.displayName() + " cookie store: " + e.getMessage(), e);
        } catch (DataAccessException e) {
            String reason = e.getMostSpecificCause().getMessage();
            if (looksLocked(reason)) {
                throw new SessionStoreLockedException(
                        profile.displayName() + " cookie store is locked: " + reason, e);
            }
            throw new SessionNotFoundException(
                    profile.displayName() + " cookie store is unreadable: " + reason, e);
        } finally {
            if (dataSource != null) {
                dataSource.destroy();
            }
            deleteQuietly(snapshotDir);
        }
    }

    /**
     * Runs the engine-specific query against the snapshot.
     */
    protected abstract List<CookieRecord> query(JdbcTemplate jdbcTemplate, BrowserProfile profile, String domain);

    protected static String subdomainPattern(String domain) {
        return "%." + domain;
    }

    private Path snapshot(Path store, Path snapshotDir) throws IOException {
        Path copy = snapshotDir.resolve(store.getFileName().toString());
        Files.copy(store, copy, StandardCopyOption.REPLACE_EXISTING);

        // Recent writes may still sit in the write-ahead log
        Path wal = store.resolveSibling(store.getFileName() + "-wal");
        if (Files.isRegularFile(wal)) {
            Files.copy(wal, snapshotDir.resolve(wal.getFileName().toString()), StandardCopyOption.REPLACE_EXISTING);
        }
        return copy;
    }

    static boolean looksLocked(String reason) {
        if (reason == null) {
            return false;
        }
        String lower = reason.toLowerCase(Locale.ROOT);
        return lower.contains("locked") || lower.contains("busy") || lower.contains("unable to open");
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null) {
            return;
        }
        try (var files = Files.walk(dir)) {
            files.sorted((a, b) -> b.getNameCount() - a.getNameCount()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.debug("Could not delete snapshot file {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.debug("Could not clean up snapshot directory {}: {}", dir, e.getMessage());
        }
    }
}
