package com.example.DnsQueryLog.repository;

import com.example.DnsQueryLog.codec.QueryLogEntryCodec;
import com.example.DnsQueryLog.entity.QueryLogEntry;
import com.example.DnsQueryLog.exception.ConsistencyException;
import com.example.DnsQueryLog.exception.DecodeException;
import com.example.DnsQueryLog.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Append-only query log on disk: one active file plus a single rotated backup ({@code <name>.1}).
 * <p>
 * Records inside each file are oldest first. All file operations run under the shared
 * {@link LogFileLock}; encoding and verification happen before the lock is taken.
 */
@Slf4j
public class QueryLogFileStore {

    static final String BACKUP_SUFFIX = ".1";

    private final Path file;
    private final Path backupFile;
    private final LogFileLock fileLock;
    private final QueryLogEntryCodec codec;

    public QueryLogFileStore(Path file, LogFileLock fileLock, QueryLogEntryCodec codec) {
        this.file = file;
        this.backupFile = file.resolveSibling(file.getFileName() + BACKUP_SUFFIX);
        this.fileLock = fileLock;
        this.codec = codec;
    }

    public Path getFile() {
        return file;
    }

    public Path getBackupFile() {
        return backupFile;
    }

    /**
     * Writes {@code entries} to the end of the active file in a single write.
     * Nothing is written unless the encoded batch decodes back to exactly the same entries.
     */
    public void append(List<QueryLogEntry> entries) {
        if (entries.isEmpty()) {
            log.debug("querylog: there's nothing to write to a file");
            return;
        }
        long start = System.nanoTime();
        byte[] data = codec.encodeAll(entries);
        long elapsedMicros = (System.nanoTime() - start) / 1000;
        log.debug("{} entries serialized in {}us: {} kB", entries.size(), elapsedMicros, data.length / 1024);

        verify(entries, data);

        fileLock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(file, data, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new PersistenceException("Couldn't write to file " + file, e);
        } finally {
            fileLock.unlock();
        }
        log.debug("ok \"{}\": {} bytes written", file, data.length);
    }

    private void verify(List<QueryLogEntry> entries, byte[] data) {
        List<QueryLogEntry> decoded = new ArrayList<>(entries.size());
        int skipped = codec.decodeAll(data, decoded::add);
        if (skipped > 0) {
            throw new ConsistencyException("check fail: " + skipped + " encoded records could not be decoded");
        }
        if (decoded.size() != entries.size()) {
            throw new ConsistencyException("check fail: " + entries.size() + " vs " + decoded.size() + " entries");
        }
        for (int i = 0; i < entries.size(); i++) {
            if (!entries.get(i).equals(decoded.get(i))) {
                throw new ConsistencyException("decoded buffer differs at entry " + i
                        + ": " + entries.get(i) + " vs " + decoded.get(i));
            }
        }
        log.debug("check ok: {} entries", decoded.size());
    }

    /**
     * Moves the active file into the backup slot, replacing any earlier backup.
     * Does nothing when there is no active file.
     */
    public void rotate() {
        fileLock.lock();
        try {
            if (Files.notExists(file)) {
                return;
            }
            Files.move(file, backupFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Rotated query log from {} to {}", file, backupFile);
        } catch (IOException e) {
            throw new PersistenceException("Failed to rename query log " + file, e);
        } finally {
            fileLock.unlock();
        }
    }

    public void clear() {
        fileLock.lock();
        try {
            Files.deleteIfExists(file);
            Files.deleteIfExists(backupFile);
            log.info("Query log files {} and {} removed", file, backupFile);
        } catch (IOException e) {
            throw new PersistenceException("Failed to remove query log " + file, e);
        } finally {
            fileLock.unlock();
        }
    }

    /**
     * Reads the active file and then the backup, handing every entry no older than
     * {@code timeWindow} to {@code onEntry} for as long as {@code shouldContinue} allows.
     */
    public ReplayStats replay(Duration timeWindow, Instant now,
                              Consumer<QueryLogEntry> onEntry, BooleanSupplier shouldContinue) {
        ReplayStats stats = new ReplayStats();
        for (Path path : List.of(file, backupFile)) {
            if (!shouldContinue.getAsBoolean()) {
                stats.setStoppedEarly(true);
                break;
            }
            replayFile(path, timeWindow, now, onEntry, shouldContinue, stats);
            if (stats.isStoppedEarly()) {
                break;
            }
        }
        return stats;
    }

    private void replayFile(Path path, Duration timeWindow, Instant now, Consumer<QueryLogEntry> onEntry,
                            BooleanSupplier shouldContinue, ReplayStats stats) {
        if (Files.notExists(path)) {
            return;
        }
        long start = System.nanoTime();
        int accepted = 0;
        Instant oldest = now.minus(timeWindow);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                if (!shouldContinue.getAsBoolean()) {
                    stats.setStoppedEarly(true);
                    break;
                }
                QueryLogEntry entry;
                try {
                    entry = codec.decode(line);
                } catch (DecodeException e) {
                    log.debug("Failed to decode query log record in {}: {}", path, e.getMessage());
                    stats.setSkipped(stats.getSkipped() + 1);
                    continue;
                }
                if (entry.getTime().isBefore(oldest)) {
                    stats.setOutside(stats.getOutside() + 1);
                    continue;
                }
                accepted++;
                onEntry.accept(entry);
            }
        } catch (IOException e) {
            log.error("Failed to read query log file \"{}\": {}", path, e.getMessage());
            return;
        } finally {
            stats.setAccepted(stats.getAccepted() + accepted);
        }
        log.debug("file \"{}\": read {} entries in {}ms", path, accepted, (System.nanoTime() - start) / 1_000_000);
    }
}
