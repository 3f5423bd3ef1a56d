package com.example.DnsQueryLog.repository;

import com.example.DnsQueryLog.codec.QueryLogEntryCodec;
import com.example.DnsQueryLog.entity.QueryLogEntry;
import com.example.DnsQueryLog.exception.ConsistencyException;
import com.example.DnsQueryLog.exception.PersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static com.example.DnsQueryLog.QueryLogFixtures.blocked;
import static com.example.DnsQueryLog.QueryLogFixtures.entry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryLogFileStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");
    private static final Duration DAY = Duration.ofDays(1);

    @TempDir
    Path dir;

    private Path file;
    private QueryLogFileStore store;

    @BeforeEach
    void setUp() {
        file = dir.resolve("querylog.json");
        store = new QueryLogFileStore(file, new LogFileLock(), new QueryLogEntryCodec());
    }

    @Test
    void replayAfterRestartReturnsEverythingInOrder() {
        List<QueryLogEntry> batch = List.of(
                entry("one.example", "10.0.0.1", NOW.minusSeconds(30)),
                blocked("ads.example", "10.0.0.2", NOW.minusSeconds(20)),
                entry("two.example", "10.0.0.3", NOW.minusSeconds(10)));
        store.append(batch);

        QueryLogFileStore reopened = new QueryLogFileStore(file, new LogFileLock(), new QueryLogEntryCodec());
        List<QueryLogEntry> replayed = new ArrayList<>();
        ReplayStats stats = reopened.replay(Duration.ofDays(365), NOW, replayed::add, () -> true);

        assertThat(replayed).isEqualTo(batch);
        assertThat(stats.getAccepted()).isEqualTo(3);
        assertThat(stats.isStoppedEarly()).isFalse();
    }

    @Test
    void appendNeverTruncates() {
        QueryLogEntry first = entry("one.example", "10.0.0.1", NOW.minusSeconds(2));
        QueryLogEntry second = entry("two.example", "10.0.0.1", NOW.minusSeconds(1));
        store.append(List.of(first));
        store.append(List.of(second));
        store.append(List.of());

        assertThat(replayAll()).containsExactly(first, second);
    }

    @Test
    void rotateWithoutActiveFileDoesNothing() {
        assertThatCode(store::rotate).doesNotThrowAnyException();
        assertThat(Files.exists(store.getBackupFile())).isFalse();
    }

    @Test
    void rotateKeepsOnlyOneBackup() {
        QueryLogEntry oldest = entry("oldest.example", "10.0.0.1", NOW.minusSeconds(3));
        QueryLogEntry older = entry("older.example", "10.0.0.1", NOW.minusSeconds(2));
        QueryLogEntry current = entry("current.example", "10.0.0.1", NOW.minusSeconds(1));

        store.append(List.of(oldest));
        store.rotate();
        store.append(List.of(older));
        store.rotate();
        store.append(List.of(current));

        assertThat(Files.exists(file)).isTrue();
        assertThat(store.getBackupFile().getFileName().toString()).isEqualTo("querylog.json.1");
        // active file first, then the backup
        assertThat(replayAll()).containsExactly(current, older);
    }

    @Test
    void replaySkipsEntriesOutsideWindow() {
        QueryLogEntry stale = entry("stale.example", "10.0.0.1", NOW.minus(Duration.ofHours(25)));
        QueryLogEntry fresh = entry("fresh.example", "10.0.0.1", NOW.minus(Duration.ofHours(23)));
        store.append(List.of(stale, fresh));

        List<QueryLogEntry> replayed = new ArrayList<>();
        ReplayStats stats = store.replay(DAY, NOW, replayed::add, () -> true);

        assertThat(replayed).containsExactly(fresh);
        assertThat(stats.getOutside()).isEqualTo(1);
    }

    @Test
    void replayStopsWhenCallerHasEnough() {
        store.append(List.of(
                entry("a.example", "10.0.0.1", NOW.minusSeconds(3)),
                entry("b.example", "10.0.0.1", NOW.minusSeconds(2)),
                entry("c.example", "10.0.0.1", NOW.minusSeconds(1))));

        List<QueryLogEntry> replayed = new ArrayList<>();
        ReplayStats stats = store.replay(DAY, NOW, replayed::add, () -> replayed.size() < 2);

        assertThat(replayed).hasSize(2);
        assertThat(stats.isStoppedEarly()).isTrue();
    }

    @Test
    void replaySkipsCorruptRecords() throws IOException {
        QueryLogEntry first = entry("a.example", "10.0.0.1", NOW.minusSeconds(2));
        QueryLogEntry second = entry("b.example", "10.0.0.1", NOW.minusSeconds(1));
        store.append(List.of(first));
        Files.write(file, "{\"time\":\"2024-03-10T11:59:58Z\",\"ques\n\u0000garbage\n".getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.APPEND);
        store.append(List.of(second));

        List<QueryLogEntry> replayed = new ArrayList<>();
        ReplayStats stats = store.replay(DAY, NOW, replayed::add, () -> true);

        assertThat(replayed).containsExactly(first, second);
        assertThat(stats.getSkipped()).isEqualTo(2);
    }

    @Test
    void failedSelfCheckWritesNothing() {
        QueryLogEntryCodec lossy = new QueryLogEntryCodec() {
            @Override
            public int decodeAll(byte[] data, Consumer<QueryLogEntry> onEntry) {
                return super.decodeAll(data, e -> onEntry.accept(
                        QueryLogEntry.builder().time(e.getTime()).question(e.getQuestion()).build()));
            }
        };
        QueryLogFileStore checked = new QueryLogFileStore(file, new LogFileLock(), lossy);

        assertThatThrownBy(() -> checked.append(List.of(entry("a.example", "10.0.0.1", NOW))))
                .isInstanceOf(ConsistencyException.class);
        assertThat(Files.exists(file)).isFalse();
    }

    @Test
    void ioFailureIsReportedAsPersistenceError() throws IOException {
        Path notADirectory = Files.createFile(dir.resolve("blocker"));
        QueryLogFileStore broken = new QueryLogFileStore(notADirectory.resolve("querylog.json"),
                new LogFileLock(), new QueryLogEntryCodec());

        assertThatThrownBy(() -> broken.append(List.of(entry("a.example", "10.0.0.1", NOW))))
                .isInstanceOf(PersistenceException.class);
    }

    @Test
    void clearRemovesBothFiles() {
        store.append(List.of(entry("a.example", "10.0.0.1", NOW)));
        store.rotate();
        store.append(List.of(entry("b.example", "10.0.0.1", NOW)));

        store.clear();

        assertThat(Files.exists(file)).isFalse();
        assertThat(Files.exists(store.getBackupFile())).isFalse();
        assertThat(replayAll()).isEmpty();
    }

    @Test
    void sharedLockIsReleasedAfterEachOperation() {
        LogFileLock lock = new LogFileLock();
        QueryLogFileStore first = new QueryLogFileStore(file, lock, new QueryLogEntryCodec());
        QueryLogFileStore second = new QueryLogFileStore(file, lock, new QueryLogEntryCodec());

        first.append(List.of(entry("a.example", "10.0.0.1", NOW)));
        second.rotate();

        assertThat(lock.isLocked()).isFalse();
        assertThat(Files.exists(first.getBackupFile())).isTrue();
    }

    private List<QueryLogEntry> replayAll() {
        List<QueryLogEntry> replayed = new ArrayList<>();
        store.replay(Duration.ofDays(3650), NOW, replayed::add, () -> true);
        return replayed;
    }
}
