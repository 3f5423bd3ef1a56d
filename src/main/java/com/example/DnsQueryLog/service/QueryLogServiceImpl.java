package com.example.DnsQueryLog.service;

import com.example.DnsQueryLog.cache.RecentQueryCache;
import com.example.DnsQueryLog.config.QueryLogProperties;
import com.example.DnsQueryLog.dto.QueryLogConfigDto;
import com.example.DnsQueryLog.dto.StatsTop;
import com.example.DnsQueryLog.entity.QueryLogEntry;
import com.example.DnsQueryLog.exception.QueryLogException;
import com.example.DnsQueryLog.exception.ValidationException;
import com.example.DnsQueryLog.repository.QueryLogFileStore;
import com.example.DnsQueryLog.repository.QueryLogSettingsStore;
import com.example.DnsQueryLog.repository.ReplayStats;
import com.example.DnsQueryLog.stats.TopStatsAggregator;
import com.example.DnsQueryLog.util.DnsMessages;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

@Slf4j
@Service
public class QueryLogServiceImpl implements QueryLogService {

    public static final List<Integer> SUPPORTED_INTERVAL_HOURS = List.of(24, 7 * 24, 30 * 24, 90 * 24);

    private static final Duration HOUR = Duration.ofHours(1);

    private final QueryLogProperties properties;
    private final QueryLogFileStore fileStore;
    private final QueryLogSettingsStore settingsStore;
    private final RecentQueryCache cache;
    private final TopStatsAggregator topStats;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    // pending entries not yet written; buffer lock is never held during file I/O.
    // flushPending stays set after a failed write so that only the periodic flush retries.
    private final ReentrantLock bufferLock = new ReentrantLock();
    private final ReentrantLock flushLock = new ReentrantLock();
    private List<QueryLogEntry> buffer = new ArrayList<>();
    private boolean flushPending;

    private volatile boolean enabled;
    private volatile int intervalHours;
    private volatile ServiceState state = ServiceState.UNINITIALIZED;

    private ScheduledFuture<?> hourlyTask;
    private ScheduledFuture<?> rotationTask;
    private ScheduledFuture<?> flushTask;

    public QueryLogServiceImpl(QueryLogProperties properties,
                               QueryLogFileStore fileStore,
                               QueryLogSettingsStore settingsStore,
                               RecentQueryCache cache,
                               TopStatsAggregator topStats,
                               TaskScheduler taskScheduler,
                               Clock clock) {
        this.properties = properties;
        this.fileStore = fileStore;
        this.settingsStore = settingsStore;
        this.cache = cache;
        this.topStats = topStats;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.enabled = properties.isEnabled();
        this.intervalHours = properties.getIntervalHours();
    }

    /**
     * Restores saved settings, replays the log files into memory and starts the periodic tasks.
     * Any failure while reading history leaves the service running with empty history.
     */
    @PostConstruct
    public synchronized void start() {
        if (state != ServiceState.UNINITIALIZED) {
            log.warn("Query log service already started, state {}", state);
            return;
        }
        loadSettings();

        Instant now = clock.instant();
        try {
            replayHistory(now);
        } catch (RuntimeException e) {
            log.error("Failed to load entries from querylog, starting with empty history: {}", e.getMessage(), e);
            cache.clear();
            topStats.reset();
        }

        hourlyTask = taskScheduler.scheduleAtFixedRate(this::rotateHour, now.plus(HOUR), HOUR);
        rotationTask = scheduleRotation(now);
        flushTask = taskScheduler.scheduleAtFixedRate(this::periodicFlush,
                now.plus(properties.getFlushPeriod()), properties.getFlushPeriod());

        state = ServiceState.RUNNING;
        log.info("Query log started: enabled={}, interval={}h, file={}", enabled, intervalHours, fileStore.getFile());
    }

    /**
     * Cancels the periodic tasks and writes out everything still pending.
     */
    @PreDestroy
    public synchronized void stop() {
        if (state == ServiceState.STOPPED) {
            return;
        }
        boolean wasRunning = state == ServiceState.RUNNING;
        state = ServiceState.STOPPED;
        cancel(hourlyTask);
        cancel(rotationTask);
        cancel(flushTask);
        if (wasRunning) {
            try {
                flush(true);
            } catch (QueryLogException e) {
                log.error("Final query log flush failed, {} entries lost: {}", pendingCount(), e.getMessage());
            }
        }
        log.info("Query log stopped");
    }

    @Override
    public IngestOutcome ingest(QueryLogEntry entry) {
        if (state != ServiceState.RUNNING || !enabled) {
            return IngestOutcome.DISABLED;
        }
        if (entry == null || entry.getTime() == null || !entry.hasQuestion()) {
            log.warn("entry question is absent, skipping");
            return IngestOutcome.REJECTED;
        }
        Optional<String> name = DnsMessages.queryName(entry.getQuestion());
        if (name.isEmpty()) {
            log.warn("entry from {} has no readable question name, skipping", entry.getClientIp());
            return IngestOutcome.REJECTED;
        }

        boolean needFlush;
        bufferLock.lock();
        try {
            // stop() marks the state before its final flush takes this lock
            if (state != ServiceState.RUNNING) {
                return IngestOutcome.DISABLED;
            }
            cache.append(entry);
            buffer.add(entry);
            needFlush = buffer.size() >= properties.getBufferSize() && !flushPending;
            if (needFlush) {
                flushPending = true;
            }
        } finally {
            bufferLock.unlock();
        }

        topStats.recordEntry(entry, name.get(), clock.instant());

        if (needFlush) {
            taskScheduler.schedule(this::bufferFullFlush, clock.instant());
        }
        return IngestOutcome.ACCEPTED;
    }

    @Override
    public void flush(boolean full) {
        flushLock.lock();
        try {
            List<QueryLogEntry> batch;
            bufferLock.lock();
            try {
                boolean needFlush = buffer.size() >= properties.getBufferSize();
                if (!needFlush && !full) {
                    return;
                }
                batch = buffer;
                buffer = new ArrayList<>();
                flushPending = false;
            } finally {
                bufferLock.unlock();
            }

            try {
                fileStore.append(batch);
            } catch (QueryLogException e) {
                bufferLock.lock();
                try {
                    batch.addAll(buffer);
                    buffer = batch;
                    flushPending = true;
                } finally {
                    bufferLock.unlock();
                }
                log.error("Saving querylog to file failed, {} entries kept for retry: {}", batch.size(), e.getMessage());
                throw e;
            }
        } finally {
            flushLock.unlock();
        }
    }

    @Override
    public List<QueryLogEntry> getEntries() {
        return cache.snapshot();
    }

    @Override
    public StatsTop getTopStats(int hours) {
        return topStats.topStats(hours);
    }

    @Override
    public void setTopStatsHours(int hours) {
        topStats.resize(hours);
    }

    @Override
    public QueryLogConfigDto getConfig() {
        return new QueryLogConfigDto(enabled, intervalHours);
    }

    /**
     * Applies and saves new settings. Unsupported intervals are rejected before anything changes.
     */
    @Override
    public synchronized void configure(QueryLogConfigDto config) {
        if (!SUPPORTED_INTERVAL_HOURS.contains(config.getRetentionIntervalHours())) {
            throw new ValidationException("Unsupported interval: " + config.getRetentionIntervalHours()
                    + " hours, supported: " + SUPPORTED_INTERVAL_HOURS);
        }
        settingsStore.save(config);

        boolean intervalChanged = config.getRetentionIntervalHours() != intervalHours;
        enabled = config.isEnabled();
        intervalHours = config.getRetentionIntervalHours();
        if (intervalChanged && state == ServiceState.RUNNING) {
            cancel(rotationTask);
            rotationTask = scheduleRotation(clock.instant());
        }
        log.info("Query log configured: enabled={}, interval={}h", enabled, intervalHours);

        try {
            flush(true);
        } catch (QueryLogException e) {
            log.error("Query log flush after reconfiguration failed: {}", e.getMessage());
        }
    }

    @Override
    public void clear() {
        cache.clear();
        flushLock.lock();
        try {
            bufferLock.lock();
            try {
                buffer = new ArrayList<>();
                flushPending = false;
            } finally {
                bufferLock.unlock();
            }
            fileStore.clear();
        } finally {
            flushLock.unlock();
        }
        topStats.reset();
        log.info("Query log cleared");
    }

    @Override
    public ServiceState getState() {
        return state;
    }

    int pendingCount() {
        bufferLock.lock();
        try {
            return buffer.size();
        } finally {
            bufferLock.unlock();
        }
    }

    void rotateHour() {
        try {
            topStats.rotateHour();
        } catch (RuntimeException e) {
            log.error("Failed to rotate hourly top: {}", e.getMessage(), e);
        }
    }

    void rotateLogFile() {
        try {
            fileStore.rotate();
        } catch (QueryLogException e) {
            log.error("Failed to rotate querylog: {}", e.getMessage());
        }
    }

    void periodicFlush() {
        try {
            flush(true);
        } catch (QueryLogException e) {
            log.error("Periodic querylog flush failed, retrying on next tick: {}", e.getMessage());
        }
    }

    private void bufferFullFlush() {
        try {
            flush(false);
        } catch (QueryLogException e) {
            log.error("Querylog flush failed, retrying later: {}", e.getMessage());
        }
    }

    private void loadSettings() {
        Optional<QueryLogConfigDto> saved;
        try {
            saved = settingsStore.load();
        } catch (QueryLogException e) {
            log.error("Failed to read query log settings, using defaults: {}", e.getMessage());
            return;
        }
        saved.ifPresent(config -> {
            enabled = config.isEnabled();
            if (SUPPORTED_INTERVAL_HOURS.contains(config.getRetentionIntervalHours())) {
                intervalHours = config.getRetentionIntervalHours();
            } else {
                log.warn("Saved query log interval {}h is not supported, keeping {}h",
                        config.getRetentionIntervalHours(), intervalHours);
            }
        });
    }

    private void replayHistory(Instant now) {
        long start = System.nanoTime();
        // newest memorySize entries; files are each in time order but the active one comes first
        PriorityQueue<QueryLogEntry> newest = new PriorityQueue<>(Comparator.comparing(QueryLogEntry::getTime));
        int[] counted = new int[1];

        ReplayStats stats = fileStore.replay(Duration.ofHours(intervalHours), now, entry -> {
            if (!entry.hasQuestion()) {
                log.debug("entry question is absent, skipping");
                return;
            }
            if (entry.getTime().isAfter(now)) {
                log.debug("t {} vs {} is in the future, ignoring", entry.getTime(), now);
                return;
            }
            Optional<String> name = DnsMessages.queryName(entry.getQuestion());
            if (name.isEmpty()) {
                log.debug("entry question can't be read, skipping");
                return;
            }
            newest.add(entry);
            if (newest.size() > cache.capacity()) {
                newest.poll();
            }
            if (topStats.recordEntry(entry, name.get(), now)) {
                counted[0]++;
            }
        }, () -> true);

        cache.loadAll(newest);
        log.info("Loaded {} query log entries ({} undecodable, {} outside window), {} counted in top stats, in {}ms",
                stats.getAccepted(), stats.getSkipped(), stats.getOutside(), counted[0],
                (System.nanoTime() - start) / 1_000_000);
    }

    private ScheduledFuture<?> scheduleRotation(Instant from) {
        Duration period = Duration.ofHours(intervalHours);
        return taskScheduler.scheduleAtFixedRate(this::rotateLogFile, from.plus(period), period);
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }
}
