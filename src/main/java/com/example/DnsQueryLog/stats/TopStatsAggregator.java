package com.example.DnsQueryLog.stats;

import com.example.DnsQueryLog.dto.StatsTop;
import com.example.DnsQueryLog.entity.QueryLogEntry;
import com.example.DnsQueryLog.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Rolling per-hour top statistics: requested domains, blocked domains and clients.
 * <p>
 * Bucket 0 is the current hour, the last bucket the oldest one kept. Memory is bounded by
 * {@code limit * topSize * 3} counters whatever the query volume.
 * <p>
 * The bucket list lock is write-locked only to rotate, resize or reset the list; recording
 * and reading hold it shared and then take the lock of the individual bucket. The list lock
 * is always taken first.
 */
@Slf4j
public class TopStatsAggregator {

    private final int topSize;
    private final ReadWriteLock hoursLock = new ReentrantReadWriteLock();
    private List<HourBucket> hours;
    private int limit;

    public TopStatsAggregator(int limit, int topSize) {
        if (limit < 1) {
            throw new ValidationException("Top stats hour limit must be at least 1, got " + limit);
        }
        this.topSize = topSize;
        this.limit = limit;
        this.hours = emptyBuckets(limit);
    }

    /**
     * Counts {@code entry} under {@code queryName} in the bucket for the hour it happened in.
     *
     * @return false when the entry is too old, in the future or has no name
     */
    public boolean recordEntry(QueryLogEntry entry, String queryName, Instant now) {
        if (queryName == null || queryName.isEmpty()) {
            return false;
        }
        Duration age = Duration.between(entry.getTime(), now);
        if (age.isNegative()) {
            log.debug("t {} vs {} is in the future, ignoring", entry.getTime(), now);
            return false;
        }
        long hour = age.toHours();

        hoursLock.readLock().lock();
        try {
            if (hour >= limit) {
                log.debug("t {} is very old, ignoring", entry.getTime());
                return false;
            }
            boolean filtered = entry.getResult() != null && entry.getResult().isFiltered();
            hours.get((int) hour).record(queryName, filtered, entry.getClientIp());
            return true;
        } finally {
            hoursLock.readLock().unlock();
        }
    }

    public void rotateHour() {
        log.info("Rotating hourly top");
        HourBucket fresh = new HourBucket(topSize);
        hoursLock.writeLock().lock();
        try {
            List<HourBucket> rotated = new ArrayList<>(limit);
            rotated.add(fresh);
            rotated.addAll(hours.subList(0, limit - 1));
            hours = rotated;
        } finally {
            hoursLock.writeLock().unlock();
        }
    }

    /**
     * Changes how many hours are kept. Growing appends empty buckets at the old end,
     * shrinking drops the oldest buckets; the newest {@code min(old, new)} are untouched.
     */
    public void resize(int newLimit) {
        if (newLimit < 1) {
            throw new ValidationException("Top stats hour limit must be at least 1, got " + newLimit);
        }
        hoursLock.writeLock().lock();
        try {
            List<HourBucket> resized = new ArrayList<>(newLimit);
            resized.addAll(hours.subList(0, Math.min(limit, newLimit)));
            while (resized.size() < newLimit) {
                resized.add(new HourBucket(topSize));
            }
            hours = resized;
            log.info("Top stats limit changed from {} to {} hours", limit, newLimit);
            limit = newLimit;
        } finally {
            hoursLock.writeLock().unlock();
        }
    }

    public void reset() {
        hoursLock.writeLock().lock();
        try {
            hours = emptyBuckets(limit);
        } finally {
            hoursLock.writeLock().unlock();
        }
    }

    /**
     * Sums the counters of the newest {@code hourOffset} hours, i.e. data from [now - hourOffset, now].
     */
    public StatsTop topStats(int hourOffset) {
        StatsTop top = new StatsTop();
        hoursLock.readLock().lock();
        try {
            int count = Math.max(0, Math.min(hourOffset, hours.size()));
            for (int hour = 0; hour < count; hour++) {
                hours.get(hour).addTo(top);
            }
        } finally {
            hoursLock.readLock().unlock();
        }
        return top;
    }

    public int getLimit() {
        hoursLock.readLock().lock();
        try {
            return limit;
        } finally {
            hoursLock.readLock().unlock();
        }
    }

    public int getBucketCount() {
        hoursLock.readLock().lock();
        try {
            return hours.size();
        } finally {
            hoursLock.readLock().unlock();
        }
    }

    private List<HourBucket> emptyBuckets(int count) {
        List<HourBucket> buckets = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            buckets.add(new HourBucket(topSize));
        }
        return buckets;
    }
}
