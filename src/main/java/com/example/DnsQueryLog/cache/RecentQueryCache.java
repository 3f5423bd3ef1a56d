package com.example.DnsQueryLog.cache;

import com.example.DnsQueryLog.entity.QueryLogEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The most recent query log entries, oldest first, never more than {@code capacity} of them.
 */
public class RecentQueryCache {

    private final int capacity;
    private final ArrayDeque<QueryLogEntry> entries;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public RecentQueryCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public void append(QueryLogEntry entry) {
        lock.writeLock().lock();
        try {
            entries.addLast(entry);
            if (entries.size() > capacity) {
                entries.removeFirst();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Bulk load from the persisted log. Entries may come in any file order; they are put
     * in time order and only the newest {@code capacity} are kept.
     */
    public void loadAll(Collection<QueryLogEntry> loaded) {
        List<QueryLogEntry> sorted = new ArrayList<>(loaded);
        sorted.sort(Comparator.comparing(QueryLogEntry::getTime));
        int from = Math.max(0, sorted.size() - capacity);

        lock.writeLock().lock();
        try {
            for (QueryLogEntry entry : sorted.subList(from, sorted.size())) {
                entries.addLast(entry);
                if (entries.size() > capacity) {
                    entries.removeFirst();
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Copy of the cached entries, newest last. */
    public List<QueryLogEntry> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
