package com.example.DnsQueryLog.repository;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes every physical operation on the query log files.
 * <p>
 * One instance is shared by all stores writing to the same files. It must never be
 * acquired while an in-memory structure lock is held.
 */
public class LogFileLock {

    private final ReentrantLock lock = new ReentrantLock();

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    public boolean isLocked() {
        return lock.isLocked();
    }
}
