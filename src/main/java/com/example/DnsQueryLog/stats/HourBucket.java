package com.example.DnsQueryLog.stats;

import com.example.DnsQueryLog.dto.StatsTop;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Counters for one hour of traffic.
 */
public class HourBucket {

    private final LruCounter domains;
    private final LruCounter blocked;
    private final LruCounter clients;

    // LinkedHashMap in access order mutates on get, so readers lock exclusively as well
    private final ReentrantLock lock = new ReentrantLock();

    public HourBucket(int topSize) {
        this.domains = new LruCounter(topSize);
        this.blocked = new LruCounter(topSize);
        this.clients = new LruCounter(topSize);
    }

    public void record(String domain, boolean filtered, String clientIp) {
        lock.lock();
        try {
            domains.increment(domain);
            if (filtered) {
                blocked.increment(domain);
            }
            if (clientIp != null && !clientIp.isEmpty()) {
                clients.increment(clientIp);
            }
        } finally {
            lock.unlock();
        }
    }

    void addTo(StatsTop top) {
        lock.lock();
        try {
            domains.addTo(top.getDomains());
            blocked.addTo(top.getBlocked());
            clients.addTo(top.getClients());
        } finally {
            lock.unlock();
        }
    }
}
