package com.example.DnsQueryLog.service;

import com.example.DnsQueryLog.dto.QueryLogConfigDto;
import com.example.DnsQueryLog.dto.StatsTop;
import com.example.DnsQueryLog.entity.QueryLogEntry;

import java.util.List;

public interface QueryLogService {

    // Record a completed DNS query
    IngestOutcome ingest(QueryLogEntry entry);

    // Entries kept in memory, newest last
    List<QueryLogEntry> getEntries();

    // Top domains, blocked domains and clients over the last hours
    StatsTop getTopStats(int hours);

    // Change how many hours of top statistics are kept
    void setTopStatsHours(int hours);

    QueryLogConfigDto getConfig();

    void configure(QueryLogConfigDto config);

    void clear();

    // Write pending entries to the log file; without full only once the buffer is full
    void flush(boolean full);

    ServiceState getState();
}
