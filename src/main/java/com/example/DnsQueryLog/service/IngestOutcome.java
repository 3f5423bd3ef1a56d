package com.example.DnsQueryLog.service;

public enum IngestOutcome {
    ACCEPTED,
    // missing question or no name could be read from it
    REJECTED,
    // logging is switched off or the service is not running
    DISABLED
}
