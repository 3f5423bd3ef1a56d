package com.example.DnsQueryLog.service;

public enum ServiceState {
    UNINITIALIZED,
    RUNNING,
    STOPPED
}
