package com.example.DnsQueryLog.entity;

public enum FilterReason {
    NOT_FILTERED_NOT_FOUND,
    NOT_FILTERED_WHITE_LIST,
    NOT_FILTERED_ERROR,
    FILTERED_BLACK_LIST,
    FILTERED_SAFE_BROWSING,
    FILTERED_PARENTAL,
    FILTERED_INVALID,
    FILTERED_SAFE_SEARCH,
    FILTERED_BLOCKED_SERVICE
}
