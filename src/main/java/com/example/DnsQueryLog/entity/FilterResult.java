package com.example.DnsQueryLog.entity;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Verdict of the filtering engine for one query.
 */
@Value
@Builder
@Jacksonized
public class FilterResult {

    public static final FilterResult NOT_FILTERED = FilterResult.builder()
            .filtered(false)
            .reason(FilterReason.NOT_FILTERED_NOT_FOUND)
            .build();

    boolean filtered;
    FilterReason reason;
    String rule;      // matched rule text, null when nothing matched
    long filterId;
}
