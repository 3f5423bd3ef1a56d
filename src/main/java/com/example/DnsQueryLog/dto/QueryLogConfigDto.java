package com.example.DnsQueryLog.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueryLogConfigDto {
    private boolean enabled;
    private int retentionIntervalHours;
}
