package com.example.DnsQueryLog.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One row of the query log as shown to the operator.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueryLogItem {
    private String time;
    private String client;
    private String name;
    private String type;
    private String queryClass;
    private String status;        // response code, e.g. NOERROR
    private List<String> answers;
    private double elapsedMs;
    private boolean filtered;
    private String reason;
    private String rule;
    private long filterId;
    private String upstream;
}
