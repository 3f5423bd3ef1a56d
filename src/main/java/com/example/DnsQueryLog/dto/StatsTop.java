package com.example.DnsQueryLog.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatsTop {

    private Map<String, Integer> domains = new HashMap<>();   // top requested domains
    private Map<String, Integer> blocked = new HashMap<>();   // top blocked domains
    private Map<String, Integer> clients = new HashMap<>();   // top DNS clients
}
