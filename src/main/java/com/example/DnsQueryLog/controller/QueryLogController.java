package com.example.DnsQueryLog.controller;

import com.example.DnsQueryLog.dto.QueryLogConfigDto;
import com.example.DnsQueryLog.dto.QueryLogItem;
import com.example.DnsQueryLog.dto.StatsTop;
import com.example.DnsQueryLog.service.QueryLogService;
import com.example.DnsQueryLog.util.QueryLogItems;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/control")
@CrossOrigin(origins = "*")
public class QueryLogController {

    @Autowired
    private QueryLogService queryLogService;

    @GetMapping("/querylog")
    public ResponseEntity<List<QueryLogItem>> queryLog() {
        return ResponseEntity.ok(QueryLogItems.newestFirst(queryLogService.getEntries()));
    }

    @GetMapping("/querylog_info")
    public ResponseEntity<QueryLogConfigDto> queryLogInfo() {
        return ResponseEntity.ok(queryLogService.getConfig());
    }

    @PostMapping("/querylog_config")
    public ResponseEntity<String> queryLogConfig(@RequestBody QueryLogConfigDto config) {
        queryLogService.configure(config);
        return ResponseEntity.ok("OK");
    }

    @PostMapping("/querylog_clear")
    public ResponseEntity<String> queryLogClear() {
        queryLogService.clear();
        return ResponseEntity.ok("OK");
    }

    /**
     * Top domains, blocked domains and clients of the last {@code hours} hours,
     * highest count first, at most {@code limit} of each when a limit is given.
     */
    @GetMapping("/stats_top")
    public ResponseEntity<StatsTop> statsTop(@RequestParam(defaultValue = "24") int hours,
                                             @RequestParam(defaultValue = "0") int limit) {
        StatsTop top = queryLogService.getTopStats(hours);
        return ResponseEntity.ok(new StatsTop(
                sorted(top.getDomains(), limit),
                sorted(top.getBlocked(), limit),
                sorted(top.getClients(), limit)));
    }

    private static Map<String, Integer> sorted(Map<String, Integer> counts, int limit) {
        Map<String, Integer> result = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<String, Integer>comparingByKey()))
                .limit(limit > 0 ? limit : Long.MAX_VALUE)
                .forEach(e -> result.put(e.getKey(), e.getValue()));
        return result;
    }
}
