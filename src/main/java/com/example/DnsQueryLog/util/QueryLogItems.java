package com.example.DnsQueryLog.util;

import com.example.DnsQueryLog.dto.QueryLogItem;
import com.example.DnsQueryLog.entity.FilterResult;
import com.example.DnsQueryLog.entity.QueryLogEntry;
import org.xbill.DNS.Rcode;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

public final class QueryLogItems {

    private QueryLogItems() {
    }

    /** Converts entries for display, newest first. */
    public static List<QueryLogItem> newestFirst(List<QueryLogEntry> entries) {
        List<QueryLogItem> items = new ArrayList<>(entries.size());
        for (int i = entries.size() - 1; i >= 0; i--) {
            items.add(from(entries.get(i)));
        }
        return items;
    }

    public static QueryLogItem from(QueryLogEntry entry) {
        QueryLogItem.QueryLogItemBuilder item = QueryLogItem.builder()
                .time(DateTimeFormatter.ISO_INSTANT.format(entry.getTime()))
                .client(entry.getClientIp())
                .elapsedMs(entry.getElapsed() == null ? 0 : entry.getElapsed().toNanos() / 1_000_000.0)
                .upstream(entry.getUpstream())
                .answers(DnsMessages.answers(entry.getAnswer()));

        DnsMessages.firstQuestion(entry.getQuestion()).ifPresent(q -> item
                .name(DnsMessages.queryName(entry.getQuestion()).orElse(""))
                .type(DnsMessages.queryType(q))
                .queryClass(DnsMessages.queryClass(q)));
        DnsMessages.responseCode(entry.getAnswer()).ifPresent(rcode -> item.status(Rcode.string(rcode)));

        FilterResult result = entry.getResult();
        if (result != null) {
            item.filtered(result.isFiltered())
                    .reason(result.getReason() == null ? null : result.getReason().name())
                    .rule(result.getRule())
                    .filterId(result.getFilterId());
        }
        return item.build();
    }
}
