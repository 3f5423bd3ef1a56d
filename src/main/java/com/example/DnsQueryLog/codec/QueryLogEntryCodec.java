package com.example.DnsQueryLog.codec;

import com.example.DnsQueryLog.entity.QueryLogEntry;
import com.example.DnsQueryLog.exception.DecodeException;
import com.example.DnsQueryLog.exception.EncodeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.function.Consumer;

/**
 * Converts query log entries to and from JSON lines.
 * <p>
 * Every record is a single JSON object followed by {@code '\n'}, so a reader can always
 * resynchronize on the next newline after a damaged record. Times are written as ISO-8601
 * UTC instants and durations as ISO-8601 durations, both at nanosecond precision.
 */
@Slf4j
public class QueryLogEntryCodec {

    private static final byte NEWLINE = '\n';

    private final ObjectMapper mapper;

    public QueryLogEntryCodec() {
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                .build();
    }

    public byte[] encode(QueryLogEntry entry) {
        try {
            byte[] json = mapper.writeValueAsBytes(entry);
            byte[] line = new byte[json.length + 1];
            System.arraycopy(json, 0, line, 0, json.length);
            line[json.length] = NEWLINE;
            return line;
        } catch (JsonProcessingException e) {
            throw new EncodeException("Failed to encode query log entry", e);
        }
    }

    public byte[] encodeAll(List<QueryLogEntry> entries) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(entries.size() * 256);
        for (QueryLogEntry entry : entries) {
            byte[] line = encode(entry);
            out.write(line, 0, line.length);
        }
        return out.toByteArray();
    }

    public QueryLogEntry decode(byte[] line) {
        return decode(line, 0, line.length);
    }

    public QueryLogEntry decode(String line) {
        if (line == null || line.isBlank()) {
            throw new DecodeException("Empty query log record");
        }
        try {
            return validate(mapper.readValue(line, QueryLogEntry.class));
        } catch (IOException | RuntimeException e) {
            throw asDecodeException(e);
        }
    }

    private QueryLogEntry decode(byte[] data, int offset, int length) {
        if (length == 0) {
            throw new DecodeException("Empty query log record");
        }
        try {
            return validate(mapper.readValue(data, offset, length, QueryLogEntry.class));
        } catch (IOException | RuntimeException e) {
            throw asDecodeException(e);
        }
    }

    /**
     * Decodes every newline-delimited record in {@code data}, handing each to {@code onEntry}.
     * Blank lines are ignored; undecodable records are skipped.
     *
     * @return number of records that could not be decoded
     */
    public int decodeAll(byte[] data, Consumer<QueryLogEntry> onEntry) {
        int skipped = 0;
        int start = 0;
        for (int i = 0; i <= data.length; i++) {
            if (i < data.length && data[i] != NEWLINE) {
                continue;
            }
            if (i > start && !isBlank(data, start, i)) {
                try {
                    onEntry.accept(decode(data, start, i - start));
                } catch (DecodeException e) {
                    log.debug("Skipping query log record at offset {}: {}", start, e.getMessage());
                    skipped++;
                }
            }
            start = i + 1;
        }
        return skipped;
    }

    private static QueryLogEntry validate(QueryLogEntry entry) {
        if (entry == null) {
            throw new DecodeException("Query log record is null");
        }
        if (entry.getTime() == null) {
            throw new DecodeException("Query log record has no time");
        }
        if (entry.getQuestion() == null) {
            throw new DecodeException("Query log record has no question");
        }
        return entry;
    }

    private static DecodeException asDecodeException(Exception e) {
        if (e instanceof DecodeException) {
            return (DecodeException) e;
        }
        return new DecodeException("Malformed query log record: " + e.getMessage(), e);
    }

    private static boolean isBlank(byte[] data, int from, int to) {
        for (int i = from; i < to; i++) {
            if (!Character.isWhitespace(data[i])) {
                return false;
            }
        }
        return true;
    }
}
