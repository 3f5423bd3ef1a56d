package com.example.DnsQueryLog.entity;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;

/**
 * One completed DNS transaction as it is kept in memory and written to the query log file.
 * <p>
 * Entries are never modified once built. {@code question} and {@code answer} hold the raw
 * wire-format messages; only the queried name is ever extracted from them. Both arrays are
 * copied on the way in and on the way out, so a producer may reuse its buffers.
 */
@Value
@Builder
@Jacksonized
public class QueryLogEntry {

    Instant time;

    byte[] question;

    byte[] answer; // may be null when the query failed

    String clientIp;

    @Builder.Default
    FilterResult result = FilterResult.NOT_FILTERED;

    @Builder.Default
    Duration elapsed = Duration.ZERO;

    String upstream;

    public byte[] getQuestion() {
        return copy(question);
    }

    public byte[] getAnswer() {
        return copy(answer);
    }

    public boolean hasQuestion() {
        return question != null && question.length > 0;
    }

    private static byte[] copy(byte[] data) {
        return data == null ? null : data.clone();
    }

    public static class QueryLogEntryBuilder {

        public QueryLogEntryBuilder question(byte[] question) {
            this.question = copy(question);
            return this;
        }

        public QueryLogEntryBuilder answer(byte[] answer) {
            this.answer = copy(answer);
            return this;
        }
    }
}
