package com.example.DnsQueryLog.util;

import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Message;
import org.xbill.DNS.Record;
import org.xbill.DNS.Section;
import org.xbill.DNS.Type;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads what the query log needs out of raw DNS wire-format messages.
 */
@Slf4j
public final class DnsMessages {

    private DnsMessages() {
    }

    /**
     * Name asked for by the first question of {@code question}, lower-cased and without the
     * trailing dot. Empty when the message can't be parsed or has no usable question.
     */
    public static Optional<String> queryName(byte[] question) {
        return firstQuestion(question).map(DnsMessages::normalizedName).filter(name -> !name.isEmpty());
    }

    public static Optional<Record> firstQuestion(byte[] question) {
        Optional<Message> message = parse(question);
        if (message.isEmpty()) {
            return Optional.empty();
        }
        Record q = message.get().getQuestion();
        if (q == null) {
            log.debug("malformed dns message, has no questions");
        }
        return Optional.ofNullable(q);
    }

    public static String queryType(Record question) {
        return Type.string(question.getType());
    }

    public static String queryClass(Record question) {
        return DClass.string(question.getDClass());
    }

    /** Answer section of {@code answer} rendered one record per string; empty if there is none. */
    public static List<String> answers(byte[] answer) {
        List<String> result = new ArrayList<>();
        parse(answer).ifPresent(message -> {
            for (Record record : message.getSection(Section.ANSWER)) {
                result.add(Type.string(record.getType()) + " " + record.rdataToString() + " ttl=" + record.getTTL());
            }
        });
        return result;
    }

    public static Optional<Integer> responseCode(byte[] answer) {
        return parse(answer).map(message -> message.getHeader().getRcode());
    }

    private static String normalizedName(Record question) {
        String name = question.getName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".") ? name.substring(0, name.length() - 1) : name;
    }

    private static Optional<Message> parse(byte[] wire) {
        if (wire == null || wire.length == 0) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Message(wire));
        } catch (IOException e) {
            log.debug("failed to unpack dns message: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
