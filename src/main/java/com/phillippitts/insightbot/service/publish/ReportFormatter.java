package com.phillippitts.insightbot.service.publish;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits a report into messages that fit the channel's length limits.
 *
 * <p>The header always travels with the first body chunk. The first message is at most
 * {@value #FIRST_MESSAGE_LIMIT} UTF-16 units including the header; continuation messages are
 * at most {@value #CONTINUATION_LIMIT}. A cut never separates a surrogate pair.
 */
public final class ReportFormatter {

    public static final int FIRST_MESSAGE_LIMIT = 2000;
    public static final int CONTINUATION_LIMIT = 1900;

    private ReportFormatter() {}

    public static List<String> split(String header, String body) {
        return split(header, body, FIRST_MESSAGE_LIMIT, CONTINUATION_LIMIT);
    }

    static List<String> split(String header, String body, int firstLimit, int continuationLimit) {
        Objects.requireNonNull(header, "header must not be null");
        Objects.requireNonNull(body, "body must not be null");
        if (header.length() >= firstLimit) {
            throw new IllegalArgumentException("Header leaves no room for the report body");
        }
        if (continuationLimit < 2) {
            throw new IllegalArgumentException("Continuation limit too small");
        }
        List<String> messages = new ArrayList<>();
        if (header.length() + body.length() <= firstLimit) {
            messages.add(header + body);
            return messages;
        }
        int end = cutPoint(body, 0, firstLimit - header.length());
        messages.add(header + body.substring(0, end));
        int start = end;
        while (start < body.length()) {
            end = cutPoint(body, start, continuationLimit);
            messages.add(body.substring(start, end));
            start = end;
        }
        return messages;
    }

    private static int cutPoint(String s, int start, int limit) {
        int end = Math.min(s.length(), start + limit);
        if (end < s.length() && end > start + 1
                && Character.isHighSurrogate(s.charAt(end - 1)) && Character.isLowSurrogate(s.charAt(end))) {
            end--;
        }
        return end;
    }
}
