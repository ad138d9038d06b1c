package com.gzh.webhooks.rule;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses durations written the way rule files write them: a sequence of
 * decimal numbers each followed by a unit, e.g. {@code 30s}, {@code 1m30s},
 * {@code 250ms}, {@code 1.5h}.  Units: {@code ns}, {@code us}, {@code ms},
 * {@code s}, {@code m}, {@code h}.
 */
public final class Durations {

    private static final Pattern SEGMENT = Pattern.compile("(\\d+(?:\\.\\d*)?|\\.\\d+)(ns|us|µs|ms|s|m|h)");

    private Durations() {}

    /**
     * @throws IllegalArgumentException if {@code text} is not a valid duration
     */
    public static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Duration must not be blank");
        }
        String s = text.trim();
        boolean negative = s.startsWith("-");
        if (negative || s.startsWith("+")) {
            s = s.substring(1);
        }
        if ("0".equals(s)) {
            return Duration.ZERO;
        }

        Matcher m = SEGMENT.matcher(s);
        long nanos = 0;
        int pos = 0;
        while (pos < s.length()) {
            if (!m.find(pos) || m.start() != pos) {
                throw new IllegalArgumentException("Invalid duration: " + text);
            }
            double amount = Double.parseDouble(m.group(1));
            nanos += Math.round(amount * unitNanos(m.group(2)));
            pos = m.end();
        }
        if (pos == 0) {
            throw new IllegalArgumentException("Invalid duration: " + text);
        }
        return Duration.ofNanos(negative ? -nanos : nanos);
    }

    private static long unitNanos(String unit) {
        return switch (unit) {
            case "ns"       -> 1L;
            case "us", "µs" -> 1_000L;
            case "ms"       -> 1_000_000L;
            case "s"        -> 1_000_000_000L;
            case "m"        -> 60_000_000_000L;
            case "h"        -> 3_600_000_000_000L;
            default         -> throw new IllegalArgumentException("Unknown duration unit: " + unit);
        };
    }
}
