package com.gzh.webhooks.github;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/** Turns {@code key=value} arguments into a map, rejecting unknown keys. */
final class CliArgsParser {

    private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

    private CliArgsParser() {}

    /**
     * @param allowed keys the mode understands
     * @throws IllegalArgumentException on a malformed argument or an unknown key
     */
    static Map<String, String> toMap(String[] args, Set<String> allowed) {
        Map<String, String> map = new LinkedHashMap<>();
        for (String raw : args) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String arg = raw.trim();
            int idx = arg.indexOf('=');
            if (idx <= 0 || idx == arg.length() - 1) {
                throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
            }
            String key = arg.substring(0, idx).trim();
            if (!KEY_PATTERN.matcher(key).matches()) {
                throw new IllegalArgumentException("invalid argument name: " + key);
            }
            if (!allowed.contains(key)) {
                throw new IllegalArgumentException("unknown argument: " + key);
            }
            map.put(key, arg.substring(idx + 1).trim());
        }
        return map;
    }

    static int intValue(Map<String, String> args, String key, int defaultValue) {
        String value = args.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (was '" + value + "')");
        }
    }
}
