package com.phillippitts.routineengine.util;

import java.util.Map;
import java.util.TreeSet;

/** Utility for privacy-safe logging of notification texts and connector payloads. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Renders only the keys of a parameter map, sorted, so values (tokens, messages) never reach the log.
     */
    public static String keysOnly(Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return "[]";
        }
        return new TreeSet<>(params.keySet()).toString();
    }
}
