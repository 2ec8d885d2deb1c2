package com.phillippitts.routineengine.service.pattern;

import java.time.Instant;

/**
 * A finished task as seen by pattern detection.
 *
 * @param title       task title; blank titles are treated as {@code Unknown}
 * @param completedAt completion time
 */
public record CompletedTask(String title, Instant completedAt) {

    static final String UNKNOWN_TITLE = "Unknown";

    public CompletedTask {
        title = title == null || title.isBlank() ? UNKNOWN_TITLE : title;
        if (completedAt == null) {
            throw new IllegalArgumentException("completedAt is required");
        }
    }
}
