package com.phillippitts.routineengine.service.vision;

/**
 * One object reported by a detection service.
 *
 * @param label      object class, e.g. {@code person}
 * @param confidence score in [0, 1]
 */
public record Detection(String label, double confidence) {
}
