package com.phillippitts.routineengine.domain;

import java.util.List;

/**
 * Configuration of a vision-detection trigger.
 *
 * @param service       detection backend: {@code local}, {@code frigate}, {@code codeprojectai} or {@code yolo}
 * @param camera        camera name (required by frigate)
 * @param objectTypes   labels to look for; matched case-insensitively by substring in either direction
 * @param minConfidence minimum detection confidence, null for the configured default
 * @param zone          optional zone name, passed through to backends that understand it
 * @param imageSource   snapshot URL (required by codeprojectai and yolo)
 * @param checkInterval poll period in milliseconds, null for the configured default
 */
public record VisionDetectionConfig(
        String service,
        String camera,
        List<String> objectTypes,
        Double minConfidence,
        String zone,
        String imageSource,
        Long checkInterval
) {
    public VisionDetectionConfig {
        objectTypes = objectTypes == null ? List.of() : List.copyOf(objectTypes);
    }
}
