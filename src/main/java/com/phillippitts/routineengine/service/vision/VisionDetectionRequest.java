package com.phillippitts.routineengine.service.vision;

import java.util.List;

/**
 * Parameters of one detection poll, taken from a vision trigger's configuration.
 *
 * @param camera        camera name (Frigate)
 * @param objectTypes   object classes the trigger is interested in
 * @param minConfidence minimum score to keep
 * @param zone          optional zone filter
 * @param imageSource   URL of the frame to analyse (CodeProject.AI, YOLO)
 */
public record VisionDetectionRequest(
        String camera,
        List<String> objectTypes,
        double minConfidence,
        String zone,
        String imageSource
) {
    public VisionDetectionRequest {
        objectTypes = objectTypes == null ? List.of() : List.copyOf(objectTypes);
    }
}
