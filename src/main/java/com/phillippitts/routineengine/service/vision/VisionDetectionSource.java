package com.phillippitts.routineengine.service.vision;

import java.util.List;

/**
 * An object-detection service polled by vision triggers. Beans are keyed by {@link #service()}.
 */
public interface VisionDetectionSource {

    /**
     * Service id matching {@code visionDetection.service}: {@code frigate}, {@code codeprojectai},
     * {@code yolo} or {@code local}.
     */
    String service();

    /**
     * Returns the current detections. Throws on transport or parse failure.
     */
    List<Detection> detect(VisionDetectionRequest request);
}
