package com.phillippitts.routineengine.service.trigger;

import com.phillippitts.routineengine.domain.VisionDetectionConfig;
import com.phillippitts.routineengine.service.vision.Detection;
import com.phillippitts.routineengine.service.vision.VisionDetectionRequest;
import com.phillippitts.routineengine.service.vision.VisionDetectionSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Polls a detection service and reports when the set of matching objects changes.
 *
 * <p>Detections below the minimum confidence are dropped. A label matches a target object type when
 * either contains the other, ignoring case. The signature of a poll is the sorted matched labels
 * joined with ",". A poll fires when it has at least one match and its signature differs from the
 * previous successful poll; an empty poll resets the signature, so an object that leaves and
 * returns fires again.
 */
final class VisionDetectionPoller {

    private static final Logger LOG = LogManager.getLogger(VisionDetectionPoller.class);

    private final String routineId;
    private final VisionDetectionConfig config;
    private final Map<String, VisionDetectionSource> sources;
    private final double minConfidence;

    private String lastSignature;

    VisionDetectionPoller(String routineId, VisionDetectionConfig config,
                          Map<String, VisionDetectionSource> sources, double defaultMinConfidence) {
        this.routineId = routineId;
        this.config = config;
        this.sources = sources;
        this.minConfidence = config.minConfidence() == null ? defaultMinConfidence : config.minConfidence();
    }

    /**
     * @return the matched labels when this poll fires
     */
    synchronized Optional<String> poll() {
        String service = config.service();
        String missing = missingPrerequisite(service);
        if (missing != null) {
            LOG.warn("Vision trigger of routine {} ({}) is missing {}, skipping poll", routineId, service, missing);
            return Optional.empty();
        }
        VisionDetectionSource source = sources.get(service);
        if (source == null) {
            LOG.warn("No vision detection source for service '{}' (routine {}), skipping poll", service, routineId);
            return Optional.empty();
        }

        List<Detection> detections = source.detect(new VisionDetectionRequest(
                config.camera(), config.objectTypes(), minConfidence, config.zone(), config.imageSource()));

        List<String> matched = match(detections, config.objectTypes(), minConfidence);
        String signature = String.join(",", matched);
        boolean fire = !matched.isEmpty() && !Objects.equals(signature, lastSignature);
        lastSignature = signature;
        return fire ? Optional.of("detected " + String.join(", ", matched)) : Optional.empty();
    }

    private String missingPrerequisite(String service) {
        if ("frigate".equals(service) && isBlank(config.camera())) {
            return "camera";
        }
        if (("codeprojectai".equals(service) || "yolo".equals(service)) && isBlank(config.imageSource())) {
            return "imageSource";
        }
        return null;
    }

    static List<String> match(List<Detection> detections, List<String> targets, double minConfidence) {
        List<String> matched = new ArrayList<>();
        if (detections == null) {
            return matched;
        }
        for (Detection d : detections) {
            if (d == null || d.label() == null || d.confidence() < minConfidence) {
                continue;
            }
            String label = d.label().toLowerCase(Locale.ROOT);
            boolean hit = targets.stream()
                    .filter(t -> t != null && !t.isBlank())
                    .map(t -> t.toLowerCase(Locale.ROOT))
                    .anyMatch(t -> label.contains(t) || t.contains(label));
            if (hit) {
                matched.add(d.label());
            }
        }
        Collections.sort(matched);
        return matched;
    }

    synchronized String lastSignature() {
        return lastSignature;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
