package com.phillippitts.routineengine.service.vision;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;

/**
 * Frigate NVR: reads the most recent events for a camera via
 * {@code GET /api/events?camera=&labels=&limit=}. Each event contributes its label and top score.
 */
public class FrigateDetectionSource extends HttpVisionDetectionSource {

    private static final Logger LOG = LogManager.getLogger(FrigateDetectionSource.class);

    public static final String SERVICE_ID = "frigate";

    private final int eventLimit;

    public FrigateDetectionSource(RestTemplate restTemplate, String baseUrl, int eventLimit) {
        super(restTemplate, baseUrl);
        this.eventLimit = eventLimit;
    }

    @Override
    public String service() {
        return SERVICE_ID;
    }

    @Override
    public List<Detection> detect(VisionDetectionRequest request) {
        if (request.camera() == null || request.camera().isBlank()) {
            throw missing(SERVICE_ID, "a camera");
        }
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(baseUrl + "/api/events")
                .queryParam("camera", request.camera())
                .queryParam("limit", eventLimit);
        if (!request.objectTypes().isEmpty()) {
            uri.queryParam("labels", String.join(",", request.objectTypes()));
        }
        if (request.zone() != null && !request.zone().isBlank()) {
            uri.queryParam("zone", request.zone());
        }
        String body = restTemplate.getForObject(uri.build().toUri(), String.class);
        List<Detection> detections = body == null || body.isBlank()
                ? List.of()
                : VisionJsonParser.parse(new JSONArray(body), "label", "top_score", "data.top_score", "score");
        LOG.debug("Frigate camera {} returned {} event(s)", request.camera(), detections.size());
        return detections;
    }
}
