package com.phillippitts.routineengine.service.vision;

import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Self-hosted YOLO endpoint: posts {@code {imageUrl, minConfidence}} and reads
 * {@code detections[{label, confidence}]}.
 */
public class YoloDetectionSource extends HttpVisionDetectionSource {

    public static final String SERVICE_ID = "yolo";

    private final String path;

    public YoloDetectionSource(RestTemplate restTemplate, String baseUrl, String path) {
        super(restTemplate, baseUrl);
        this.path = path == null || path.isBlank() ? "" : (path.startsWith("/") ? path : "/" + path);
    }

    @Override
    public String service() {
        return SERVICE_ID;
    }

    @Override
    public List<Detection> detect(VisionDetectionRequest request) {
        if (request.imageSource() == null || request.imageSource().isBlank()) {
            throw missing(SERVICE_ID, "an imageSource");
        }
        JSONObject payload = new JSONObject()
                .put("imageUrl", request.imageSource())
                .put("minConfidence", request.minConfidence());
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String body = restTemplate.postForObject(baseUrl + path,
                new HttpEntity<>(payload.toString(), headers), String.class);
        return VisionJsonParser.parseField(body, "detections", "label", "confidence", "score");
    }
}
