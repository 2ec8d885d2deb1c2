package com.phillippitts.routineengine.service.vision;

import org.springframework.web.client.RestTemplate;

import java.util.Objects;

/**
 * Base class for detection services reached over HTTP.
 */
public abstract class HttpVisionDetectionSource implements VisionDetectionSource {

    protected final RestTemplate restTemplate;
    protected final String baseUrl;

    protected HttpVisionDetectionSource(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        String url = Objects.requireNonNull(baseUrl, "baseUrl");
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    protected static IllegalArgumentException missing(String service, String field) {
        return new IllegalArgumentException(service + " detection requires " + field);
    }
}
