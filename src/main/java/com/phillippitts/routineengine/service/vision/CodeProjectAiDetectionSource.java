package com.phillippitts.routineengine.service.vision;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * CodeProject.AI Server: fetches the frame from {@code imageSource} and posts it to
 * {@code /v1/vision/detection}; reads {@code predictions[{label, confidence}]}.
 */
public class CodeProjectAiDetectionSource extends HttpVisionDetectionSource {

    private static final Logger LOG = LogManager.getLogger(CodeProjectAiDetectionSource.class);

    public static final String SERVICE_ID = "codeprojectai";

    public CodeProjectAiDetectionSource(RestTemplate restTemplate, String baseUrl) {
        super(restTemplate, baseUrl);
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
        byte[] image = restTemplate.getForObject(request.imageSource(), byte[].class);
        if (image == null || image.length == 0) {
            LOG.debug("Empty frame from {}", request.imageSource());
            return List.of();
        }

        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("image", new ByteArrayResource(image) {
            @Override
            public String getFilename() {
                return "frame.jpg";
            }
        });
        form.add("min_confidence", String.valueOf(request.minConfidence()));
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        String body = restTemplate.postForObject(baseUrl + "/v1/vision/detection",
                new HttpEntity<>(form, headers), String.class);
        return VisionJsonParser.parseField(body, "predictions", "label", "confidence");
    }
}
