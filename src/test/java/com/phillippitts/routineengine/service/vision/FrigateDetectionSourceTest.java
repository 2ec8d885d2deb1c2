package com.phillippitts.routineengine.service.vision;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class FrigateDetectionSourceTest {

    private MockRestServiceServer server;
    private FrigateDetectionSource source;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.createServer(restTemplate);
        source = new FrigateDetectionSource(restTemplate, "http://frigate:5000/", 5);
    }

    @Test
    void queriesRecentEventsForCamera() {
        server.expect(requestTo(startsWith("http://frigate:5000/api/events")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("camera", "front_door"))
                .andExpect(queryParam("limit", "5"))
                .andExpect(queryParam("zone", "porch"))
                .andRespond(withSuccess("""
                        [
                          {"label":"person","top_score":0.91},
                          {"label":"car","data":{"top_score":0.77}},
                          {"label":"dog","score":0.6},
                          {"label":"","top_score":0.99},
                          {"label":"cat"}
                        ]
                        """, MediaType.APPLICATION_JSON));

        List<Detection> detections = source.detect(new VisionDetectionRequest(
                "front_door", List.of("person", "car"), 0.5, "porch", null));

        assertThat(detections).containsExactly(
                new Detection("person", 0.91),
                new Detection("car", 0.77),
                new Detection("dog", 0.6),
                new Detection("cat", 0.0));
        server.verify();
    }

    @Test
    void emptyBodyMeansNoDetections() {
        server.expect(requestTo(startsWith("http://frigate:5000/api/events")))
                .andRespond(withSuccess("", MediaType.APPLICATION_JSON));

        assertThat(source.detect(new VisionDetectionRequest("yard", List.of(), 0.5, null, null))).isEmpty();
    }

    @Test
    void cameraIsRequired() {
        assertThatThrownBy(() -> source.detect(new VisionDetectionRequest(" ", List.of("person"), 0.5, null, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("frigate detection requires a camera");
    }
}
