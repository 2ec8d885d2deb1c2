package com.phillippitts.routineengine.config;

import com.phillippitts.routineengine.config.properties.HomeAssistantProperties;
import com.phillippitts.routineengine.config.properties.VisionProperties;
import com.phillippitts.routineengine.service.connector.homeassistant.HomeAssistantClient;
import com.phillippitts.routineengine.service.connector.homeassistant.HomeAssistantConnectorHandler;
import com.phillippitts.routineengine.service.vision.CodeProjectAiDetectionSource;
import com.phillippitts.routineengine.service.vision.FrigateDetectionSource;
import com.phillippitts.routineengine.service.vision.YoloDetectionSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP connectors and detection sources. Each one is created only when its base URL is set, so an
 * unconfigured deployment runs with notifications only.
 */
@Configuration
public class ConnectorConfig {

    private static final Logger LOG = LogManager.getLogger(ConnectorConfig.class);

    private final RestTemplateBuilder restTemplateBuilder;

    public ConnectorConfig(RestTemplateBuilder restTemplateBuilder) {
        this.restTemplateBuilder = restTemplateBuilder;
    }

    @Bean
    @ConditionalOnProperty(prefix = "connectors.homeassistant", name = "base-url")
    public HomeAssistantClient homeAssistantClient(HomeAssistantProperties props) {
        RestTemplate rest = restTemplateBuilder
                .setConnectTimeout(props.getConnectTimeout())
                .setReadTimeout(props.getReadTimeout())
                .build();
        if (!props.hasToken()) {
            LOG.warn("Home Assistant base URL set without a token; actions will report setup required");
        }
        return new HomeAssistantClient(rest, props.getBaseUrl(), props.getToken());
    }

    @Bean
    @ConditionalOnProperty(prefix = "connectors.homeassistant", name = "base-url")
    public HomeAssistantConnectorHandler homeAssistantConnectorHandler(HomeAssistantClient client) {
        return new HomeAssistantConnectorHandler(client);
    }

    @Bean
    @ConditionalOnProperty(prefix = "vision.frigate", name = "base-url")
    public FrigateDetectionSource frigateDetectionSource(VisionProperties props) {
        return new FrigateDetectionSource(visionRestTemplate(props), props.getFrigate().getBaseUrl(),
                props.getFrigateEventLimit());
    }

    @Bean
    @ConditionalOnProperty(prefix = "vision.codeprojectai", name = "base-url")
    public CodeProjectAiDetectionSource codeProjectAiDetectionSource(VisionProperties props) {
        return new CodeProjectAiDetectionSource(visionRestTemplate(props), props.getCodeprojectai().getBaseUrl());
    }

    @Bean
    @ConditionalOnProperty(prefix = "vision.yolo", name = "base-url")
    public YoloDetectionSource yoloDetectionSource(VisionProperties props) {
        return new YoloDetectionSource(visionRestTemplate(props), props.getYolo().getBaseUrl(), props.getYoloPath());
    }

    private RestTemplate visionRestTemplate(VisionProperties props) {
        return restTemplateBuilder
                .setConnectTimeout(props.getTimeout())
                .setReadTimeout(props.getTimeout())
                .build();
    }
}
