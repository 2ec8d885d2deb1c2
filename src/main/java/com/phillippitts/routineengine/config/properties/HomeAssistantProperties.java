package com.phillippitts.routineengine.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Home Assistant REST API access. The connector and state source are only created when
 * {@code connectors.homeassistant.base-url} is set.
 */
@Validated
@ConfigurationProperties(prefix = "connectors.homeassistant")
public class HomeAssistantProperties {

    /** Base URL, e.g. http://homeassistant.local:8123. */
    private final String baseUrl;

    /** Long-lived access token sent as a bearer token. */
    private final String token;

    private final Duration connectTimeout;

    private final Duration readTimeout;

    @ConstructorBinding
    public HomeAssistantProperties(String baseUrl, String token, Duration connectTimeout, Duration readTimeout) {
        this.baseUrl = baseUrl;
        this.token = token;
        this.connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
        this.readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getToken() {
        return token;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }
}
