package com.phillippitts.routineengine.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Endpoints of the object-detection services polled by vision triggers.
 * Each source is registered only when its base URL is set.
 */
@ConfigurationProperties(prefix = "vision")
@Validated
public class VisionProperties {

    private Endpoint frigate = new Endpoint();
    private Endpoint codeprojectai = new Endpoint();
    private Endpoint yolo = new Endpoint();

    /** Number of recent Frigate events requested per poll. */
    @Positive
    private int frigateEventLimit = 10;

    /** Path of the YOLO detection endpoint relative to its base URL. */
    private String yoloPath = "/detect";

    @NotNull
    private Duration timeout = Duration.ofSeconds(10);

    public Endpoint getFrigate() {
        return frigate;
    }

    public void setFrigate(Endpoint frigate) {
        this.frigate = frigate;
    }

    public Endpoint getCodeprojectai() {
        return codeprojectai;
    }

    public void setCodeprojectai(Endpoint codeprojectai) {
        this.codeprojectai = codeprojectai;
    }

    public Endpoint getYolo() {
        return yolo;
    }

    public void setYolo(Endpoint yolo) {
        this.yolo = yolo;
    }

    public int getFrigateEventLimit() {
        return frigateEventLimit;
    }

    public void setFrigateEventLimit(int frigateEventLimit) {
        this.frigateEventLimit = frigateEventLimit;
    }

    public String getYoloPath() {
        return yoloPath;
    }

    public void setYoloPath(String yoloPath) {
        this.yoloPath = yoloPath;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * One detection service endpoint.
     */
    public static class Endpoint {
        private String baseUrl;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank();
        }
    }
}
