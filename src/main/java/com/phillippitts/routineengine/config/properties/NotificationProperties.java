package com.phillippitts.routineengine.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for notification actions.
 */
@ConfigurationProperties(prefix = "routines.notification")
@Validated
public class NotificationProperties {

    /** Show a desktop tray message when the platform supports it. Otherwise notifications are only logged. */
    private boolean desktopEnabled = false;

    /** Caption of the desktop tray message. */
    @NotBlank
    private String title = "Routine";

    /** Maximum characters of a notification text written to the log. */
    @Positive
    private int maxLoggedLength = 120;

    public boolean isDesktopEnabled() {
        return desktopEnabled;
    }

    public void setDesktopEnabled(boolean desktopEnabled) {
        this.desktopEnabled = desktopEnabled;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public int getMaxLoggedLength() {
        return maxLoggedLength;
    }

    public void setMaxLoggedLength(int maxLoggedLength) {
        this.maxLoggedLength = maxLoggedLength;
    }
}
