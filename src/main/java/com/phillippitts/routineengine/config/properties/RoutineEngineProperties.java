package com.phillippitts.routineengine.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Top-level routine engine switches.
 */
@ConfigurationProperties(prefix = "routines")
public class RoutineEngineProperties {

    /** Register every enabled routine's trigger at startup. */
    private boolean autostart = true;

    public boolean isAutostart() {
        return autostart;
    }

    public void setAutostart(boolean autostart) {
        this.autostart = autostart;
    }
}
