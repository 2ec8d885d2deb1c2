package com.phillippitts.routineengine.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Attributes stamped on every routine record written to the store.
 */
@Validated
@ConfigurationProperties(prefix = "routines.store")
public class RoutineStoreProperties {

    @NotBlank
    private final String speaker;

    @NotBlank
    private final String kind;

    @NotBlank
    private final String persona;

    @Min(0)
    @Max(10)
    private final int importance;

    @ConstructorBinding
    public RoutineStoreProperties(String speaker, String kind, String persona, Integer importance) {
        this.speaker = speaker == null ? "system" : speaker;
        this.kind = kind == null ? "routine" : kind;
        this.persona = persona == null ? "NIRVANA" : persona;
        this.importance = importance == null ? 8 : importance;
    }

    public static RoutineStoreProperties defaults() {
        return new RoutineStoreProperties(null, null, null, null);
    }

    public String getSpeaker() {
        return speaker;
    }

    public String getKind() {
        return kind;
    }

    public String getPersona() {
        return persona;
    }

    public int getImportance() {
        return importance;
    }
}
