package com.phillippitts.routineengine;

import com.phillippitts.routineengine.config.properties.HomeAssistantProperties;
import com.phillippitts.routineengine.config.properties.NotificationProperties;
import com.phillippitts.routineengine.config.properties.PatternDetectionProperties;
import com.phillippitts.routineengine.config.properties.RoutineEngineProperties;
import com.phillippitts.routineengine.config.properties.RoutineStoreProperties;
import com.phillippitts.routineengine.config.properties.TriggerProperties;
import com.phillippitts.routineengine.config.properties.VisionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        RoutineEngineProperties.class,
        TriggerProperties.class,
        RoutineStoreProperties.class,
        NotificationProperties.class,
        PatternDetectionProperties.class,
        HomeAssistantProperties.class,
        VisionProperties.class
})
@EnableScheduling
public class RoutineEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoutineEngineApplication.class, args);
    }

}
