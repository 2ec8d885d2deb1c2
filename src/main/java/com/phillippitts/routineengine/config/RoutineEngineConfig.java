package com.phillippitts.routineengine.config;

import com.phillippitts.routineengine.config.properties.NotificationProperties;
import com.phillippitts.routineengine.config.properties.RoutineStoreProperties;
import com.phillippitts.routineengine.config.properties.TriggerProperties;
import com.phillippitts.routineengine.service.action.ActionDispatcher;
import com.phillippitts.routineengine.service.action.DesktopNotificationSender;
import com.phillippitts.routineengine.service.action.NotificationSender;
import com.phillippitts.routineengine.service.condition.ConditionEvaluator;
import com.phillippitts.routineengine.service.connector.ConnectorHandler;
import com.phillippitts.routineengine.service.connector.ConnectorRegistry;
import com.phillippitts.routineengine.service.engine.DefaultRoutineEngineBuilder;
import com.phillippitts.routineengine.service.engine.RoutineEngine;
import com.phillippitts.routineengine.service.metrics.RoutineMetrics;
import com.phillippitts.routineengine.service.metrics.RoutineMetricsPublisher;
import com.phillippitts.routineengine.service.state.StateQuerySource;
import com.phillippitts.routineengine.service.store.InMemoryRoutineRecordStore;
import com.phillippitts.routineengine.service.store.RoutineRecordCodec;
import com.phillippitts.routineengine.service.store.RoutineRecordStore;
import com.phillippitts.routineengine.service.trigger.TaskSchedulerTriggerScheduler;
import com.phillippitts.routineengine.service.trigger.TriggerManager;
import com.phillippitts.routineengine.service.trigger.TriggerScheduler;
import com.phillippitts.routineengine.service.vision.VisionDetectionSource;
import com.phillippitts.routineengine.util.IdGenerator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Wires the routine engine and its collaborators. The engine itself is a plain object; this class
 * is the only place that knows how the pieces fit together.
 *
 * <p>The record store, notification sender and clock back off when the application supplies its own.
 */
@Configuration
public class RoutineEngineConfig {

    private final ApplicationEventPublisher publisher;

    public RoutineEngineConfig(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Process-local store used when no persistent store is configured.
     */
    @Bean
    @ConditionalOnMissingBean(RoutineRecordStore.class)
    public RoutineRecordStore routineRecordStore(Clock clock) {
        return new InMemoryRoutineRecordStore(clock);
    }

    @Bean
    public RoutineRecordCodec routineRecordCodec() {
        return new RoutineRecordCodec();
    }

    @Bean
    public ConnectorRegistry connectorRegistry(ObjectProvider<ConnectorHandler> handlers) {
        return new ConnectorRegistry(handlers.orderedStream().toList());
    }

    @Bean
    public ConditionEvaluator conditionEvaluator(Clock clock, ObjectProvider<StateQuerySource> stateSource) {
        return new ConditionEvaluator(clock, stateSource.getIfUnique());
    }

    @Bean
    @ConditionalOnMissingBean(NotificationSender.class)
    public NotificationSender notificationSender(NotificationProperties props) {
        return new DesktopNotificationSender(props);
    }

    @Bean
    public ActionDispatcher actionDispatcher(ConnectorRegistry registry, NotificationSender notifications) {
        return new ActionDispatcher(registry, notifications);
    }

    @Bean
    public TriggerScheduler triggerScheduler(
            @Qualifier("routineTriggerScheduler") ThreadPoolTaskScheduler taskScheduler) {
        return new TaskSchedulerTriggerScheduler(taskScheduler);
    }

    @Bean
    public TriggerManager triggerManager(TriggerScheduler scheduler,
                                         TriggerProperties props,
                                         ObjectProvider<StateQuerySource> stateSource,
                                         ObjectProvider<VisionDetectionSource> visionSources,
                                         Clock clock) {
        return new TriggerManager(scheduler, publisher, props, stateSource.getIfUnique(),
                visionSources.orderedStream().toList(), clock);
    }

    @Bean
    public RoutineMetricsPublisher routineMetricsPublisher(ObjectProvider<RoutineMetrics> metrics) {
        return new RoutineMetricsPublisher(metrics.getIfAvailable());
    }

    /**
     * Exposed as the interface so the async trigger listener is proxied through it.
     */
    @Bean
    public RoutineEngine routineEngine(RoutineRecordStore store,
                                       RoutineRecordCodec codec,
                                       RoutineStoreProperties storeProperties,
                                       TriggerManager triggerManager,
                                       ConditionEvaluator conditionEvaluator,
                                       ActionDispatcher actionDispatcher,
                                       RoutineMetricsPublisher metricsPublisher,
                                       Clock clock) {
        return DefaultRoutineEngineBuilder.builder()
                .store(store)
                .codec(codec)
                .storeProperties(storeProperties)
                .triggerManager(triggerManager)
                .conditionEvaluator(conditionEvaluator)
                .actionDispatcher(actionDispatcher)
                .publisher(publisher)
                .metricsPublisher(metricsPublisher)
                .clock(clock)
                .executionIds(IdGenerator.timestamped("exec", clock))
                .build();
    }
}
