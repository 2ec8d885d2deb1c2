package com.phillippitts.routineengine.config;

import com.phillippitts.routineengine.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for trigger ticks and routine executions.
 *
 * <p>Ticks and executions use separate pools so that a slow action chain never delays another
 * routine's schedule. The executor propagates the Log4j2 ThreadContext (MDC) from the submitting
 * thread; tick tasks set their own {@code routineId}.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Bounded pool that runs routine executions for trigger fires.
     *
     * <p>Sizing via {@code threadpool.executor.*} (core 4, max 8, queue 50 by default). When the pool
     * and queue are full the publishing thread runs the execution itself
     * ({@link ThreadPoolExecutor.CallerRunsPolicy}), which slows ticks down instead of losing fires.
     *
     * @return executor referenced by {@code @Async("routineExecutor")}
     */
    @Bean(name = "routineExecutor")
    public ThreadPoolTaskExecutor routineExecutor() {
        ThreadPoolProperties.ExecutorPoolProperties props = threadPoolProperties.getExecutor();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler that runs trigger ticks ({@code threadpool.trigger.*}). Also picked up by
     * {@code @Scheduled} methods.
     */
    @Bean(name = "routineTriggerScheduler")
    public ThreadPoolTaskScheduler routineTriggerScheduler() {
        ThreadPoolProperties.SchedulerPoolProperties props = threadPoolProperties.getTrigger();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    // Package-private for tests
    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
