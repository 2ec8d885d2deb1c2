package com.phillippitts.routineengine.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the routine execution pool and the trigger scheduler.
 * Defaults are conservative but can be adjusted based on the number of routines.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private ExecutorPoolProperties executor = new ExecutorPoolProperties();
    private SchedulerPoolProperties trigger = new SchedulerPoolProperties();

    public ExecutorPoolProperties getExecutor() {
        return executor;
    }

    public void setExecutor(ExecutorPoolProperties executor) {
        this.executor = executor;
    }

    public SchedulerPoolProperties getTrigger() {
        return trigger;
    }

    public void setTrigger(SchedulerPoolProperties trigger) {
        this.trigger = trigger;
    }

    /**
     * Routine execution pool configuration.
     */
    public static class ExecutorPoolProperties {
        private int corePoolSize = 4;
        private int maxPoolSize = 8;
        private int queueCapacity = 50;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "routine-exec-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Trigger scheduler configuration. Ticks only poll and publish, so a small pool suffices.
     */
    public static class SchedulerPoolProperties {
        private int poolSize = 4;
        private String threadNamePrefix = "routine-trigger-";
        private int awaitTerminationSeconds = 10;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }
    }
}
