package com.phillippitts.routineengine.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the routine executor pool through Micrometer:
 * <ul>
 *   <li>routines.pool.size - current number of threads</li>
 *   <li>routines.pool.active - threads running an execution</li>
 *   <li>routines.pool.queued - executions waiting in the queue</li>
 *   <li>routines.pool.completed - cumulative completed executions</li>
 *   <li>routines.pool.core.size / routines.pool.max.size - configured bounds</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> executorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("routineExecutor") ObjectProvider<ThreadPoolTaskExecutor> executorProvider) {
        this.executorProvider = executorProvider;
    }

    @Bean
    public MeterBinder routineExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = executorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("routines.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the routine pool")
                    .register(registry);

            Gauge.builder("routines.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively executing routines")
                    .register(registry);

            Gauge.builder("routines.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of routine executions waiting in the queue")
                    .register(registry);

            Gauge.builder("routines.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed routine executions")
                    .register(registry);

            Gauge.builder("routines.pool.core.size", executor, ThreadPoolExecutor::getCorePoolSize)
                    .description("Configured core pool size for the routine executor")
                    .register(registry);

            Gauge.builder("routines.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                    .description("Configured maximum pool size for the routine executor")
                    .register(registry);

            LOG.info("Routine thread pool metrics registered: routines.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = executorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Routine Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()
        );
    }
}
