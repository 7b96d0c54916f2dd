package com.phillippitts.readaloud.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
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
 * Exposes pipeline and synthesis executor metrics via Micrometer.
 *
 * <p>For each pool ({@code pipeline}, {@code synthesis}) the following gauges are registered:
 * <ul>
 *   <li>{@code readaloud.pool.size} - current number of threads</li>
 *   <li>{@code readaloud.pool.active} - threads actively executing tasks</li>
 *   <li>{@code readaloud.pool.queued} - tasks waiting in the queue</li>
 *   <li>{@code readaloud.pool.completed} - cumulative count of completed tasks</li>
 * </ul>
 * tagged with {@code pool=<name>}.
 *
 * <p>Additionally logs a health summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> synthesisExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("pipelineExecutor") ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider,
            @Qualifier("synthesisExecutor") ObjectProvider<ThreadPoolTaskExecutor> synthesisExecutorProvider) {
        this.pipelineExecutorProvider = pipelineExecutorProvider;
        this.synthesisExecutorProvider = synthesisExecutorProvider;
    }

    /**
     * Binds executor gauges to the Micrometer registry.
     *
     * @return MeterBinder that registers pool gauges
     */
    @Bean
    public MeterBinder executorPoolMetrics() {
        return registry -> {
            bindPool(registry, "pipeline", pipelineExecutorProvider.getObject().getThreadPoolExecutor());
            bindPool(registry, "synthesis", synthesisExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Executor metrics registered: readaloud.pool.* available via /actuator/metrics");
        };
    }

    private static void bindPool(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("readaloud.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("readaloud.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("readaloud.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("readaloud.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tag("pool", pool)
                .register(registry);
    }

    /**
     * Logs executor health every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor pipeline = pipelineExecutorProvider.getObject().getThreadPoolExecutor();
        ThreadPoolExecutor synthesis = synthesisExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Pool health: pipeline active={}/{}, synthesis active={}/{} queued={} completed={}",
                pipeline.getActiveCount(),
                pipeline.getMaximumPoolSize(),
                synthesis.getActiveCount(),
                synthesis.getMaximumPoolSize(),
                synthesis.getQueue().size(),
                synthesis.getCompletedTaskCount()
        );
    }
}
