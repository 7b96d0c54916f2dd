package com.phillippitts.readaloud.config;

import com.phillippitts.readaloud.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the executors that run streaming sessions.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for the long-running loops of a session: one feeder, N synthesis workers and one
     * playback controller per session.
     *
     * <p>Uses a hand-off queue by default ({@code threadpool.pipeline.queue-capacity=0}) so a loop
     * never waits in a queue behind another loop it depends on. When the pool is exhausted the
     * submission is rejected ({@link ThreadPoolExecutor.AbortPolicy}) and the session fails to start
     * instead of deadlocking.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext (notably {@code sessionId}) from the
     * submitting thread to the loop thread.
     *
     * @return executor for pipeline loops
     */
    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor() {
        ThreadPoolProperties.PoolProperties props = threadPoolProperties.getPipeline();
        ThreadPoolTaskExecutor executor = newExecutor(props);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Executor for individual synthesis calls.
     *
     * <p>Workers submit each call here and wait with a per-call timeout that starts once the call
     * runs, so time spent in the queue is not counted. On timeout the returned future is cancelled
     * with interruption. Rejections surface as failed chunks, never as a stalled worker.
     *
     * @return executor for synthesis calls
     */
    @Bean(name = "synthesisExecutor")
    public ThreadPoolTaskExecutor synthesisExecutor() {
        ThreadPoolProperties.PoolProperties props = threadPoolProperties.getSynthesis();
        ThreadPoolTaskExecutor executor = newExecutor(props);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler driving rate-limited progress publication.
     *
     * @return scheduler shared by all sessions' progress trackers
     */
    @Bean(name = "progressScheduler")
    public ThreadPoolTaskScheduler progressScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("progress-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setTaskDecorator(mdcPropagatingDecorator());
        return executor;
    }

    /**
     * Decorator that copies the submitter's ThreadContext onto the executing thread and restores
     * the executing thread's previous context afterwards.
     *
     * @return MDC-propagating task decorator
     */
    static TaskDecorator mdcPropagatingDecorator() {
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
