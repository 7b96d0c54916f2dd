package com.phillippitts.readaloud.config;

import com.phillippitts.readaloud.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreatePipelineExecutorWithDefaults() {
        ThreadPoolTaskExecutor executor = config.pipelineExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(4);
            assertThat(executor.getMaxPoolSize()).isEqualTo(64);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("pipeline-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldCreateSynthesisExecutorWithDefaults() {
        ThreadPoolTaskExecutor executor = config.synthesisExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(2);
            assertThat(executor.getMaxPoolSize()).isEqualTo(16);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("synth-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldRejectLoopsWhenPipelinePoolIsExhausted() throws InterruptedException {
        // Arrange
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getPipeline().setCorePoolSize(1);
        properties.getPipeline().setMaxPoolSize(1);
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(properties).pipelineExecutor();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);

        try {
            executor.execute(() -> {
                started.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

            // Act + Assert
            assertThatThrownBy(() -> executor.execute(() -> { }))
                    .isInstanceOf(RejectedExecutionException.class);
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void shouldUseConfiguredThreadNamePrefix() throws InterruptedException {
        ThreadPoolTaskExecutor executor = config.synthesisExecutor();
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> threadName = new AtomicReference<>();

        try {
            executor.execute(() -> {
                threadName.set(Thread.currentThread().getName());
                latch.countDown();
            });

            assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(threadName.get()).startsWith("synth-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldPropagateThreadContextToPoolThreads() throws InterruptedException {
        // Arrange
        ThreadPoolTaskExecutor executor = config.pipelineExecutor();
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        ThreadContext.put("sessionId", "abc123");

        try {
            // Act
            executor.execute(() -> {
                seen.set(ThreadContext.get("sessionId"));
                latch.countDown();
            });

            // Assert
            assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(seen.get()).isEqualTo("abc123");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldRestoreExecutingThreadContextAfterTask() {
        // Arrange
        TaskDecorator decorator = ThreadPoolConfig.mdcPropagatingDecorator();
        ThreadContext.put("sessionId", "submitter");
        Runnable decorated = decorator.decorate(() ->
                assertThat(ThreadContext.get("sessionId")).isEqualTo("submitter"));
        ThreadContext.clearAll();
        ThreadContext.put("requestId", "worker");

        // Act
        decorated.run();

        // Assert
        assertThat(ThreadContext.get("requestId")).isEqualTo("worker");
        assertThat(ThreadContext.get("sessionId")).isNull();
    }

    @Test
    void shouldCreateSingleThreadProgressScheduler() {
        ThreadPoolTaskScheduler scheduler = config.progressScheduler();
        try {
            assertThat(scheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(1);
            assertThat(scheduler.getThreadNamePrefix()).isEqualTo("progress-");
        } finally {
            scheduler.shutdown();
        }
    }
}
