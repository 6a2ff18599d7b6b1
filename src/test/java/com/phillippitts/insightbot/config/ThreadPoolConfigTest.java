package com.phillippitts.insightbot.config;

import com.phillippitts.insightbot.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateAnalysisExecutorWithDefaults() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        ThreadPoolTaskExecutor executor = config.analysisExecutor();

        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(4);
            assertThat(executor.getMaxPoolSize()).isEqualTo(8);
            assertThat(executor.getQueueCapacity()).isEqualTo(50);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("analysis-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        ThreadPoolTaskExecutor executor = config.analysisExecutor();

        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger(0);

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                try {
                    Thread.sleep(10);
                    completedTasks.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    latch.countDown();
                }
            });
        }

        boolean finished = latch.await(5, TimeUnit.SECONDS);
        executor.shutdown();

        assertThat(finished).isTrue();
        assertThat(completedTasks.get()).isEqualTo(taskCount);
    }

    @Test
    void shouldPropagateMdcToWorkerThreads() throws InterruptedException {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        ThreadPoolTaskExecutor executor = config.analysisExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> threadName = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        ThreadContext.put("guildId", "g-42");
        executor.execute(() -> {
            seen.set(ThreadContext.get("guildId"));
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        assertThat(seen.get()).isEqualTo("g-42");
        assertThat(threadName.get()).startsWith("analysis-pool-");
    }

    @Test
    void shouldRestoreCallerContextWhenTaskRunsInline() {
        ThreadContext.put("guildId", "outer");
        Runnable decorated = ThreadPoolConfig.mdcPropagating().decorate(() -> ThreadContext.put("guildId", "inner"));

        decorated.run();

        assertThat(ThreadContext.get("guildId")).isEqualTo("outer");
    }

    @Test
    void shouldRejectAnalysisTasksAfterShutdownInsteadOfDroppingThem() {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).analysisExecutor();
        AtomicInteger ran = new AtomicInteger();
        executor.shutdown();

        assertThatThrownBy(() -> executor.execute(ran::incrementAndGet))
                .isInstanceOf(TaskRejectedException.class);
        assertThat(ran.get()).isZero();
    }

    @Test
    void shouldRejectSessionLoopsBeyondMaxSessions() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getSession().setMaxSessions(1);
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(properties).sessionLoopExecutor();
        CountDownLatch release = new CountDownLatch(1);

        try {
            executor.execute(() -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            assertThatThrownBy(() -> executor.execute(() -> { }))
                    .isInstanceOf(TaskRejectedException.class);
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }
}
