package com.phillippitts.insightbot.config;

import com.phillippitts.insightbot.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools behind the session engine.
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
     * Worker pool for conversion and analysis offloaded from session loops.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.analysis.*} properties:
     * <ul>
     *   <li>Core pool: default 4 - handles typical load</li>
     *   <li>Max pool: default 8 - handles several guilds reporting at once</li>
     *   <li>Queue: default 50 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}
     * Each session loop waits on at most one task, so rejection only happens once the pool is
     * saturated or shut down. The cycle then fails with a notice and capture continues.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread so guild ids stay on async log lines.
     *
     * @return Configured executor for analysis work
     */
    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor() {
        ThreadPoolProperties.AnalysisPoolProperties props = threadPoolProperties.getAnalysis();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Hosts one long-running loop per capturing session.
     *
     * <p>Loops are handed to a thread directly (queue capacity 0) and rejected with
     * {@link ThreadPoolExecutor.AbortPolicy} once {@code threadpool.session.max-sessions}
     * loops are running, so a start fails fast instead of waiting behind another guild.
     *
     * @return Configured executor for session loops
     */
    @Bean(name = "sessionLoopExecutor")
    public ThreadPoolTaskExecutor sessionLoopExecutor() {
        ThreadPoolProperties.SessionPoolProperties props = threadPoolProperties.getSession();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(0);
        executor.setMaxPoolSize(props.getMaxSessions());
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

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
