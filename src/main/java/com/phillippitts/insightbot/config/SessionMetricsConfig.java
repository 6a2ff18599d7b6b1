package com.phillippitts.insightbot.config;

import com.phillippitts.insightbot.service.session.SessionRegistry;
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
 * Session and worker pool gauges exposed via Micrometer.
 *
 * <ul>
 *   <li>insightbot.sessions.active - sessions capturing or stopping</li>
 *   <li>insightbot.sessions.registered - sessions held by the registry</li>
 *   <li>insightbot.analysis.pool.active - analysis tasks running</li>
 *   <li>insightbot.analysis.pool.queued - analysis tasks waiting</li>
 *   <li>insightbot.analysis.pool.size - current analysis pool size</li>
 * </ul>
 *
 * <p>Additionally logs a summary every 5 minutes.
 */
@Configuration
public class SessionMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(SessionMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> analysisExecutorProvider;
    private final ObjectProvider<SessionRegistry> registryProvider;

    public SessionMetricsConfig(
            @Qualifier("analysisExecutor") ObjectProvider<ThreadPoolTaskExecutor> analysisExecutorProvider,
            ObjectProvider<SessionRegistry> registryProvider) {
        this.analysisExecutorProvider = analysisExecutorProvider;
        this.registryProvider = registryProvider;
    }

    @Bean
    public MeterBinder sessionMetrics() {
        return registry -> {
            SessionRegistry sessions = registryProvider.getObject();
            ThreadPoolExecutor executor = analysisExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("insightbot.sessions.active", sessions, SessionRegistry::activeCount)
                    .description("Sessions capturing or stopping")
                    .register(registry);

            Gauge.builder("insightbot.sessions.registered", sessions, SessionRegistry::size)
                    .description("Sessions held by the registry")
                    .register(registry);

            Gauge.builder("insightbot.analysis.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Analysis tasks running")
                    .register(registry);

            Gauge.builder("insightbot.analysis.pool.queued", executor, e -> e.getQueue().size())
                    .description("Analysis tasks waiting in the queue")
                    .register(registry);

            Gauge.builder("insightbot.analysis.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the analysis pool")
                    .register(registry);

            LOG.info("Session metrics registered: insightbot.sessions.* and insightbot.analysis.pool.*");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logSessionHealth() {
        SessionRegistry sessions = registryProvider.getObject();
        ThreadPoolExecutor executor = analysisExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Session health: active={}, registered={}, analysisPool={}/{}, queued={}",
                sessions.activeCount(),
                sessions.size(),
                executor.getActiveCount(),
                executor.getMaximumPoolSize(),
                executor.getQueue().size());
    }
}
