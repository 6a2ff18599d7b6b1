package com.phillippitts.insightbot.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The analysis pool runs conversion and analysis work offloaded from session loops.
 * The session pool hosts one long-running loop per capturing guild, so its size caps the
 * number of concurrent sessions.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private AnalysisPoolProperties analysis = new AnalysisPoolProperties();
    private SessionPoolProperties session = new SessionPoolProperties();

    public AnalysisPoolProperties getAnalysis() {
        return analysis;
    }

    public void setAnalysis(AnalysisPoolProperties analysis) {
        this.analysis = analysis;
    }

    public SessionPoolProperties getSession() {
        return session;
    }

    public void setSession(SessionPoolProperties session) {
        this.session = session;
    }

    /**
     * Analysis worker pool configuration.
     */
    public static class AnalysisPoolProperties {
        private int corePoolSize = 4;
        private int maxPoolSize = 8;
        private int queueCapacity = 50;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "analysis-pool-";

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
     * Session loop pool configuration. Loops are never queued.
     */
    public static class SessionPoolProperties {
        private int maxSessions = 64;
        private String threadNamePrefix = "session-loop-";

        public int getMaxSessions() {
            return maxSessions;
        }

        public void setMaxSessions(int maxSessions) {
            this.maxSessions = maxSessions;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
