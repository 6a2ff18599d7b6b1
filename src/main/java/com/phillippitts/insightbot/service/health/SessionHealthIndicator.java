package com.phillippitts.insightbot.service.health;

import com.phillippitts.insightbot.config.properties.ThreadPoolProperties;
import com.phillippitts.insightbot.service.session.SessionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the session engine.
 *
 * <p>Reports session capacity:
 * <ul>
 *   <li>UP: session loops available</li>
 *   <li>DEGRADED: every session loop slot is in use, new starts will be rejected</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SessionHealthIndicator implements HealthIndicator {

    private final SessionRegistry registry;
    private final int maxSessions;

    public SessionHealthIndicator(SessionRegistry registry, ThreadPoolProperties threadPoolProperties) {
        this.registry = registry;
        this.maxSessions = threadPoolProperties.getSession().getMaxSessions();
    }

    @Override
    public Health health() {
        int active = registry.activeCount();
        Health.Builder builder = active >= maxSessions
                ? new Health.Builder().status("DEGRADED").withDetail("status", "Session capacity exhausted")
                : new Health.Builder().up().withDetail("status", "Accepting sessions");
        return builder
                .withDetail("activeSessions", active)
                .withDetail("registeredSessions", registry.size())
                .withDetail("maxSessions", maxSessions)
                .build();
    }
}
