package com.phillippitts.insightbot.config;

import com.phillippitts.insightbot.service.session.GuildSessionFactory;
import com.phillippitts.insightbot.service.session.SessionRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Session engine wiring.
 *
 * <p>The registry is an ordinary bean owned by the context; on shutdown every session is
 * stopped without a final cycle before the loop executor goes away.
 */
@Configuration
public class SessionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(destroyMethod = "shutdown")
    public SessionRegistry sessionRegistry(GuildSessionFactory guildSessionFactory) {
        return new SessionRegistry(guildSessionFactory);
    }
}
