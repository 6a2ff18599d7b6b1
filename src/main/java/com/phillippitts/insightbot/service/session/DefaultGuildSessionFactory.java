package com.phillippitts.insightbot.service.session;

import com.phillippitts.insightbot.config.properties.SessionProperties;
import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.service.settings.GuildSettingsStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires new sessions to the shared collaborators.
 */
@Component
public class DefaultGuildSessionFactory implements GuildSessionFactory {

    private final GuildSettingsStore settingsStore;
    private final AnalysisCycle cycle;
    private final Executor loopExecutor;
    private final SessionProperties props;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    public DefaultGuildSessionFactory(GuildSettingsStore settingsStore,
                                      AnalysisCycle cycle,
                                      @Qualifier("sessionLoopExecutor") Executor loopExecutor,
                                      SessionProperties props,
                                      ApplicationEventPublisher events,
                                      Clock clock) {
        this.settingsStore = settingsStore;
        this.cycle = cycle;
        this.loopExecutor = loopExecutor;
        this.props = props;
        this.events = events;
        this.clock = clock;
    }

    @Override
    public GuildSession create(GuildId guildId) {
        return new GuildSession(guildId, settingsStore, cycle, loopExecutor, props, events, clock);
    }
}
