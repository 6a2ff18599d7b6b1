package com.phillippitts.insightbot.presentation.dto;

import com.phillippitts.insightbot.service.session.SessionStatus;

import java.time.Instant;

public record SessionStatusResponse(String guildId,
                                    String state,
                                    Instant nextCycleAt,
                                    Long secondsUntilNextCycle,
                                    int contextChars,
                                    long bufferedBytes) {

    public static SessionStatusResponse from(SessionStatus status) {
        return new SessionStatusResponse(
                status.guildId().value(),
                status.state().name(),
                status.nextCycleAt(),
                status.secondsUntilNextCycle(),
                status.contextChars(),
                status.bufferedBytes());
    }
}
