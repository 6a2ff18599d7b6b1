package com.phillippitts.insightbot.presentation.controller;

import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.domain.SessionState;
import com.phillippitts.insightbot.domain.StartResult;
import com.phillippitts.insightbot.exception.SessionStateException;
import com.phillippitts.insightbot.presentation.dto.AnalysisAcceptedResponse;
import com.phillippitts.insightbot.presentation.dto.SessionStatusResponse;
import com.phillippitts.insightbot.presentation.dto.StartAnalysisRequest;
import com.phillippitts.insightbot.service.session.SessionService;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session lifecycle commands: start, stop, analyze now and status.
 */
@RestController
@RequestMapping("/guilds/{guildId}/analysis")
class AnalysisController {

    private static final Logger LOG = LogManager.getLogger(AnalysisController.class);

    private final SessionService sessionService;

    AnalysisController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping
    ResponseEntity<SessionStatusResponse> start(@PathVariable String guildId,
                                                @Valid @RequestBody StartAnalysisRequest request) {
        GuildId id = GuildId.of(guildId);
        StartResult result = sessionService.start(id, request.voiceChannel(), request.textChannel());
        if (result == StartResult.SESSION_CLOSED) {
            throw new SessionStateException(id, SessionState.STOPPING,
                    "The previous session is still shutting down; retry shortly");
        }
        if (result != StartResult.STARTED) {
            throw new SessionStateException(id, SessionState.CAPTURING, "Analysis is already running");
        }
        LOG.info("Analysis started: voiceChannel={}, textChannel={}", request.voiceChannel(), request.textChannel());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(SessionStatusResponse.from(sessionService.status(id)));
    }

    /**
     * Stops the session. The final report is posted before this returns unless {@code skipFinal} is set.
     */
    @DeleteMapping
    ResponseEntity<SessionStatusResponse> stop(@PathVariable String guildId,
                                               @RequestParam(defaultValue = "false") boolean skipFinal) {
        GuildId id = GuildId.of(guildId);
        if (!sessionService.stop(id, skipFinal)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(SessionStatusResponse.from(sessionService.status(id)));
    }

    @PostMapping("/now")
    ResponseEntity<AnalysisAcceptedResponse> analyzeNow(@PathVariable String guildId) {
        GuildId id = GuildId.of(guildId);
        return sessionService.analyzeNow(id)
                .map(pending -> ResponseEntity.status(HttpStatus.ACCEPTED).body(AnalysisAcceptedResponse.queued(guildId)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping
    ResponseEntity<SessionStatusResponse> status(@PathVariable String guildId) {
        return ResponseEntity.ok(SessionStatusResponse.from(sessionService.status(GuildId.of(guildId))));
    }
}
