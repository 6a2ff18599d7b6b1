package com.phillippitts.insightbot.presentation.controller;

import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.service.publish.InMemoryReportBoard;
import com.phillippitts.insightbot.service.publish.PostedMessage;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read access to the report board: notices, report starters and their threads.
 */
@RestController
class ReportController {

    private final InMemoryReportBoard reportBoard;

    ReportController(InMemoryReportBoard reportBoard) {
        this.reportBoard = reportBoard;
    }

    @GetMapping("/guilds/{guildId}/channels/{channelId}/messages")
    ResponseEntity<List<PostedMessage>> messages(@PathVariable String guildId, @PathVariable String channelId) {
        return ResponseEntity.ok(reportBoard.messages(GuildId.of(guildId), channelId));
    }
}
