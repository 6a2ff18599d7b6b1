package com.phillippitts.insightbot.presentation.controller;

import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.domain.SpeakerId;
import com.phillippitts.insightbot.presentation.dto.SpeakerNameRequest;
import com.phillippitts.insightbot.service.speaker.GuildMemberDirectory;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.TreeMap;

@RestController
@RequestMapping("/guilds/{guildId}/speakers")
class SpeakerController {

    private final GuildMemberDirectory memberDirectory;

    SpeakerController(GuildMemberDirectory memberDirectory) {
        this.memberDirectory = memberDirectory;
    }

    @GetMapping
    ResponseEntity<Map<String, String>> list(@PathVariable String guildId) {
        Map<String, String> names = new TreeMap<>();
        memberDirectory.members(GuildId.of(guildId)).forEach((id, name) -> names.put(id.value(), name));
        return ResponseEntity.ok(names);
    }

    @PutMapping("/{speakerId}")
    ResponseEntity<Void> register(@PathVariable String guildId,
                                  @PathVariable String speakerId,
                                  @Valid @RequestBody SpeakerNameRequest request) {
        memberDirectory.register(GuildId.of(guildId), SpeakerId.of(speakerId), request.displayName());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{speakerId}")
    ResponseEntity<Void> forget(@PathVariable String guildId, @PathVariable String speakerId) {
        return memberDirectory.forget(GuildId.of(guildId), SpeakerId.of(speakerId))
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
