package com.phillippitts.insightbot.presentation.controller;

import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.domain.SpeakerId;
import com.phillippitts.insightbot.service.speaker.GuildMemberDirectory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SpeakerController.class)
class SpeakerControllerTest {

    private static final GuildId GUILD = GuildId.of("g1");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GuildMemberDirectory memberDirectory;

    @Test
    void shouldListRegisteredNames() throws Exception {
        when(memberDirectory.members(GUILD)).thenReturn(Map.of(SpeakerId.of("42"), "Alice"));

        mockMvc.perform(get("/guilds/g1/speakers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['42']").value("Alice"));
    }

    @Test
    void shouldRegisterName() throws Exception {
        mockMvc.perform(put("/guilds/g1/speakers/42").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"displayName\":\"Alice\"}"))
                .andExpect(status().isNoContent());

        verify(memberDirectory).register(GUILD, SpeakerId.of("42"), "Alice");
    }

    @Test
    void shouldRejectBlankName() throws Exception {
        mockMvc.perform(put("/guilds/g1/speakers/42").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"displayName\":\"\"}"))
                .andExpect(status().isBadRequest());

        verify(memberDirectory, never()).register(any(), any(), anyString());
    }

    @Test
    void shouldReturnNotFoundWhenForgettingUnknownSpeaker() throws Exception {
        when(memberDirectory.forget(GUILD, SpeakerId.of("42"))).thenReturn(false);

        mockMvc.perform(delete("/guilds/g1/speakers/42"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldForgetKnownSpeaker() throws Exception {
        when(memberDirectory.forget(GUILD, SpeakerId.of("42"))).thenReturn(true);

        mockMvc.perform(delete("/guilds/g1/speakers/42"))
                .andExpect(status().isNoContent());
    }
}
