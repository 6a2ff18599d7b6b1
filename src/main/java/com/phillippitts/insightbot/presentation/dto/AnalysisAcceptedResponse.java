package com.phillippitts.insightbot.presentation.dto;

/**
 * Acknowledges a forced analysis; the report is posted to the session's text channel.
 */
public record AnalysisAcceptedResponse(String guildId, String status) {

    public static AnalysisAcceptedResponse queued(String guildId) {
        return new AnalysisAcceptedResponse(guildId, "queued");
    }
}
