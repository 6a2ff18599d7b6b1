package com.phillippitts.insightbot.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * Process-wide speaker id to display name map ({@code speakers.names.<id>=<name>}).
 */
@ConfigurationProperties(prefix = "speakers")
public record SpeakerDirectoryProperties(Map<String, String> names) {

    public SpeakerDirectoryProperties {
        names = names == null ? Map.of() : Map.copyOf(names);
    }
}
