package com.phillippitts.insightbot.service.analysis;

import com.phillippitts.insightbot.domain.AnalysisMode;
import com.phillippitts.insightbot.domain.SpeakerId;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything one analysis call needs.
 *
 * @param artifacts    speaker to converted audio file
 * @param context      tail of the previous successful report, empty for the first cycle
 * @param speakerNames speaker to display name
 * @param mode         report kind
 * @param credential   backend API key; blank means none is configured
 */
public record AnalysisRequest(Map<SpeakerId, Path> artifacts,
                              String context,
                              Map<SpeakerId, String> speakerNames,
                              AnalysisMode mode,
                              String credential) {

    public AnalysisRequest {
        Objects.requireNonNull(artifacts, "artifacts must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        artifacts = Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
        speakerNames = speakerNames == null ? Map.of() : Map.copyOf(speakerNames);
        context = context == null ? "" : context;
    }

    public boolean hasCredential() {
        return credential != null && !credential.isBlank();
    }

    @Override
    public String toString() {
        return "AnalysisRequest[speakers=" + artifacts.size() + ", contextChars=" + context.length()
                + ", mode=" + mode.value() + ", credential=" + (hasCredential() ? "set" : "unset") + "]";
    }
}
