package com.phillippitts.insightbot.service.analysis;

import org.json.JSONException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeminiResponseParserTest {

    @Test
    void shouldConcatenateTextPartsOfFirstCandidate() {
        String body = """
                {"candidates":[
                  {"content":{"parts":[{"text":"Hello "},{"inlineData":{}},{"text":"world "}]}},
                  {"content":{"parts":[{"text":"ignored"}]}}
                ]}
                """;

        assertThat(GeminiResponseParser.extractText(body)).isEqualTo("Hello world");
    }

    @Test
    void shouldReturnEmptyTextWhenNoCandidates() {
        assertThat(GeminiResponseParser.extractText("{}")).isEmpty();
        assertThat(GeminiResponseParser.extractText("{\"candidates\":[]}")).isEmpty();
        assertThat(GeminiResponseParser.extractText("{\"candidates\":[{\"finishReason\":\"SAFETY\"}]}")).isEmpty();
    }

    @Test
    void shouldReportInBandError() {
        String body = "{\"error\":{\"code\":429,\"status\":\"RESOURCE_EXHAUSTED\",\"message\":\"Quota exceeded\"}}";

        assertThat(GeminiResponseParser.errorMessage(body)).contains("RESOURCE_EXHAUSTED Quota exceeded");
        assertThat(GeminiResponseParser.errorMessage("{\"candidates\":[]}")).isEmpty();
    }

    @Test
    void shouldParseWrappedAndBareFileResources() {
        UploadedFile wrapped = GeminiResponseParser.parseFile(
                "{\"file\":{\"name\":\"files/a1\",\"uri\":\"https://x/files/a1\",\"mimeType\":\"audio/wav\",\"state\":\"PROCESSING\"}}");
        UploadedFile bare = GeminiResponseParser.parseFile("{\"name\":\"files/a1\",\"state\":\"ACTIVE\"}");

        assertThat(wrapped.name()).isEqualTo("files/a1");
        assertThat(wrapped.mimeType()).isEqualTo("audio/wav");
        assertThat(wrapped.isActive()).isFalse();
        assertThat(bare.isActive()).isTrue();
        assertThat(bare.mimeType()).isEqualTo("application/octet-stream");
    }

    @Test
    void shouldFailOnMalformedPayload() {
        assertThatThrownBy(() -> GeminiResponseParser.extractText("<html>"))
                .isInstanceOf(JSONException.class);
        assertThatThrownBy(() -> GeminiResponseParser.parseFile("{\"file\":{}}"))
                .isInstanceOf(JSONException.class);
    }
}
