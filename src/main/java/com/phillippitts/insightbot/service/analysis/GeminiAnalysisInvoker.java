package com.phillippitts.insightbot.service.analysis;

import com.phillippitts.insightbot.config.properties.GeminiProperties;
import com.phillippitts.insightbot.domain.AnalysisResult;
import com.phillippitts.insightbot.domain.SpeakerId;
import com.phillippitts.insightbot.service.speaker.SpeakerNameResolver;
import com.phillippitts.insightbot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link AnalysisInvoker} over the Gemini REST API.
 *
 * <p>Flow per call:
 * <ol>
 *   <li>Upload each artifact to the Files API and poll until it is {@code ACTIVE}; a file that
 *       fails or never activates is skipped</li>
 *   <li>Send one generateContent request: mode prompt, optional previous context, then a
 *       speaker label and file reference per speaker, with Google Search grounding</li>
 *   <li>Delete every uploaded file, whatever the outcome</li>
 * </ol>
 *
 * <p>HTTP 429 and quota errors map to {@link AnalysisResult.Kind#RATE_LIMITED}. Nothing is retried.
 */
@Component
public class GeminiAnalysisInvoker implements AnalysisInvoker {

    private static final Logger LOG = LogManager.getLogger(GeminiAnalysisInvoker.class);
    private static final int MAX_ERROR_BODY_CHARS = 300;

    private final RestClient restClient;
    private final GeminiProperties props;

    public GeminiAnalysisInvoker(@Qualifier("geminiRestClient") RestClient restClient, GeminiProperties props) {
        this.restClient = Objects.requireNonNull(restClient);
        this.props = Objects.requireNonNull(props);
    }

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        if (!request.hasCredential()) {
            return AnalysisResult.noCredential();
        }
        if (request.artifacts().isEmpty()) {
            return AnalysisResult.uploadFailed("no artifacts to upload");
        }
        String key = request.credential();
        List<UploadedFile> uploaded = new ArrayList<>();
        try {
            JSONArray parts = new JSONArray();
            parts.put(textPart(AnalysisPrompts.forMode(request.mode())));
            if (!request.context().isBlank()) {
                parts.put(textPart(AnalysisPrompts.contextPreamble(request.context())));
            }

            int ready = 0;
            for (Map.Entry<SpeakerId, Path> entry : request.artifacts().entrySet()) {
                SpeakerId speaker = entry.getKey();
                Optional<UploadedFile> file = upload(entry.getValue(), key);
                if (file.isEmpty()) {
                    continue;
                }
                uploaded.add(file.get());
                Optional<UploadedFile> active = awaitActive(file.get(), key);
                if (active.isEmpty()) {
                    continue;
                }
                String name = request.speakerNames().getOrDefault(speaker, SpeakerNameResolver.syntheticName(speaker));
                parts.put(textPart(AnalysisPrompts.speakerLabel(name)));
                parts.put(fileDataPart(active.get()));
                ready++;
            }
            if (ready == 0) {
                return AnalysisResult.uploadFailed("none of " + request.artifacts().size() + " artifacts could be uploaded");
            }

            String body = generate(parts, key);
            Optional<String> inBandError = GeminiResponseParser.errorMessage(body);
            if (inBandError.isPresent()) {
                return classifyMessage(inBandError.get());
            }
            String text = GeminiResponseParser.extractText(body);
            LOG.info("Analysis completed: speakers={}, reportChars={}", ready, text.length());
            return AnalysisResult.success(text);
        } catch (RestClientResponseException e) {
            if (isRateLimit(e)) {
                LOG.warn("Analysis rate limited: status={}", e.getStatusCode().value());
                return AnalysisResult.rateLimited("HTTP " + e.getStatusCode().value());
            }
            LOG.warn("Analysis request failed: status={}, body={}", e.getStatusCode().value(),
                    LogSanitizer.truncate(e.getResponseBodyAsString(), MAX_ERROR_BODY_CHARS));
            return AnalysisResult.failure("HTTP " + e.getStatusCode().value() + ": "
                    + LogSanitizer.truncate(e.getResponseBodyAsString(), MAX_ERROR_BODY_CHARS));
        } catch (RestClientException e) {
            LOG.warn("Analysis request failed: {}", e.getMessage());
            return AnalysisResult.failure(e.getMessage());
        } catch (JSONException e) {
            LOG.warn("Malformed analysis response: {}", e.getMessage());
            return AnalysisResult.failure("malformed response: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AnalysisResult.failure("interrupted while waiting for uploads");
        } finally {
            deleteAll(uploaded, key);
        }
    }

    private Optional<UploadedFile> upload(Path file, String key) {
        String mimeType = MimeTypes.forAudio(file);
        HttpHeaders partHeaders = new HttpHeaders();
        partHeaders.setContentType(MediaType.parseMediaType(mimeType));
        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("file", new HttpEntity<>(new FileSystemResource(file), partHeaders));
        try {
            String body = restClient.post()
                    .uri(props.uploadBaseUrl() + "/files?key={key}", key)
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(form)
                    .retrieve()
                    .body(String.class);
            UploadedFile uploaded = GeminiResponseParser.parseFile(body);
            LOG.debug("Uploaded {} as {}", file.getFileName(), uploaded.name());
            return Optional.of(uploaded);
        } catch (RestClientResponseException e) {
            if (isRateLimit(e)) {
                throw e;
            }
            LOG.warn("Upload failed for {}: status={}", file.getFileName(), e.getStatusCode().value());
            return Optional.empty();
        } catch (RestClientException | JSONException e) {
            LOG.warn("Upload failed for {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<UploadedFile> awaitActive(UploadedFile file, String key) throws InterruptedException {
        UploadedFile current = file;
        for (int attempt = 0; attempt < props.pollAttempts(); attempt++) {
            if (current.isActive()) {
                return Optional.of(current);
            }
            if (current.isFailed()) {
                LOG.warn("File processing failed: {}", file.name());
                return Optional.empty();
            }
            Thread.sleep(props.pollInterval().toMillis());
            try {
                String body = restClient.get()
                        .uri(props.baseUrl() + "/" + file.name() + "?key={key}", key)
                        .retrieve()
                        .body(String.class);
                current = GeminiResponseParser.parseFile(body);
            } catch (RestClientResponseException e) {
                if (isRateLimit(e)) {
                    throw e;
                }
                LOG.debug("Polling {} failed: status={}", file.name(), e.getStatusCode().value());
            }
        }
        if (current.isActive()) {
            return Optional.of(current);
        }
        LOG.warn("File {} not active after {} polls", file.name(), props.pollAttempts());
        return Optional.empty();
    }

    private String generate(JSONArray parts, String key) {
        JSONObject request = new JSONObject()
                .put("contents", new JSONArray().put(new JSONObject()
                        .put("role", "user")
                        .put("parts", parts)))
                .put("tools", new JSONArray().put(new JSONObject()
                        .put("google_search", new JSONObject())));
        return restClient.post()
                .uri(props.baseUrl() + "/models/{model}:generateContent?key={key}", props.model(), key)
                .contentType(MediaType.APPLICATION_JSON)
                .body(request.toString())
                .retrieve()
                .body(String.class);
    }

    private void deleteAll(List<UploadedFile> files, String key) {
        for (UploadedFile file : files) {
            try {
                restClient.delete()
                        .uri(props.baseUrl() + "/" + file.name() + "?key={key}", key)
                        .retrieve()
                        .toBodilessEntity();
            } catch (RestClientException e) {
                LOG.debug("Failed to delete uploaded file {}: {}", file.name(), e.getMessage());
            }
        }
    }

    private static JSONObject textPart(String text) {
        return new JSONObject().put("text", text);
    }

    private static JSONObject fileDataPart(UploadedFile file) {
        return new JSONObject().put("file_data", new JSONObject()
                .put("file_uri", file.uri())
                .put("mime_type", file.mimeType()));
    }

    static boolean isRateLimit(RestClientResponseException e) {
        if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return true;
        }
        return isQuotaMessage(e.getResponseBodyAsString());
    }

    private static boolean isQuotaMessage(String text) {
        return text != null && (text.contains("RESOURCE_EXHAUSTED") || text.contains("Quota exceeded"));
    }

    private static AnalysisResult classifyMessage(String message) {
        if (isQuotaMessage(message)) {
            return AnalysisResult.rateLimited(message);
        }
        return AnalysisResult.failure(message);
    }
}
