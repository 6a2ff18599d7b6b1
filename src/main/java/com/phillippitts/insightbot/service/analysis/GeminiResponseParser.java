package com.phillippitts.insightbot.service.analysis;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Optional;

/**
 * Parses Gemini REST responses.
 *
 * <p>Uses org.json for lightweight parsing; malformed payloads surface as
 * {@link org.json.JSONException}.
 */
final class GeminiResponseParser {

    private GeminiResponseParser() {}

    /**
     * Concatenates the text parts of the first candidate.
     *
     * @return the report text, or "" when the response has no candidate text
     */
    static String extractText(String body) {
        JSONObject root = new JSONObject(body);
        JSONArray candidates = root.optJSONArray("candidates");
        if (candidates == null || candidates.isEmpty()) {
            return "";
        }
        JSONObject content = candidates.getJSONObject(0).optJSONObject("content");
        if (content == null) {
            return "";
        }
        JSONArray parts = content.optJSONArray("parts");
        if (parts == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length(); i++) {
            JSONObject part = parts.optJSONObject(i);
            if (part != null && part.has("text")) {
                sb.append(part.optString("text", ""));
            }
        }
        return sb.toString().trim();
    }

    /** Error message of an in-band {@code error} object, if present. */
    static Optional<String> errorMessage(String body) {
        JSONObject root = new JSONObject(body);
        JSONObject error = root.optJSONObject("error");
        if (error == null) {
            return Optional.empty();
        }
        return Optional.of(error.optString("status", "") + " " + error.optString("message", "unknown error"))
                .map(String::trim);
    }

    /** Parses an upload response ({@code {"file": {...}}}) or a bare file resource. */
    static UploadedFile parseFile(String body) {
        JSONObject root = new JSONObject(body);
        JSONObject file = root.has("file") ? root.getJSONObject("file") : root;
        return new UploadedFile(
                file.getString("name"),
                file.optString("uri", ""),
                file.optString("mimeType", "application/octet-stream"),
                file.optString("state", ""));
    }
}
