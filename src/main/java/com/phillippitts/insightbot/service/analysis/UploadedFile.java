package com.phillippitts.insightbot.service.analysis;

/**
 * A file held by the Files API.
 *
 * @param name     resource name, e.g. {@code files/abc123}
 * @param uri      URI referenced from generateContent
 * @param mimeType MIME type reported by the API
 * @param state    {@code PROCESSING}, {@code ACTIVE} or {@code FAILED}
 */
record UploadedFile(String name, String uri, String mimeType, String state) {

    static final String ACTIVE = "ACTIVE";
    static final String FAILED = "FAILED";

    boolean isActive() {
        return ACTIVE.equals(state);
    }

    boolean isFailed() {
        return FAILED.equals(state);
    }
}
