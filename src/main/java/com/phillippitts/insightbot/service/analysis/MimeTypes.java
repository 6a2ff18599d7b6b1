package com.phillippitts.insightbot.service.analysis;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Audio MIME types by file extension, as accepted by the Files API.
 */
final class MimeTypes {

    private MimeTypes() {}

    static String forAudio(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        String ext = dot >= 0 ? name.substring(dot + 1) : "";
        return switch (ext) {
            case "wav" -> "audio/wav";
            case "mp3" -> "audio/mp3";
            case "ogg", "opus" -> "audio/ogg";
            case "flac" -> "audio/flac";
            case "aac" -> "audio/aac";
            default -> "application/octet-stream";
        };
    }
}
