package com.phillippitts.insightbot.service.audio;

import com.phillippitts.insightbot.exception.AudioConversionException;

import java.nio.file.Path;

/**
 * Converts one speaker's raw PCM file into an artifact the analysis backend accepts.
 */
public interface AudioConverter {

    /** File extension of produced artifacts, without the dot. */
    String extension();

    /**
     * Path the artifact for {@code rawFile} is written to. Known before conversion so that
     * partial output can be cleaned up even when conversion fails.
     */
    default Path targetFor(Path rawFile) {
        String name = rawFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return rawFile.resolveSibling(base + "." + extension());
    }

    /**
     * Converts {@code rawFile} into {@link #targetFor(Path)}.
     *
     * @return the written artifact
     * @throws AudioConversionException if conversion fails
     */
    Path convert(Path rawFile);
}
