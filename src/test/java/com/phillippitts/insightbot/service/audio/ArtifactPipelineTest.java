package com.phillippitts.insightbot.service.audio;

import com.phillippitts.insightbot.config.properties.SessionProperties;
import com.phillippitts.insightbot.domain.SpeakerId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ArtifactPipelineTest {

    private static final SpeakerId ALICE = SpeakerId.of("alice");
    private static final SpeakerId BOB = SpeakerId.of("bob");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T10:15:30.250Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private SessionProperties props;

    @BeforeEach
    void setUp() {
        props = new SessionProperties(tempDir.resolve("audio").toString(), 2000, 60,
                ChronoUnit.SECONDS, Duration.ofMinutes(1));
    }

    @Test
    void shouldConvertEachSpeakerIntoNamedArtifact() throws Exception {
        // Arrange
        ArtifactPipeline pipeline = new ArtifactPipeline(new WavAudioConverter(), props, CLOCK);
        Map<SpeakerId, byte[]> raw = new LinkedHashMap<>();
        raw.put(ALICE, new byte[400]);
        raw.put(BOB, new byte[800]);

        // Act
        try (ConvertedBatch batch = pipeline.convert("20250301_101500", raw)) {
            // Assert
            assertThat(batch.artifacts()).containsOnlyKeys(ALICE, BOB);
            Path alice = batch.artifacts().get(ALICE);
            assertThat(alice.getFileName().toString()).isEqualTo("20250301_101500_alice_20250301_101530_250.wav");
            assertThat(alice).exists();
            assertThat(Files.size(alice)).isEqualTo(WavWriter.HEADER_SIZE + 400L);
            assertThat(batch.cleanup()).hasSize(4);
        }
    }

    @Test
    void shouldDeleteEveryFileOnClose() throws Exception {
        // Arrange
        ArtifactPipeline pipeline = new ArtifactPipeline(new WavAudioConverter(), props, CLOCK);
        ConvertedBatch batch = pipeline.convert("s", Map.of(ALICE, new byte[400]));

        // Act
        batch.close();

        // Assert
        for (Path file : batch.cleanup()) {
            assertThat(Files.exists(file)).isFalse();
        }
    }

    @Test
    void shouldDropSpeakerWhoseConversionFailsButListItsFilesForCleanup() {
        // Arrange
        ArtifactPipeline pipeline = new ArtifactPipeline(new WavAudioConverter(), props, CLOCK);
        Map<SpeakerId, byte[]> raw = new LinkedHashMap<>();
        raw.put(ALICE, new byte[400]);
        raw.put(BOB, new byte[3]); // not frame aligned

        // Act
        try (ConvertedBatch batch = pipeline.convert("s", raw)) {
            // Assert
            assertThat(batch.artifacts()).containsOnlyKeys(ALICE);
            assertThat(batch.cleanup()).anyMatch(p -> p.getFileName().toString().startsWith("s_bob_")
                    && p.getFileName().toString().endsWith(".pcm"));
        }
    }

    @Test
    void shouldReturnEmptyBatchForNoAudio() {
        ArtifactPipeline pipeline = new ArtifactPipeline(new WavAudioConverter(), props, CLOCK);

        try (ConvertedBatch batch = pipeline.convert("s", Map.of())) {
            assertThat(batch.isEmpty()).isTrue();
            assertThat(batch.cleanup()).isEmpty();
        }
    }

    @Test
    void shouldMakeSpeakerIdsFileSafe() {
        assertThat(ArtifactPipeline.fileSafe("12345")).isEqualTo("12345");
        assertThat(ArtifactPipeline.fileSafe("a/b\\c:d e")).isEqualTo("a_b_c_d_e");
    }
}
