package com.phillippitts.insightbot.service.audio;

import com.phillippitts.insightbot.config.audio.AudioConversionProperties;
import com.phillippitts.insightbot.exception.AudioConversionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FfmpegAudioConverterTest {

    @TempDir
    Path tempDir;

    private final AudioConversionProperties props = new AudioConversionProperties("mp3", "/opt/ffmpeg", 5);

    @Test
    void shouldBuildCommandForTransportFormat() {
        FfmpegAudioConverter converter = new FfmpegAudioConverter(props, (cmd, dir) -> mock(Process.class));
        Path raw = tempDir.resolve("a.pcm");

        List<String> command = converter.buildCommand(raw, converter.targetFor(raw));

        assertThat(command).startsWith("/opt/ffmpeg");
        assertThat(command).containsSubsequence("-f", "s16le", "-ar", "48000", "-ac", "2", "-i", raw.toString());
        assertThat(command.get(command.size() - 1)).endsWith("a.mp3");
    }

    @Test
    void shouldReturnTargetWhenFfmpegSucceeds() throws Exception {
        // Arrange
        Path raw = Files.write(tempDir.resolve("a.pcm"), new byte[400]);
        Process process = mock(Process.class);
        when(process.waitFor(anyLong(), eq(TimeUnit.SECONDS))).thenReturn(true);
        when(process.exitValue()).thenReturn(0);
        List<List<String>> commands = new ArrayList<>();
        FfmpegAudioConverter converter = new FfmpegAudioConverter(props, (cmd, dir) -> {
            commands.add(cmd);
            Files.write(Path.of(cmd.get(cmd.size() - 1)), new byte[]{1});
            return process;
        });

        // Act
        Path artifact = converter.convert(raw);

        // Assert
        assertThat(artifact).isEqualTo(tempDir.resolve("a.mp3")).exists();
        assertThat(commands).hasSize(1);
    }

    @Test
    void shouldFailOnNonZeroExit() throws Exception {
        Path raw = Files.write(tempDir.resolve("a.pcm"), new byte[400]);
        Process process = mock(Process.class);
        when(process.waitFor(anyLong(), eq(TimeUnit.SECONDS))).thenReturn(true);
        when(process.exitValue()).thenReturn(1);
        FfmpegAudioConverter converter = new FfmpegAudioConverter(props, (cmd, dir) -> process);

        assertThatThrownBy(() -> converter.convert(raw))
                .isInstanceOf(AudioConversionException.class)
                .hasMessageContaining("exited with code 1");
    }

    @Test
    void shouldKillProcessOnTimeout() throws Exception {
        Path raw = Files.write(tempDir.resolve("a.pcm"), new byte[400]);
        Process process = mock(Process.class);
        when(process.waitFor(anyLong(), eq(TimeUnit.SECONDS))).thenReturn(false);
        FfmpegAudioConverter converter = new FfmpegAudioConverter(props, (cmd, dir) -> process);

        assertThatThrownBy(() -> converter.convert(raw))
                .isInstanceOf(AudioConversionException.class)
                .hasMessageContaining("timed out");
        verify(process).destroyForcibly();
    }

    @Test
    void shouldFailWhenFfmpegCannotStart() throws Exception {
        Path raw = Files.write(tempDir.resolve("a.pcm"), new byte[400]);
        FfmpegAudioConverter converter = new FfmpegAudioConverter(props, (cmd, dir) -> {
            throw new IOException("No such file");
        });

        assertThatThrownBy(() -> converter.convert(raw))
                .isInstanceOf(AudioConversionException.class)
                .hasMessageContaining("Failed to start ffmpeg");
    }

    @Test
    void shouldFailWhenNoOutputWasWritten() throws Exception {
        Path raw = Files.write(tempDir.resolve("a.pcm"), new byte[400]);
        Process process = mock(Process.class);
        when(process.waitFor(anyLong(), eq(TimeUnit.SECONDS))).thenReturn(true);
        when(process.exitValue()).thenReturn(0);
        FfmpegAudioConverter converter = new FfmpegAudioConverter(props, (cmd, dir) -> process);

        assertThatThrownBy(() -> converter.convert(raw))
                .isInstanceOf(AudioConversionException.class)
                .hasMessageContaining("no output");
    }
}
