package com.phillippitts.insightbot.service.voice;

import com.phillippitts.insightbot.config.audio.AudioCaptureProperties;
import com.phillippitts.insightbot.domain.SpeakerId;
import com.phillippitts.insightbot.exception.TransportException;
import com.phillippitts.insightbot.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.Test;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.Control;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.Line;
import javax.sound.sampled.LineListener;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.TargetDataLine;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class JavaSoundVoiceGatewayTest {

    private final AudioCaptureProperties props = new AudioCaptureProperties(20, "host", "Host");
    private final EventCapturingPublisher events = new EventCapturingPublisher();

    @Test
    void shouldDeliverChunksAttributedToLocalSpeaker() {
        // Arrange
        AtomicReference<Optional<String>> requestedMixer = new AtomicReference<>();
        JavaSoundVoiceGateway gateway = new JavaSoundVoiceGateway(props, events, (fmt, mixer) -> {
            requestedMixer.set(mixer);
            return new RepeatingTargetDataLine(fmt);
        });
        Set<SpeakerId> speakers = ConcurrentHashMap.newKeySet();
        AtomicInteger bytes = new AtomicInteger();

        // Act
        CaptureHandle handle = gateway.connect("default");
        handle.startRecording((speaker, chunk) -> {
            speakers.add(speaker);
            bytes.addAndGet(chunk.length);
        });
        await().atMost(Duration.ofSeconds(2)).until(() -> bytes.get() > 0);
        handle.stopRecording();

        // Assert
        assertThat(requestedMixer.get()).isEmpty();
        assertThat(speakers).containsExactly(SpeakerId.of("host"));
        assertThat(bytes.get() % 2).isZero();
        assertThat(handle.isRecording()).isFalse();
        assertThat(handle.isConnected()).isTrue();
        assertThat(events.all()).isEmpty();
    }

    @Test
    void shouldOpenNamedMixerForNonDefaultChannel() {
        AtomicReference<Optional<String>> requestedMixer = new AtomicReference<>();
        JavaSoundVoiceGateway gateway = new JavaSoundVoiceGateway(props, events, (fmt, mixer) -> {
            requestedMixer.set(mixer);
            return new RepeatingTargetDataLine(fmt);
        });

        gateway.connect("USB Mic").disconnect();

        assertThat(requestedMixer.get()).contains("USB Mic");
    }

    @Test
    void shouldStopDeliveringAfterStopRecording() throws InterruptedException {
        // Arrange
        JavaSoundVoiceGateway gateway = new JavaSoundVoiceGateway(props, events, (fmt, mixer) -> new RepeatingTargetDataLine(fmt));
        AtomicInteger chunks = new AtomicInteger();
        CaptureHandle handle = gateway.connect("default");
        handle.startRecording((speaker, chunk) -> chunks.incrementAndGet());
        await().atMost(Duration.ofSeconds(2)).until(() -> chunks.get() > 0);

        // Act
        handle.stopRecording();
        int afterStop = chunks.get();
        Thread.sleep(100);

        // Assert
        assertThat(chunks.get()).isEqualTo(afterStop);
    }

    @Test
    void shouldCloseLineOnDisconnectAndTolerateRepeatedCalls() {
        // Arrange
        RepeatingTargetDataLine[] opened = new RepeatingTargetDataLine[1];
        JavaSoundVoiceGateway gateway = new JavaSoundVoiceGateway(props, events, (fmt, mixer) -> {
            opened[0] = new RepeatingTargetDataLine(fmt);
            return opened[0];
        });
        CaptureHandle handle = gateway.connect("default");
        handle.startRecording((speaker, chunk) -> { });

        // Act
        handle.disconnect();
        handle.disconnect();
        handle.stopRecording();

        // Assert
        assertThat(opened[0].isOpen()).isFalse();
        assertThat(handle.isConnected()).isFalse();
        assertThatThrownBy(() -> handle.startRecording((speaker, chunk) -> { }))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("disconnected");
    }

    @Test
    void shouldRejectSecondStartRecording() {
        JavaSoundVoiceGateway gateway = new JavaSoundVoiceGateway(props, events, (fmt, mixer) -> new RepeatingTargetDataLine(fmt));
        CaptureHandle handle = gateway.connect("default");
        handle.startRecording((speaker, chunk) -> { });

        try {
            assertThatThrownBy(() -> handle.startRecording((speaker, chunk) -> { }))
                    .isInstanceOf(TransportException.class)
                    .hasMessageContaining("Already recording");
        } finally {
            handle.disconnect();
        }
    }

    @Test
    void shouldPublishEventAndThrowWhenLineUnavailable() {
        JavaSoundVoiceGateway gateway = new JavaSoundVoiceGateway(props, events, (fmt, mixer) -> {
            throw new LineUnavailableException("No audio device available");
        });

        assertThatThrownBy(() -> gateway.connect("default"))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("unavailable");
        assertThat(events.eventsOfType(CaptureErrorEvent.class))
                .extracting(CaptureErrorEvent::reason)
                .containsExactly("LINE_UNAVAILABLE");
    }

    @Test
    void shouldPublishEventWhenPermissionDenied() {
        JavaSoundVoiceGateway gateway = new JavaSoundVoiceGateway(props, events, (fmt, mixer) -> {
            throw new SecurityException("Microphone access denied");
        });

        assertThatThrownBy(() -> gateway.connect("default")).isInstanceOf(TransportException.class);
        assertThat(events.eventsOfType(CaptureErrorEvent.class))
                .extracting(CaptureErrorEvent::reason)
                .containsExactly("PERMISSION_DENIED");
    }

    @Test
    void shouldPublishEventWhenReadFails() {
        // Arrange
        JavaSoundVoiceGateway gateway = new JavaSoundVoiceGateway(props, events, (fmt, mixer) -> new RepeatingTargetDataLine(fmt) {
            @Override
            public int read(byte[] b, int off, int len) {
                throw new IllegalStateException("device unplugged");
            }
        });
        CaptureHandle handle = gateway.connect("default");

        // Act
        handle.startRecording((speaker, chunk) -> { });

        // Assert
        await().atMost(Duration.ofSeconds(2)).until(() -> !handle.isRecording());
        assertThat(events.eventsOfType(CaptureErrorEvent.class))
                .extracting(CaptureErrorEvent::reason)
                .containsExactly("CAPTURE_ERROR");
        handle.disconnect();
    }

    // --- Test doubles ---
    static class RepeatingTargetDataLine implements TargetDataLine {
        private final AudioFormat fmt;
        private final byte[] pattern = new byte[320];
        private volatile boolean started;
        private volatile boolean open = true;

        RepeatingTargetDataLine(AudioFormat fmt) {
            this.fmt = fmt;
            for (int i = 0; i < pattern.length; i++) {
                pattern[i] = (byte) (i & 0xFF);
            }
        }

        @Override public AudioFormat getFormat() {
            return fmt;
        }
        @Override public void open(AudioFormat format, int bufferSize) {
            open = true;
        }
        @Override public void open(AudioFormat format) {
            open = true;
        }
        @Override public int read(byte[] b, int off, int len) {
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return 0;
            }
            if (!started || !open) {
                return 0;
            }
            int n = Math.min(len, pattern.length);
            System.arraycopy(pattern, 0, b, off, n);
            return n;
        }
        @Override public void start() {
            started = true;
        }
        @Override public void stop() {
            started = false;
        }
        @Override public void close() {
            open = false;
        }
        @Override public boolean isOpen() {
            return open;
        }
        @Override public int available() {
            return 0;
        }
        @Override public void drain() {
        }
        @Override public void flush() {
        }
        @Override public int getBufferSize() {
            return 0;
        }
        @Override public int getFramePosition() {
            return 0;
        }
        @Override public float getLevel() {
            return 0;
        }
        @Override public long getLongFramePosition() {
            return 0;
        }
        @Override public long getMicrosecondPosition() {
            return 0;
        }
        @Override public Control getControl(Control.Type control) {
            throw new IllegalArgumentException();
        }
        @Override public Control[] getControls() {
            return new Control[0];
        }
        @Override public boolean isControlSupported(Control.Type control) {
            return false;
        }
        @Override public void addLineListener(LineListener listener) {
        }
        @Override public void removeLineListener(LineListener listener) {
        }
        @Override public Line.Info getLineInfo() {
            return new DataLine.Info(TargetDataLine.class, fmt);
        }
        @Override public void open() {
            open = true;
        }
        @Override public boolean isActive() {
            return started;
        }
        @Override public boolean isRunning() {
            return started;
        }
    }
}
