package com.phillippitts.insightbot.service.voice;

import com.phillippitts.insightbot.config.audio.AudioCaptureProperties;
import com.phillippitts.insightbot.domain.SpeakerId;
import com.phillippitts.insightbot.exception.TransportException;
import com.phillippitts.insightbot.service.audio.PcmFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Voice transport over Java Sound: the "channel" names a capture mixer ({@code default} uses
 * the system default line) and all audio is attributed to the configured local speaker.
 *
 * <p>Each {@link CaptureHandle} owns one open {@link TargetDataLine} and, while recording, one
 * daemon reader thread.
 */
@Component
public class JavaSoundVoiceGateway implements VoiceGateway {

    private static final Logger LOG = LogManager.getLogger(JavaSoundVoiceGateway.class);
    private static final long READER_JOIN_TIMEOUT_MS = 2_000;

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(AudioFormat format, Optional<String> mixerName) throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;

    @Autowired
    public JavaSoundVoiceGateway(AudioCaptureProperties props, ApplicationEventPublisher publisher) {
        this(props, publisher, defaultProvider());
    }

    // Package-private for tests
    JavaSoundVoiceGateway(AudioCaptureProperties props,
                          ApplicationEventPublisher publisher,
                          DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.provider = Objects.requireNonNull(provider);
    }

    private static DataLineProvider defaultProvider() {
        return (format, mixerName) -> {
            TargetDataLine line = null;
            if (mixerName.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(mixerName.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public CaptureHandle connect(String channel) {
        Optional<String> mixer = (channel == null || channel.isBlank() || "default".equalsIgnoreCase(channel))
                ? Optional.empty()
                : Optional.of(channel);
        try {
            TargetDataLine line = provider.open(PcmFormat.toJavaSound(), mixer);
            LOG.info("Capture line opened: channel='{}'", channel);
            return new LineHandle(channel, line);
        } catch (LineUnavailableException e) {
            publisher.publishEvent(new CaptureErrorEvent("LINE_UNAVAILABLE", channel, Instant.now()));
            throw new TransportException("Capture line unavailable", channel, e);
        } catch (SecurityException e) {
            publisher.publishEvent(new CaptureErrorEvent("PERMISSION_DENIED", channel, Instant.now()));
            throw new TransportException("Capture access denied", channel, e);
        } catch (IllegalArgumentException e) {
            publisher.publishEvent(new CaptureErrorEvent("FORMAT_UNSUPPORTED", channel, Instant.now()));
            throw new TransportException("Capture format unsupported", channel, e);
        }
    }

    private final class LineHandle implements CaptureHandle {
        private final String channel;
        private final TargetDataLine line;
        private final SpeakerId speaker = SpeakerId.of(props.getSpeakerId());
        private final AtomicBoolean connected = new AtomicBoolean(true);
        private final AtomicBoolean recording = new AtomicBoolean(false);
        private volatile Thread reader;

        LineHandle(String channel, TargetDataLine line) {
            this.channel = channel;
            this.line = line;
        }

        @Override
        public boolean isConnected() {
            return connected.get();
        }

        @Override
        public boolean isRecording() {
            return recording.get();
        }

        @Override
        public void startRecording(AudioSink sink) {
            Objects.requireNonNull(sink, "sink must not be null");
            if (!connected.get()) {
                throw new TransportException("Handle is disconnected", channel);
            }
            if (!recording.compareAndSet(false, true)) {
                throw new TransportException("Already recording", channel);
            }
            line.start();
            int bytesPerChunk = PcmFormat.bytesFor(props.getChunkMillis());
            Thread t = new Thread(() -> readLoop(sink, bytesPerChunk), "audio-capture-" + channel);
            t.setDaemon(true);
            reader = t;
            t.start();
        }

        private void readLoop(AudioSink sink, int bytesPerChunk) {
            byte[] buf = new byte[bytesPerChunk];
            long total = 0;
            try {
                while (recording.get()) {
                    int n = line.read(buf, 0, buf.length);
                    if (n <= 0) {
                        continue;
                    }
                    sink.onAudio(speaker, Arrays.copyOf(buf, n));
                    total += n;
                }
                LOG.info("Audio capture finished on '{}': {} bytes", channel, total);
            } catch (RuntimeException e) {
                LOG.warn("Capture failed on '{}': {}", channel, e.toString());
                recording.set(false);
                publisher.publishEvent(new CaptureErrorEvent("CAPTURE_ERROR", channel, Instant.now()));
            }
        }

        @Override
        public void stopRecording() {
            if (!recording.getAndSet(false)) {
                return;
            }
            try {
                line.stop();
            } catch (RuntimeException e) {
                LOG.debug("Ignoring error stopping line on '{}': {}", channel, e.getMessage());
            }
            joinReader();
        }

        @Override
        public void disconnect() {
            stopRecording();
            if (!connected.getAndSet(false)) {
                return;
            }
            try {
                line.close();
            } catch (RuntimeException e) {
                LOG.debug("Ignoring error closing line on '{}': {}", channel, e.getMessage());
            }
            LOG.info("Capture line closed: channel='{}'", channel);
        }

        private void joinReader() {
            Thread thread = reader;
            if (thread == null || !thread.isAlive() || thread == Thread.currentThread()) {
                return;
            }
            try {
                thread.join(READER_JOIN_TIMEOUT_MS);
                if (thread.isAlive()) {
                    LOG.warn("Capture thread did not terminate within {}ms", READER_JOIN_TIMEOUT_MS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for capture thread to terminate");
            }
        }
    }
}
