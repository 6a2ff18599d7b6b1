package com.phillippitts.insightbot.service.audio;

import com.phillippitts.insightbot.domain.SpeakerId;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class AudioAccumulatorTest {

    private static final SpeakerId ALICE = SpeakerId.of("alice");
    private static final SpeakerId BOB = SpeakerId.of("bob");

    @Test
    void shouldReturnEmptyMapWhenNothingBuffered() {
        AudioAccumulator accumulator = new AudioAccumulator();

        assertThat(accumulator.flush()).isEmpty();
        assertThat(accumulator.bufferedBytes()).isZero();
    }

    @Test
    void shouldKeepChunkOrderPerSpeaker() {
        // Arrange
        AudioAccumulator accumulator = new AudioAccumulator();
        accumulator.append(ALICE, new byte[]{1, 2});
        accumulator.append(BOB, new byte[]{9});
        accumulator.append(ALICE, new byte[]{3});

        // Act
        Map<SpeakerId, byte[]> flushed = accumulator.flush();

        // Assert
        assertThat(flushed.get(ALICE)).containsExactly(1, 2, 3);
        assertThat(flushed.get(BOB)).containsExactly(9);
    }

    @Test
    void shouldResetAfterFlush() {
        AudioAccumulator accumulator = new AudioAccumulator();
        accumulator.append(ALICE, new byte[]{1});

        accumulator.flush();

        assertThat(accumulator.flush()).isEmpty();
        assertThat(accumulator.bufferedBytes()).isZero();
    }

    @Test
    void shouldIgnoreEmptyChunks() {
        AudioAccumulator accumulator = new AudioAccumulator();

        accumulator.append(ALICE, new byte[0]);
        accumulator.append(BOB, null);

        assertThat(accumulator.flush()).isEmpty();
    }

    @Test
    void shouldReportBufferedBytesAcrossSpeakers() {
        AudioAccumulator accumulator = new AudioAccumulator();
        accumulator.append(ALICE, new byte[10]);
        accumulator.append(BOB, new byte[6]);

        assertThat(accumulator.bufferedBytes()).isEqualTo(16);
    }

    @Test
    void shouldNeitherLoseNorDuplicateChunksUnderConcurrentFlush() throws InterruptedException {
        // Arrange
        AudioAccumulator accumulator = new AudioAccumulator();
        int writers = 4;
        int chunksPerWriter = 2_000;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch done = new CountDownLatch(writers);
        AtomicLong flushedBytes = new AtomicLong();

        // Act
        for (int w = 0; w < writers; w++) {
            SpeakerId speaker = SpeakerId.of("speaker-" + w);
            pool.execute(() -> {
                for (int i = 0; i < chunksPerWriter; i++) {
                    accumulator.append(speaker, new byte[4]);
                }
                done.countDown();
            });
        }
        while (done.getCount() > 0) {
            accumulator.flush().values().forEach(b -> flushedBytes.addAndGet(b.length));
        }
        accumulator.flush().values().forEach(b -> flushedBytes.addAndGet(b.length));
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        // Assert
        assertThat(flushedBytes.get()).isEqualTo((long) writers * chunksPerWriter * 4);
    }
}
