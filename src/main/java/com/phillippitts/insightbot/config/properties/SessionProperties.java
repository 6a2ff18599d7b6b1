package com.phillippitts.insightbot.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Typed properties for the session engine.
 *
 * <p>Example application.properties:
 * <pre>
 * session.temp-dir=temp_audio
 * session.context-max-chars=2000
 * session.countdown-step=60
 * session.interval-unit=seconds
 * session.stop-await-timeout=PT10M
 * </pre>
 *
 * <p>Guild intervals and the countdown step are counted in {@code interval-unit}. Production
 * uses seconds; tests shrink the unit to milliseconds to exercise real timing quickly.
 */
@Validated
@ConfigurationProperties(prefix = "session")
public class SessionProperties {

    /** Directory for raw and converted per-speaker audio files. */
    private final Path tempDir;

    /** Number of trailing report characters kept as context for the next cycle. */
    @Min(0)
    @Max(100_000)
    private final int contextMaxChars;

    /** Countdown refresh step while waiting for the next cycle, in interval units. */
    @Min(1)
    private final int countdownStep;

    /** Unit in which guild intervals and the countdown step are expressed. */
    private final ChronoUnit intervalUnit;

    /** Upper bound on waiting for a session loop to finish its in-flight cycle at stop. */
    private final Duration stopAwaitTimeout;

    @ConstructorBinding
    public SessionProperties(String tempDir,
                             @NotNull Integer contextMaxChars,
                             @NotNull Integer countdownStep,
                             ChronoUnit intervalUnit,
                             Duration stopAwaitTimeout) {
        this.tempDir = Path.of(tempDir == null || tempDir.isBlank() ? "temp_audio" : tempDir);
        this.contextMaxChars = contextMaxChars;
        this.countdownStep = countdownStep;
        this.intervalUnit = intervalUnit == null ? ChronoUnit.SECONDS : intervalUnit;
        this.stopAwaitTimeout = stopAwaitTimeout == null ? Duration.ofMinutes(10) : stopAwaitTimeout;
    }

    public Path getTempDir() { return tempDir; }
    public int getContextMaxChars() { return contextMaxChars; }
    public int getCountdownStep() { return countdownStep; }
    public ChronoUnit getIntervalUnit() { return intervalUnit; }
    public Duration getStopAwaitTimeout() { return stopAwaitTimeout; }

    /** Converts an amount of interval units into a duration; amounts below one are raised to one. */
    public Duration toDuration(int amount) {
        return intervalUnit.getDuration().multipliedBy(Math.max(1, amount));
    }
}
