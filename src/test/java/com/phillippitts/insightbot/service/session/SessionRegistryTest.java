package com.phillippitts.insightbot.service.session;

import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.domain.SpeakerId;
import com.phillippitts.insightbot.testutil.FakeCaptureHandle;
import com.phillippitts.insightbot.testutil.RecordingPublishTarget;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SessionRegistryTest {

    private static final GuildId OTHER = GuildId.of("guild-2");

    @TempDir
    Path tempDir;

    private SessionTestFixture fixture;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        fixture = new SessionTestFixture(tempDir);
        fixture.interval(600_000);
        registry = new SessionRegistry(fixture.factory());
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
        fixture.close();
    }

    @Test
    void shouldReturnSameSessionForSameGuild() {
        GuildSession first = registry.getOrCreate(SessionTestFixture.GUILD);
        GuildSession second = registry.getOrCreate(SessionTestFixture.GUILD);

        assertThat(second).isSameAs(first);
        assertThat(registry.getOrCreate(OTHER)).isNotSameAs(first);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void shouldStopAndRemoveSession() {
        // Arrange
        GuildSession session = registry.getOrCreate(SessionTestFixture.GUILD);
        FakeCaptureHandle handle = new FakeCaptureHandle();
        session.start(handle, new RecordingPublishTarget(), "key");
        assertThat(registry.activeCount()).isEqualTo(1);

        // Act
        boolean removed = registry.remove(SessionTestFixture.GUILD, true);

        // Assert
        assertThat(removed).isTrue();
        assertThat(registry.find(SessionTestFixture.GUILD)).isEmpty();
        assertThat(registry.activeCount()).isZero();
        assertThat(handle.disconnectCallCount.get()).isEqualTo(1);
    }

    @Test
    void shouldRemoveIdleSessionAndReportNothingStopped() {
        registry.getOrCreate(SessionTestFixture.GUILD);

        assertThat(registry.remove(SessionTestFixture.GUILD, false)).isFalse();
        assertThat(registry.find(SessionTestFixture.GUILD)).isEmpty();
        assertThat(registry.remove(OTHER, false)).isFalse();
    }

    @Test
    void shouldReplaceRetiredSession() {
        // Arrange
        GuildSession retired = registry.getOrCreate(SessionTestFixture.GUILD);
        retired.stop(true);

        // Act
        GuildSession fresh = registry.getOrCreate(SessionTestFixture.GUILD);

        // Assert
        assertThat(fresh).isNotSameAs(retired);
        assertThat(fresh.isRetired()).isFalse();
    }

    @Test
    void shouldStopAllSessionsWithoutFinalCycleOnShutdown() {
        // Arrange
        FakeCaptureHandle first = new FakeCaptureHandle();
        FakeCaptureHandle second = new FakeCaptureHandle();
        registry.getOrCreate(SessionTestFixture.GUILD).start(first, new RecordingPublishTarget(), "key");
        registry.getOrCreate(OTHER).start(second, new RecordingPublishTarget(), "key");
        first.emit(SpeakerId.of("alice"), new byte[400]);

        // Act
        registry.shutdown();

        // Assert
        assertThat(registry.size()).isZero();
        assertThat(first.disconnectCallCount.get()).isEqualTo(1);
        assertThat(second.disconnectCallCount.get()).isEqualTo(1);
        assertThat(fixture.invoker.callCount()).isZero();
    }
}
