package com.phillippitts.insightbot.service.publish;

import com.phillippitts.insightbot.domain.CycleOutcome;
import com.phillippitts.insightbot.domain.CycleTrigger;
import com.phillippitts.insightbot.domain.GuildSettings;
import com.phillippitts.insightbot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Renders reports and notices and posts them to a {@link PublishTarget}.
 *
 * <p>A successful report is posted as a starter message plus a fresh thread holding the
 * header and the report chunks. Notices are single channel messages without a thread.
 */
@Component
public class ReportPublisher {

    private static final Logger LOG = LogManager.getLogger(ReportPublisher.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final int MAX_DETAIL_CHARS = 200;

    static final String REPORT_HEADER = "📊 **Discussion report**\n";
    static final String FINAL_HEADER = "🏁 **Final report**\n";

    private final Clock clock;

    public ReportPublisher(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Posts a report: starter message, new thread, then the header and body chunks.
     *
     * @return number of messages sent to the thread
     */
    public int publishReport(PublishTarget target, CycleTrigger trigger, String report) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(trigger, "trigger must not be null");
        String stamp = LocalDateTime.now(clock).format(STAMP);

        MessageHandle starter = target.send(starterText(trigger, stamp));
        String title = trigger.isFinal() ? "Discussion report (final) " + stamp : "Discussion report " + stamp;
        ThreadHandle thread = target.createThread(starter, title);

        String header = trigger.isFinal() ? FINAL_HEADER : REPORT_HEADER;
        List<String> chunks = ReportFormatter.split(header, report);
        for (String chunk : chunks) {
            thread.send(chunk);
        }
        LOG.debug("Report published: thread='{}', messages={}, chars={}", title, chunks.size(), report.length());
        return chunks.size();
    }

    /**
     * Posts the notice for a cycle that produced no report.
     *
     * @param detail failure detail, only shown for generic failures
     */
    public void publishNotice(PublishTarget target, CycleOutcome outcome, String detail) {
        Objects.requireNonNull(target, "target must not be null");
        String notice = noticeFor(outcome, detail);
        if (notice != null) {
            target.send(notice);
        }
    }

    /** Privacy notice posted when capture starts. */
    public void publishStarted(PublishTarget target, GuildSettings settings) {
        Objects.requireNonNull(target, "target must not be null");
        target.send("🎙️ **Recording started.** Voice in this channel is captured and sent to an AI service "
                + "for analysis. Mode: `" + settings.mode().value() + "`, reports every "
                + settings.intervalSeconds() + " seconds.");
    }

    static String noticeFor(CycleOutcome outcome, String detail) {
        return switch (outcome) {
            case NO_AUDIO -> "🔇 No audio was captured during this session.";
            case NO_CREDENTIAL -> "🔑 No API key is configured. Set one in the guild settings to enable analysis.";
            case RATE_LIMITED -> "⏳ Analysis skipped: the API rate limit was reached. The next cycle will try again.";
            case UPLOAD_FAILED -> "⚠️ Analysis skipped: the recorded audio could not be uploaded.";
            case EMPTY_REPORT -> "ℹ️ The analysis returned no content for this period.";
            case FAILED -> "⚠️ Analysis failed: "
                    + (detail == null || detail.isBlank() ? "unknown error" : LogSanitizer.truncate(detail, MAX_DETAIL_CHARS));
            case SKIPPED, NO_ARTIFACTS, REPORTED -> null;
        };
    }

    private static String starterText(CycleTrigger trigger, String stamp) {
        return switch (trigger) {
            case SCHEDULED -> "📅 **Scheduled analysis** (" + stamp + ")";
            case MANUAL -> "🔎 **Manual analysis** (" + stamp + ")";
            case FINAL -> "🛑 **Session ended** (" + stamp + ")";
        };
    }
}
