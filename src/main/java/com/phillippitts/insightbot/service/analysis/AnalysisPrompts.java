package com.phillippitts.insightbot.service.analysis;

import com.phillippitts.insightbot.domain.AnalysisMode;

/**
 * Instruction texts sent ahead of the audio.
 */
public final class AnalysisPrompts {

    /** Exact reply requested when the audio holds no meaningful conversation. */
    public static final String NO_NEW_DISCUSSION = "No new discussion took place.";

    static final String DEBATE = """
            You are a professional debate analyst and fact checker. Analyze the audio files provided, \
            one per participant and each introduced by the speaker's name, and write a report in the format below.

            Rules:
            1. Attribute every statement to the speaker whose file it came from.
            2. Use Google Search to verify every factual claim made in the discussion (figures, news, dates).
            3. Point out statements that contradict what a speaker said earlier.
            4. If the audio is silent, only noise, or contains no meaningful conversation, do not analyze it; \
            reply only with "%s" Do not invent content.
            5. The previous context is background only. Never include statements in the report that are not \
            present in the audio provided this time.

            Sections:
            [Summary]: (at most 300 characters)
            [Positions]: (speaker: for / against / neutral, and their main arguments)
            [Conflict structure]: (what is blocking agreement)
            [Points of contention, contradictions and fact check]: (contradictions and claims that current \
            information shows to be wrong)
            [Compromise proposals]: (proposals that could resolve the points of conflict)
            """.formatted(NO_NEW_DISCUSSION);

    static final String SUMMARY = """
            You are the minute taker of a meeting. Analyze the audio files provided, one per participant and \
            each introduced by the speaker's name, and write a friendly summary that lets someone joining late \
            understand where the discussion stands.

            Rules:
            1. Make clear who is talking about what.
            2. Add a short explanation for jargon and context-dependent terms.
            3. If the audio is silent, only noise, or contains no meaningful conversation, do not analyze it; \
            reply only with "%s"
            4. The previous context is background only. Never include statements in the report that are not \
            present in the audio provided this time.

            Sections:
            [Current topic]: (what is being discussed now, in a few lines)
            [Flow so far]: (main statements and decisions, in order, as bullet points)
            [Open issues]: (what is still undecided and what to discuss next)
            [Participants' key points]: (each participant's main claims)
            """.formatted(NO_NEW_DISCUSSION);

    private AnalysisPrompts() {}

    public static String forMode(AnalysisMode mode) {
        return switch (mode) {
            case DEBATE -> DEBATE;
            case SUMMARY -> SUMMARY;
        };
    }

    /** Preamble carrying the previous report's tail into the next request. */
    public static String contextPreamble(String context) {
        return "Previous context:\n" + context + "\n---\nCurrent discussion:";
    }

    public static String speakerLabel(String displayName) {
        return "Speaker: " + displayName;
    }
}
