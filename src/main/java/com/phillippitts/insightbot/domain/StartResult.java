package com.phillippitts.insightbot.domain;

/**
 * Result of asking a session to start capturing.
 */
public enum StartResult {
    STARTED,
    /** A capture handle is already attached, or a lifecycle transition is in progress. */
    ALREADY_CAPTURING,
    /** The session was stopped and retired; callers obtain a fresh one from the registry. */
    SESSION_CLOSED
}
