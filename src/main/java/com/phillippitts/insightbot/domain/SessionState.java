package com.phillippitts.insightbot.domain;

/**
 * Lifecycle state of a guild session.
 *
 * <pre>
 * IDLE → CAPTURING   (start)
 * CAPTURING → STOPPING → IDLE (stop; the session is then retired and removed)
 * </pre>
 */
public enum SessionState {
    IDLE,
    CAPTURING,
    STOPPING
}
