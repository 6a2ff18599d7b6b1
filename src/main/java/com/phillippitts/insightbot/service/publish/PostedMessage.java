package com.phillippitts.insightbot.service.publish;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a message on the report board, with its thread if one was opened.
 *
 * @param id          message id, unique per channel
 * @param text        message text
 * @param postedAt    when the message was posted
 * @param threadTitle title of the thread opened under the message, {@code null} if none
 * @param thread      messages sent to that thread, in order
 */
public record PostedMessage(long id, String text, Instant postedAt, String threadTitle, List<String> thread) {

    public PostedMessage {
        thread = thread == null ? List.of() : List.copyOf(thread);
    }

    public boolean hasThread() {
        return threadTitle != null;
    }
}
