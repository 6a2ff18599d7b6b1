package com.phillippitts.insightbot.service.publish;

/**
 * A thread opened under a posted message.
 */
public interface ThreadHandle {

    String title();

    void send(String text);
}
