package com.phillippitts.insightbot.service.publish;

/**
 * Text channel a session publishes notices and reports to.
 */
public interface PublishTarget {

    MessageHandle send(String text);

    ThreadHandle createThread(MessageHandle message, String title);
}
