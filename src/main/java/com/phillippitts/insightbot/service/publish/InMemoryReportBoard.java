package com.phillippitts.insightbot.service.publish;

import com.phillippitts.insightbot.domain.GuildId;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process report board: every guild channel keeps its most recent messages and the threads
 * opened under them, readable through the report endpoint.
 */
@Component
public class InMemoryReportBoard implements ReportChannels {

    static final int MAX_MESSAGES_PER_CHANNEL = 200;

    private final Map<String, Channel> channels = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryReportBoard(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public PublishTarget open(GuildId guildId, String channelId) {
        Objects.requireNonNull(guildId, "guildId must not be null");
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalArgumentException("channelId must not be blank");
        }
        return channels.computeIfAbsent(key(guildId, channelId), k -> new Channel(channelId));
    }

    /** Messages posted to a channel, oldest first; empty when the channel was never used. */
    public List<PostedMessage> messages(GuildId guildId, String channelId) {
        Channel channel = channels.get(key(guildId, channelId));
        return channel == null ? List.of() : channel.snapshot();
    }

    private static String key(GuildId guildId, String channelId) {
        return guildId.value() + '/' + channelId;
    }

    private final class Channel implements PublishTarget {
        private final String channelId;
        private final Deque<Entry> entries = new ArrayDeque<>();
        private long nextId = 1;

        Channel(String channelId) {
            this.channelId = channelId;
        }

        @Override
        public synchronized MessageHandle send(String text) {
            Objects.requireNonNull(text, "text must not be null");
            Entry entry = new Entry(nextId++, text, clock.instant());
            entries.addLast(entry);
            while (entries.size() > MAX_MESSAGES_PER_CHANNEL) {
                entries.removeFirst();
            }
            return new MessageHandle(channelId, entry.id);
        }

        @Override
        public synchronized ThreadHandle createThread(MessageHandle message, String title) {
            Objects.requireNonNull(message, "message must not be null");
            if (!channelId.equals(message.channelId())) {
                throw new IllegalArgumentException("Message " + message.messageId() + " is not in channel " + channelId);
            }
            Entry entry = find(message.messageId());
            if (entry == null) {
                throw new IllegalArgumentException("Unknown message " + message.messageId());
            }
            if (entry.threadTitle != null) {
                throw new IllegalStateException("Message " + message.messageId() + " already has a thread");
            }
            entry.threadTitle = title;
            return new ThreadHandle() {
                @Override
                public String title() {
                    return title;
                }

                @Override
                public void send(String text) {
                    Objects.requireNonNull(text, "text must not be null");
                    synchronized (Channel.this) {
                        entry.thread.add(text);
                    }
                }
            };
        }

        private Entry find(long id) {
            for (Entry e : entries) {
                if (e.id == id) {
                    return e;
                }
            }
            return null;
        }

        synchronized List<PostedMessage> snapshot() {
            List<PostedMessage> result = new ArrayList<>(entries.size());
            for (Entry e : entries) {
                result.add(new PostedMessage(e.id, e.text, e.postedAt, e.threadTitle, e.thread));
            }
            return result;
        }
    }

    private static final class Entry {
        final long id;
        final String text;
        final Instant postedAt;
        final List<String> thread = new ArrayList<>();
        String threadTitle;

        Entry(long id, String text, Instant postedAt) {
            this.id = id;
            this.text = text;
            this.postedAt = postedAt;
        }
    }
}
