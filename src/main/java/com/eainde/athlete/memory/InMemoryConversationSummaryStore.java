package com.eainde.athlete.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryConversationSummaryStore implements ConversationSummaryStore {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryConversationSummaryStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String conversationId) {
        Entry entry = entries.get(conversationId);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(conversationId, entry);
            return Optional.empty();
        }
        return Optional.of(entry.summary());
    }

    @Override
    public void upsert(String conversationId, String summary, Duration ttl) {
        entries.put(conversationId, new Entry(summary, clock.instant().plus(ttl)));
    }

    private record Entry(String summary, Instant expiresAt) {
    }
}
