package com.eainde.athlete.memory;

import java.time.Duration;
import java.util.Optional;

/**
 * Rolling summary of a conversation, keyed by conversation id. Later writes replace earlier
 * ones; entries expire after their time to live.
 */
public interface ConversationSummaryStore {

    Optional<String> get(String conversationId);

    void upsert(String conversationId, String summary, Duration ttl);
}
