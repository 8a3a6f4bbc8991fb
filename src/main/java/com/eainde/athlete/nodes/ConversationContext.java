package com.eainde.athlete.nodes;

import com.eainde.athlete.state.ConversationMessage;

import java.util.List;

/**
 * Helpers that turn conversation history into prompt and query text.
 */
public final class ConversationContext {

    static final int HISTORY_TURNS = 6;

    private ConversationContext() {
    }

    /** The last few turns before the current question, one {@code role: content} line each. */
    public static String formatHistory(List<ConversationMessage> messages) {
        if (messages.size() <= 1) {
            return "";
        }
        List<ConversationMessage> previous = messages.subList(0, messages.size() - 1);
        int from = Math.max(0, previous.size() - HISTORY_TURNS);
        StringBuilder history = new StringBuilder();
        for (ConversationMessage message : previous.subList(from, previous.size())) {
            history.append(message.role().value()).append(": ").append(message.content()).append('\n');
        }
        return history.toString().trim();
    }

    /**
     * The current question enriched with up to {@code charLimit} characters of the preceding user
     * turns, so follow-ups like "what about the deadline?" still retrieve the right documents.
     */
    public static String contextualQuery(String question, List<ConversationMessage> messages, int charLimit) {
        StringBuilder context = new StringBuilder();
        for (int i = messages.size() - 2; i >= 0 && context.length() < charLimit; i--) {
            ConversationMessage message = messages.get(i);
            if (message.role() == ConversationMessage.Role.USER && message.content() != null) {
                context.insert(0, message.content() + " ");
            }
        }
        if (context.length() == 0) {
            return question;
        }
        String terms = context.toString().trim();
        if (terms.length() > charLimit) {
            terms = terms.substring(terms.length() - charLimit);
        }
        return question + " " + terms;
    }
}
