package com.eainde.athlete.workflow;

import com.eainde.athlete.state.ConversationMessage;

import java.util.List;

/**
 * A question plus optional conversation context.
 *
 * @param message        the user's question
 * @param conversationId groups turns for summary memory, may be null
 * @param history        earlier turns, oldest first, may be null
 * @param userSport      the athlete's sport when known, may be null
 */
public record AgentRequest(String message, String conversationId, List<ConversationMessage> history,
                           String userSport) {

    public static AgentRequest of(String message) {
        return new AgentRequest(message, null, List.of(), null);
    }

    public List<ConversationMessage> historyOrEmpty() {
        return history == null ? List.of() : history;
    }
}
