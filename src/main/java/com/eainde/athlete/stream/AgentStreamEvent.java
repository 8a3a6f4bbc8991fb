package com.eainde.athlete.stream;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One event of the client-facing stream. {@code data} is a string for text and status events,
 * a list for citations and discovered urls, and the referral for escalation.
 */
public record AgentStreamEvent(EventType type, Object data) {

    public enum EventType {
        STATUS("status"),
        TEXT_DELTA("text-delta"),
        CITATIONS("citations"),
        ESCALATION("escalation"),
        ANSWER_RESET("answer-reset"),
        DISCOVERED_URLS("discovered-urls"),
        ERROR("error"),
        DONE("done");

        private final String wireName;

        EventType(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }
    }

    public static AgentStreamEvent status(String label) {
        return new AgentStreamEvent(EventType.STATUS, label);
    }

    public static AgentStreamEvent textDelta(String text) {
        return new AgentStreamEvent(EventType.TEXT_DELTA, text);
    }

    public static AgentStreamEvent answerReset() {
        return new AgentStreamEvent(EventType.ANSWER_RESET, null);
    }

    public static AgentStreamEvent error(String message, String code) {
        return new AgentStreamEvent(EventType.ERROR, new ErrorPayload(message, code));
    }

    public static AgentStreamEvent done() {
        return new AgentStreamEvent(EventType.DONE, null);
    }
}
