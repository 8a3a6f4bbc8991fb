package com.eainde.athlete.state;

import com.eainde.athlete.graph.ActiveRuns;
import org.bsc.langgraph4j.state.AgentState;

import java.util.List;
import java.util.Map;

/**
 * State of one question-answering run. Nodes read it through the typed getters and return
 * patches keyed by the constants below.
 */
public class RunState extends AgentState {

    public static final String RUN_ID = ActiveRuns.RUN_ID;

    public static final String MESSAGES = "messages";
    public static final String CONVERSATION_ID = "conversationId";
    public static final String CONVERSATION_SUMMARY = "conversationSummary";
    public static final String USER_SPORT = "userSport";

    public static final String TOPIC_DOMAIN = "topicDomain";
    public static final String DETECTED_ORG_IDS = "detectedOrgIds";
    public static final String QUERY_INTENT = "queryIntent";
    public static final String HAS_TIME_CONSTRAINT = "hasTimeConstraint";
    public static final String ESCALATION_REASON = "escalationReason";
    public static final String ESCALATION_CATEGORY = "escalationCategory";
    public static final String NEEDS_CLARIFICATION = "needsClarification";
    public static final String CLARIFICATION_QUESTION = "clarificationQuestion";
    public static final String EMOTIONAL_STATE = "emotionalState";

    public static final String IS_COMPLEX_QUERY = "isComplexQuery";
    public static final String SUB_QUERIES = "subQueries";

    public static final String RETRIEVED_DOCUMENTS = "retrievedDocuments";
    public static final String RETRIEVAL_CONFIDENCE = "retrievalConfidence";
    public static final String RETRIEVAL_STATUS = "retrievalStatus";
    public static final String EXPANSION_ATTEMPTED = "expansionAttempted";
    public static final String REFORMULATED_QUERIES = "reformulatedQueries";

    public static final String WEB_SEARCH_RESULTS = "webSearchResults";
    public static final String WEB_SEARCH_RESULT_URLS = "webSearchResultUrls";

    public static final String ANSWER = "answer";
    public static final String DISCLAIMER_REQUIRED = "disclaimerRequired";
    public static final String DISCLAIMER = "disclaimer";
    public static final String CITATIONS = "citations";
    public static final String ESCALATION = "escalation";
    public static final String QUALITY_CHECK_RESULT = "qualityCheckResult";
    public static final String QUALITY_RETRY_COUNT = "qualityRetryCount";

    public RunState(Map<String, Object> data) {
        super(data);
    }

    public String getRunId() {
        return (String) data().get(RUN_ID);
    }

    public List<ConversationMessage> getMessages() {
        return list(MESSAGES);
    }

    /** Content of the most recent user message, empty when there is none. */
    public String getCurrentQuestion() {
        List<ConversationMessage> messages = getMessages();
        for (int i = messages.size() - 1; i >= 0; i--) {
            ConversationMessage message = messages.get(i);
            if (message.role() == ConversationMessage.Role.USER) {
                return message.content() == null ? "" : message.content();
            }
        }
        return "";
    }

    public String getConversationId() {
        return (String) data().get(CONVERSATION_ID);
    }

    public String getConversationSummary() {
        return (String) data().get(CONVERSATION_SUMMARY);
    }

    public String getUserSport() {
        return (String) data().get(USER_SPORT);
    }

    public TopicDomain getTopicDomain() {
        return (TopicDomain) data().get(TOPIC_DOMAIN);
    }

    public List<String> getDetectedOrgIds() {
        return list(DETECTED_ORG_IDS);
    }

    public QueryIntent getQueryIntent() {
        return (QueryIntent) data().getOrDefault(QUERY_INTENT, QueryIntent.GENERAL);
    }

    public boolean hasTimeConstraint() {
        return flag(HAS_TIME_CONSTRAINT);
    }

    public String getEscalationReason() {
        return (String) data().get(ESCALATION_REASON);
    }

    public EscalationCategory getEscalationCategory() {
        return (EscalationCategory) data().get(ESCALATION_CATEGORY);
    }

    public boolean needsClarification() {
        return flag(NEEDS_CLARIFICATION);
    }

    public String getClarificationQuestion() {
        return (String) data().get(CLARIFICATION_QUESTION);
    }

    public EmotionalState getEmotionalState() {
        return (EmotionalState) data().getOrDefault(EMOTIONAL_STATE, EmotionalState.NEUTRAL);
    }

    public boolean isComplexQuery() {
        return flag(IS_COMPLEX_QUERY);
    }

    public List<SubQuery> getSubQueries() {
        return list(SUB_QUERIES);
    }

    public List<RetrievedDocument> getRetrievedDocuments() {
        return list(RETRIEVED_DOCUMENTS);
    }

    public double getRetrievalConfidence() {
        Object value = data().get(RETRIEVAL_CONFIDENCE);
        return value == null ? 0.0 : ((Number) value).doubleValue();
    }

    public RetrievalStatus getRetrievalStatus() {
        return (RetrievalStatus) data().get(RETRIEVAL_STATUS);
    }

    public boolean isExpansionAttempted() {
        return flag(EXPANSION_ATTEMPTED);
    }

    public List<String> getReformulatedQueries() {
        return list(REFORMULATED_QUERIES);
    }

    public List<String> getWebSearchResults() {
        return list(WEB_SEARCH_RESULTS);
    }

    public List<WebSearchResult> getWebSearchResultUrls() {
        return list(WEB_SEARCH_RESULT_URLS);
    }

    public String getAnswer() {
        return (String) data().get(ANSWER);
    }

    /** Defaults to true; only answers that already point to a human opt out. */
    public boolean isDisclaimerRequired() {
        Object value = data().get(DISCLAIMER_REQUIRED);
        return value == null || (Boolean) value;
    }

    public String getDisclaimer() {
        return (String) data().get(DISCLAIMER);
    }

    public List<Citation> getCitations() {
        return list(CITATIONS);
    }

    public EscalationInfo getEscalation() {
        return (EscalationInfo) data().get(ESCALATION);
    }

    public QualityCheckResult getQualityCheckResult() {
        return (QualityCheckResult) data().get(QUALITY_CHECK_RESULT);
    }

    public int getQualityRetryCount() {
        Object value = data().get(QUALITY_RETRY_COUNT);
        return value == null ? 0 : ((Number) value).intValue();
    }

    private boolean flag(String key) {
        return Boolean.TRUE.equals(data().get(key));
    }

    @SuppressWarnings("unchecked")
    private <T> List<T> list(String key) {
        Object value = data().get(key);
        return value == null ? List.of() : (List<T>) value;
    }
}
